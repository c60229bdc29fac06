package org.themecheck.checks;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The offenses of one completed check run.
 *
 * @param filesChecked   Number of files handed to the checks.
 * @param offensesByFile File URI to ordered offenses, in the order the files produced their first offense.
 */
public record CheckRunResult(int filesChecked, Map<String, List<Offense>> offensesByFile) {

    public CheckRunResult {
        offensesByFile = Collections.unmodifiableMap(new LinkedHashMap<>(offensesByFile));
    }

    /**
     * @return The ordered offenses of one file, empty if it has none.
     */
    public List<Offense> offensesFor(String fileUri) {
        return offensesByFile.getOrDefault(fileUri, List.of());
    }

    /**
     * @return All offenses, grouped by file.
     */
    public List<Offense> offenses() {
        List<Offense> all = new ArrayList<>();
        offensesByFile.values().forEach(all::addAll);
        return all;
    }

    public int offenseCount() {
        return offensesByFile.values().stream().mapToInt(List::size).sum();
    }
}
