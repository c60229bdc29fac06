package org.themecheck.checks;

import org.themecheck.frontend.parser.ast.Position;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.ToIntFunction;

/**
 * Collects the offenses of one run.
 *
 * <p>Offenses identical in check code, file, position and message are kept once. Per file, offenses are
 * ordered by start offset, then by the registration order of their check, then by arrival. Files appear in
 * the order their first offense arrived. Not thread-safe: a run has a single writer.</p>
 */
public final class OffenseCollector {

    private record Key(String checkCode, String fileUri, Position position, String message) {}

    private record Entry(Offense offense, int checkOrder, long sequence) {}

    private static final Comparator<Entry> ORDER = Comparator
            .comparingInt((Entry e) -> e.offense().position().start())
            .thenComparingInt(Entry::checkOrder)
            .thenComparingLong(Entry::sequence);

    private final ToIntFunction<String> checkOrder;
    private final Map<String, List<Entry>> byFile = new LinkedHashMap<>();
    private final Set<Key> seen = new HashSet<>();
    private long sequence;

    /**
     * @param checkOrder Maps a check code to its registration index.
     */
    public OffenseCollector(ToIntFunction<String> checkOrder) {
        this.checkOrder = checkOrder;
    }

    public OffenseCollector(CheckRegistry registry) {
        this(registry::orderOf);
    }

    /**
     * Creates a collector that orders ties by arrival only.
     */
    public OffenseCollector() {
        this(code -> 0);
    }

    /**
     * @param offense The offense to add.
     * @return false if an identical offense was already collected.
     */
    public boolean add(Offense offense) {
        Key key = new Key(offense.checkCode(), offense.fileUri(), offense.position(), offense.message());
        if (!seen.add(key)) {
            return false;
        }
        byFile.computeIfAbsent(offense.fileUri(), uri -> new ArrayList<>())
                .add(new Entry(offense, checkOrder.applyAsInt(offense.checkCode()), sequence++));
        return true;
    }

    /**
     * @return The ordered offenses of one file.
     */
    public List<Offense> offensesFor(String fileUri) {
        List<Entry> entries = byFile.get(fileUri);
        return entries == null ? List.of() : sorted(entries);
    }

    /**
     * @return File URI to ordered offenses, files in arrival order.
     */
    public Map<String, List<Offense>> byFile() {
        Map<String, List<Offense>> result = new LinkedHashMap<>();
        byFile.forEach((uri, entries) -> result.put(uri, sorted(entries)));
        return Collections.unmodifiableMap(result);
    }

    /**
     * @return All offenses, grouped by file as in {@link #byFile()}.
     */
    public List<Offense> offenses() {
        List<Offense> all = new ArrayList<>();
        byFile().values().forEach(all::addAll);
        return all;
    }

    public int size() {
        return seen.size();
    }

    private static List<Offense> sorted(List<Entry> entries) {
        return entries.stream().sorted(ORDER).map(Entry::offense).toList();
    }
}
