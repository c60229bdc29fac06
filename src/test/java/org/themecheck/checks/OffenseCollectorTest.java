package org.themecheck.checks;

import org.themecheck.frontend.parser.ast.Position;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

public class OffenseCollectorTest {

    private static Offense offense(String code, String uri, int start, String message) {
        return new Offense(code, Severity.WARNING, message, uri, new Position(start, start + 1));
    }

    @Test
    @Tag("unit")
    void ordersByStartThenCheckOrderThenArrival() {
        Map<String, Integer> order = Map.of("First", 0, "Second", 1);
        OffenseCollector collector = new OffenseCollector(code -> order.getOrDefault(code, Integer.MAX_VALUE));

        collector.add(offense("Second", "a.liquid", 5, "s5"));
        collector.add(offense("Unknown", "a.liquid", 5, "u5"));
        collector.add(offense("First", "a.liquid", 5, "f5"));
        collector.add(offense("Second", "a.liquid", 1, "s1"));
        collector.add(offense("First", "a.liquid", 5, "f5 again"));

        assertThat(collector.offensesFor("a.liquid")).extracting(Offense::message)
                .containsExactly("s1", "f5", "f5 again", "s5", "u5");
    }

    @Test
    @Tag("unit")
    void dropsIdenticalOffenses() {
        OffenseCollector collector = new OffenseCollector();

        assertThat(collector.add(offense("A", "a.liquid", 0, "m"))).isTrue();
        assertThat(collector.add(offense("A", "a.liquid", 0, "m"))).isFalse();
        assertThat(collector.add(offense("A", "a.liquid", 0, "other"))).isTrue();
        assertThat(collector.add(offense("A", "b.liquid", 0, "m"))).isTrue();

        assertThat(collector.size()).isEqualTo(3);
    }

    @Test
    @Tag("unit")
    void groupsFilesInArrivalOrder() {
        OffenseCollector collector = new OffenseCollector();
        collector.add(offense("A", "z.liquid", 0, "m"));
        collector.add(offense("A", "a.liquid", 0, "m"));

        assertThat(collector.byFile().keySet()).containsExactly("z.liquid", "a.liquid");
        assertThat(collector.offenses()).extracting(Offense::fileUri).containsExactly("z.liquid", "a.liquid");
        assertThat(collector.offensesFor("missing.liquid")).isEmpty();
    }
}
