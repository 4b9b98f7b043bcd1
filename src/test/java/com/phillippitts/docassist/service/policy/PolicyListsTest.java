package com.phillippitts.docassist.service.policy;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PolicyListsTest {

    private static final List<String> DEFAULTS = List.of("default.com");

    @Test
    void parseSplitsOnCommasAndNewlines() {
        assertThat(PolicyLists.parse(" a.com, b.com\n\nc.com ,", DEFAULTS)).containsExactly("a.com", "b.com", "c.com");
    }

    @Test
    void blankInputParsesToDefaults() {
        assertThat(PolicyLists.parse("  ", DEFAULTS)).isEqualTo(DEFAULTS);
        assertThat(PolicyLists.parse(" , \n", DEFAULTS)).isEqualTo(DEFAULTS);
        assertThat(PolicyLists.parse(null, DEFAULTS)).isEqualTo(DEFAULTS);
    }

    @Test
    void normalizeTrimsAndDropsBlanks() {
        assertThat(PolicyLists.normalize(Arrays.asList(" x ", "", null, "y"), DEFAULTS)).containsExactly("x", "y");
    }

    @Test
    void missingListFallsBackButEmptyListStaysEmpty() {
        assertThat(PolicyLists.normalize(null, DEFAULTS)).isEqualTo(DEFAULTS);
        assertThat(PolicyLists.normalize(List.of(), DEFAULTS)).isEmpty();
    }
}
