package ai.coursedoc.transcoder.render;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

/**
 * The integral guess is best effort; these cases pin down where it fires, including known misfires.
 */
class SummationHeuristicTest {

    @ParameterizedTest(name = "[{0}] lower=''{1}'' upper=''{2}'' -> {3}")
    @CsvSource(value = {
            "PERMISSIVE, 0, 1, true",
            "PERMISSIVE, a, b, true",
            "PERMISSIVE, '', n, true",
            "PERMISSIVE, k, '', true",
            "PERMISSIVE, i=1, n, false",
            "PERMISSIVE, 0, \\infty, false",
            "PERMISSIVE, +, -, false",
            "SIMPLE_LIMITS, 0, 1, true",
            "SIMPLE_LIMITS, '', n, false",
            "SIMPLE_LIMITS, i=1, n, false",
            "DISABLED, 0, 1, false",
            "DISABLED, '', '', false"
    })
    void decidesWhenSummationIsReadAsIntegral(SummationHeuristic heuristic, String lower, String upper, boolean integral) {
        assertThat(heuristic.treatAsIntegral(lower, upper)).isEqualTo(integral);
    }

    @Test
    void misfiresOnSimpleSummationLimits() {
        // sum from 0 to n over single characters is indistinguishable from an integral
        assertThat(SummationHeuristic.PERMISSIVE.treatAsIntegral("0", "n")).isTrue();
    }

    @Test
    void parsesPolicyNames() {
        assertThat(SummationHeuristic.from("simple-limits")).isEqualTo(SummationHeuristic.SIMPLE_LIMITS);
        assertThat(SummationHeuristic.from(" Disabled ")).isEqualTo(SummationHeuristic.DISABLED);
        assertThat(SummationHeuristic.from(null)).isEqualTo(SummationHeuristic.PERMISSIVE);
    }

    @Test
    void rejectsUnknownPolicy() {
        assertThatThrownBy(() -> SummationHeuristic.from("aggressive"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("aggressive");
    }
}
