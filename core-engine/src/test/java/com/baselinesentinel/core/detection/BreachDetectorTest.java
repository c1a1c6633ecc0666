package com.baselinesentinel.core.detection;

import com.baselinesentinel.core.model.BreachResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link BreachDetector}.
 */
class BreachDetectorTest {

    @Test
    @DisplayName("Should confirm the second consecutive breach and never examine the last sample")
    void shouldMatchReferenceTrace() {
        BreachResult result = BreachDetector.detect(new double[] { 70, 85, 90, 60, 95, 96 }, 80, 2);

        assertThat(result.getIndices()).containsExactly(2);
        assertThat(result.getRunMagnitudeSum()).isEqualTo(90.0);
    }

    @Test
    @DisplayName("Should not report a run that only completes on the final sample")
    void shouldIgnoreFinalSample() {
        BreachResult result = BreachDetector.detect(new double[] { 10, 10, 99 }, 50, 1);

        assertThat(result.isBreached()).isFalse();
        assertThat(result.getRunMagnitudeSum()).isZero();
    }

    @Test
    @DisplayName("Should record every position of a long run once confirmed")
    void shouldRecordWholeRun() {
        BreachResult result = BreachDetector.detect(new double[] { 90, 91, 92, 93, 0 }, 80, 2);

        assertThat(result.getIndices()).containsExactly(1, 2, 3);
        assertThat(result.getRunMagnitudeSum()).isEqualTo(91 + 92 + 93);
    }

    @Test
    @DisplayName("Should keep the heaviest run magnitude across disjoint runs")
    void shouldKeepHeaviestRun() {
        double[] values = { 200, 200, 0, 150, 150, 150, 0 };

        BreachResult result = BreachDetector.detect(values, 100, 2);

        assertThat(result.getIndices()).containsExactly(1, 4, 5);
        assertThat(result.getRunMagnitudeSum()).isEqualTo(300.0);
    }

    @Test
    @DisplayName("Should treat non-positive minConsecutive as one")
    void shouldTreatNonPositiveMinimumAsOne() {
        double[] values = { 90, 10, 90, 10 };

        assertThat(BreachDetector.detect(values, 80, 0).getIndices()).containsExactly(0, 2);
        assertThat(BreachDetector.detect(values, 80, -3).getIndices()).containsExactly(0, 2);
    }

    @Test
    @DisplayName("Should not breach on values equal to the threshold")
    void shouldRequireStrictlyGreater() {
        assertThat(BreachDetector.detect(new double[] { 80, 80, 80, 80 }, 80, 1).isBreached()).isFalse();
    }

    @Test
    @DisplayName("Should return no breach for short or empty sequences")
    void shouldHandleShortInput() {
        assertThat(BreachDetector.detect(new double[0], 1, 1)).isEqualTo(BreachResult.none());
        assertThat(BreachDetector.detect(new double[] { 1000 }, 1, 1)).isEqualTo(BreachResult.none());
        assertThat(BreachDetector.detect(List.of(), 1, 1).isBreached()).isFalse();
    }

    @Test
    @DisplayName("Should give identical results for boxed and primitive input")
    void shouldAgreeAcrossVariants() {
        List<Double> boxed = Arrays.asList(70.0, 85.0, 90.0, 60.0, 95.0, 96.0);

        assertThat(BreachDetector.detect(boxed, 80, 2))
                .isEqualTo(BreachDetector.detect(new double[] { 70, 85, 90, 60, 95, 96 }, 80, 2));
    }
}
