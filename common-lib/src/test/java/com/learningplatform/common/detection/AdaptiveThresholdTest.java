package com.learningplatform.common.detection;

import com.learningplatform.common.model.LearningRound;
import com.learningplatform.common.model.LearningStrategy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.learningplatform.common.Fixtures.round;
import static org.junit.jupiter.api.Assertions.*;

class AdaptiveThresholdTest {

    private static final List<String> SIX = List.of("a1", "a2", "a3", "a4", "a5", "a6");
    private static final List<String> TEN =
        List.of("a0", "a1", "a2", "a3", "a4", "a5", "a6", "a7", "a8", "a9");

    @Test
    @DisplayName("lone small score → mean + k·std, no lower bound")
    void noFloor() {
        List<Double> scores = List.of(0.0, 0.0, 0.0, 0.0, 0.3);
        // mean 0.06, population std 0.12
        assertEquals(0.06 + 0.5 * 0.12,
            AdaptiveThreshold.compute(scores, round(LearningStrategy.BYZANTINE_ROBUST, TEN, 3)), 1e-12);
        assertEquals(0.06 + 1.0 * 0.12,
            AdaptiveThreshold.compute(scores, round(LearningStrategy.FEDERATED_AVERAGING, TEN, 1)), 1e-12);
        assertEquals(0.06 + 1.5 * 0.12,
            AdaptiveThreshold.compute(scores, round(LearningStrategy.DIFFERENTIAL_PRIVATE, TEN, 1)), 1e-12);
    }

    @Test
    @DisplayName("all-zero scores → threshold 0")
    void allZero() {
        assertEquals(0.0,
            AdaptiveThreshold.compute(List.of(0.0, 0.0, 0.0), round(LearningStrategy.FEDERATED_AVERAGING, TEN, 1)));
    }

    @Test
    @DisplayName("high spread is capped by 1 − tolerance fraction")
    void capApplies() {
        LearningRound round = round(LearningStrategy.DIFFERENTIAL_PRIVATE, SIX, 2);
        double threshold = AdaptiveThreshold.compute(List.of(0.0, 0.0, 2.0), round);
        assertEquals(1.0 - 2.0 / 6.0, threshold, 1e-12);
    }

    @Test
    @DisplayName("wide spread lifts the threshold up to the cap")
    void spreadLifts() {
        LearningRound round = round(LearningStrategy.FEDERATED_AVERAGING, TEN, 1);
        double threshold = AdaptiveThreshold.compute(List.of(0.0, 0.9, 0.0, 0.9), round);
        // mean 0.45 + 1.0 × std 0.45 = 0.9, cap 0.9
        assertEquals(0.9, threshold, 1e-9);
    }

    @Test
    @DisplayName("no scores → default capped")
    void empty() {
        assertEquals(0.7, AdaptiveThreshold.compute(List.of(), round(LearningStrategy.FEDERATED_AVERAGING, TEN, 1)), 1e-12);
    }
}
