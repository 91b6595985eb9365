package com.learningplatform.common.aggregation;

import com.learningplatform.common.exception.InsufficientParticipantsException;
import com.learningplatform.common.model.LearningStrategy;
import com.learningplatform.common.model.ModelUpdate;
import com.learningplatform.common.tensor.ModelWeights;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.List;

import static com.learningplatform.common.Fixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class AggregatorTest {

    private final Aggregator aggregator =
        new Aggregator(new AggregationStrategies(sigma -> 0.0), Aggregator.DEFAULT_CONSENSUS_THRESHOLD);

    @Nested
    @DisplayName("strategies")
    class Strategies {

        @Test
        @DisplayName("federated averaging weights by validation score")
        void fedAvgWeighted() {
            List<ModelUpdate> updates = List.of(update("a1", vector(1.0), 0.75), update("a2", vector(3.0), 0.25));
            ModelWeights result = new FederatedAveragingStrategy().aggregate(updates);
            assertEquals(1.5, result.flatten()[0], 1e-12);
        }

        @Test
        @DisplayName("all-zero scores fall back to the plain mean")
        void fedAvgZeroScores() {
            List<ModelUpdate> updates = List.of(update("a1", vector(1.0), 0.0), update("a2", vector(3.0), 0.0));
            assertEquals(2.0, new FederatedAveragingStrategy().aggregate(updates).flatten()[0], 1e-12);
        }

        @Test
        @DisplayName("median ignores a single extreme value")
        void medianRobust() {
            List<ModelUpdate> updates = List.of(
                update("a1", vector(1.0, 10.0), 0.9),
                update("a2", vector(2.0, 20.0), 0.9),
                update("a3", vector(100.0, -500.0), 0.9));
            assertArrayEquals(new double[]{2.0, 10.0},
                new MedianAggregationStrategy().aggregate(updates).flatten(), 1e-12);
        }

        @Test
        @DisplayName("secure aggregation adds masking noise to the average")
        void secureMask() {
            List<ModelUpdate> updates = List.of(update("a1", vector(1.0), 0.5), update("a2", vector(3.0), 0.5));
            SecureAggregationStrategy secure = new SecureAggregationStrategy(sigma -> sigma);
            assertEquals(2.0 + SecureAggregationStrategy.MASK_SCALE, secure.aggregate(updates).flatten()[0], 1e-12);
        }

        @ParameterizedTest
        @EnumSource(value = LearningStrategy.class, names = "SECURE_AGGREGATION", mode = EnumSource.Mode.EXCLUDE)
        @DisplayName("identical inputs aggregate to exactly themselves")
        void identityOnIdenticalInputs(LearningStrategy strategy) {
            ModelWeights w = vector(0.7, -1.3, 2.9, 0.11, 3.3);
            List<ModelUpdate> updates = List.of(
                update("a1", w, 0.85), update("a2", w, 0.9), update("a3", w, 0.95), update("a4", w, 0.87));
            ModelWeights result = aggregator.aggregate(updates, strategy).weights();
            assertTrue(result.sameShape(w));
            assertArrayEquals(w.flatten(), result.flatten(), 0.0);
            assertEquals(w, result);
        }

        @Test
        @DisplayName("federated averaging keeps agreeing positions exact and averages the rest")
        void fedAvgMixedPositions() {
            List<ModelUpdate> updates = List.of(
                update("a1", vector(0.11, 1.0), 0.85), update("a2", vector(0.11, 3.0), 0.85));
            double[] out = new FederatedAveragingStrategy().aggregate(updates).flatten();
            assertEquals(0.11, out[0], 0.0);
            assertEquals(2.0, out[1], 1e-12);
        }

        @Test
        @DisplayName("differential-private and continual rounds use federated averaging")
        void registryFallback() {
            AggregationStrategies registry = new AggregationStrategies(sigma -> 0.0);
            assertInstanceOf(FederatedAveragingStrategy.class, registry.forStrategy(LearningStrategy.DIFFERENTIAL_PRIVATE));
            assertInstanceOf(FederatedAveragingStrategy.class, registry.forStrategy(LearningStrategy.CONTINUAL_LEARNING));
            assertInstanceOf(MedianAggregationStrategy.class, registry.forStrategy(LearningStrategy.BYZANTINE_ROBUST));
        }
    }

    @Nested
    @DisplayName("aggregate()")
    class Aggregate {

        @Test
        @DisplayName("fewer than two updates → InsufficientParticipantsException")
        void tooFew() {
            assertThrows(InsufficientParticipantsException.class,
                () -> aggregator.aggregate(List.of(update("a1", vector(1.0), 0.9)), LearningStrategy.FEDERATED_AVERAGING));
        }

        @Test
        @DisplayName("aligned high-score updates reach consensus")
        void consensus() {
            AggregationOutcome outcome = aggregator.aggregate(
                List.of(update("a1", vector(1, 1), 1.0), update("a2", vector(2, 2), 1.0)),
                LearningStrategy.FEDERATED_AVERAGING);
            assertEquals(1.0, outcome.qualityScore(), 1e-12);
            assertTrue(outcome.consensusAchieved());
        }

        @Test
        @DisplayName("low scores and orthogonal weights miss consensus")
        void noConsensus() {
            AggregationOutcome outcome = aggregator.aggregate(
                List.of(update("a1", vector(1, 0), 0.5), update("a2", vector(0, 1), 0.5)),
                LearningStrategy.FEDERATED_AVERAGING);
            assertEquals(0.3, outcome.qualityScore(), 1e-12);
            assertFalse(outcome.consensusAchieved());
        }
    }

    @Test
    @DisplayName("privacy loss sums the noise scale recorded at ingestion; epsilon is reported separately")
    void privacyLossIsNoiseSum() {
        List<ModelUpdate> updates = List.of(noisy("a1"), noisy("a2"), noisy("a3"));

        AggregationOutcome outcome = aggregator.aggregate(updates, LearningStrategy.DIFFERENTIAL_PRIVATE);

        assertEquals(1.5, outcome.privacyLoss(), 1e-12);
        assertEquals(6.0, outcome.epsilonSpent(), 1e-12);
    }

    private static ModelUpdate noisy(String agentId) {
        ModelUpdate u = update(agentId, vector(0.5, 0.5), 0.9);
        return new ModelUpdate(u.updateId(), u.agentId(), u.roundId(), u.weights(), u.weightHash(), 0.5, 2.0,
                               u.validationScore(), u.computationProof(), u.timestamp(), u.signature(),
                               u.bandwidthUsedKb());
    }

    @Test
    @DisplayName("quality with one update uses the neutral consistency term")
    void singleUpdateQuality() {
        assertEquals(0.6 * 0.5 + 0.4 * 0.5,
            AggregationQualityScorer.quality(List.of(update("a1", vector(1), 0.5))), 1e-12);
    }
}
