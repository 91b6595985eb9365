package com.learningplatform.common.detection;

import com.learningplatform.common.detection.signals.ComputationProofSignal;
import com.learningplatform.common.detection.signals.CrossValidationSignal;
import com.learningplatform.common.detection.signals.DistanceClusteringSignal;
import com.learningplatform.common.detection.signals.GradientNormSignal;
import com.learningplatform.common.detection.signals.ModelDivergenceSignal;
import com.learningplatform.common.detection.signals.ReputationSignal;
import com.learningplatform.common.detection.signals.TemporalConsistencySignal;
import com.learningplatform.common.detection.signals.ValidationOutlierSignal;
import com.learningplatform.common.detection.signals.WeightSimilaritySignal;
import com.learningplatform.common.integrity.ProofVerifier;
import com.learningplatform.common.model.ByzantineDetectionResult;
import com.learningplatform.common.model.ByzantineDetectionResult.RecommendedAction;
import com.learningplatform.common.model.ModelUpdate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Multi-signal Byzantine detection ensemble.
 *
 * <h3>Algorithm</h3>
 * <ol>
 *   <li>Every update starts at suspicion 0.0.</li>
 *   <li>Each {@link SuspicionSignal} runs independently; its hits are added to the
 *       agents' scores and their evidence tags recorded.</li>
 *   <li>{@link AdaptiveThreshold} turns the score distribution into a threshold.</li>
 *   <li>Agents with a positive score at or above the threshold are flagged.</li>
 *   <li>When more agents are flagged than the round tolerates, only the highest
 *       scores are kept (ties by agent id).</li>
 * </ol>
 *
 * <p>Detection never throws: a failing signal is logged and contributes nothing.
 * The decision whether the round can still aggregate belongs to the caller.
 *
 * <p>Stateless and thread-safe as long as the signals are.
 */
public class ByzantineDetector {

    private static final Logger log = LoggerFactory.getLogger(ByzantineDetector.class);

    public static final String METHOD = "multi_method_ensemble";

    private final List<SuspicionSignal> signals;

    public ByzantineDetector(List<SuspicionSignal> signals) {
        this.signals = List.copyOf(signals);
    }

    /** The standard nine-signal ensemble. */
    public static ByzantineDetector standard(ProofVerifier verifier) {
        return new ByzantineDetector(List.of(
            new ValidationOutlierSignal(),
            new WeightSimilaritySignal(),
            new DistanceClusteringSignal(),
            new GradientNormSignal(),
            new ReputationSignal(),
            new ComputationProofSignal(verifier),
            new CrossValidationSignal(),
            new TemporalConsistencySignal(),
            new ModelDivergenceSignal()
        ));
    }

    public List<SuspicionSignal> signals() {
        return signals;
    }

    public ByzantineDetectionResult detect(DetectionContext context) {
        Map<String, Double> scores = new LinkedHashMap<>();
        Map<String, List<String>> evidence = new LinkedHashMap<>();
        for (ModelUpdate u : context.updates()) {
            scores.put(u.agentId(), 0.0);
        }

        for (SuspicionSignal signal : signals) {
            List<SignalHit> hits;
            try {
                hits = signal.evaluate(context);
            } catch (RuntimeException e) {
                log.warn("[ByzantineDetector] signal={} failed roundId={} reason={}",
                         signal.name(), context.round().roundId(), e.getMessage(), e);
                continue;
            }
            for (SignalHit hit : hits) {
                if (!scores.containsKey(hit.agentId())) {
                    continue;
                }
                scores.merge(hit.agentId(), hit.contribution(), Double::sum);
                evidence.computeIfAbsent(hit.agentId(), k -> new ArrayList<>()).add(hit.evidence());
            }
        }

        double threshold = AdaptiveThreshold.compute(scores.values(), context.round());

        List<String> flagged = scores.entrySet().stream()
            .filter(e -> e.getValue() > 0.0 && e.getValue() >= threshold)
            .sorted(Map.Entry.<String, Double>comparingByValue(Comparator.reverseOrder())
                        .thenComparing(Map.Entry.comparingByKey()))
            .map(Map.Entry::getKey)
            .collect(Collectors.toList());

        int tolerance = context.round().byzantineTolerance();
        List<String> suspects = flagged.size() > tolerance
            ? List.copyOf(flagged.subList(0, tolerance))
            : List.copyOf(flagged);

        double confidence = scores.values().stream().mapToDouble(Double::doubleValue).max().orElse(0.0);

        Map<String, List<String>> frozenEvidence = new LinkedHashMap<>();
        evidence.forEach((agent, tags) -> frozenEvidence.put(agent, List.copyOf(tags)));

        return new ByzantineDetectionResult(
            "detection_" + UUID.randomUUID(),
            context.round().roundId(),
            suspects,
            confidence,
            METHOD,
            threshold,
            flagged.size(),
            Map.copyOf(scores),
            Map.copyOf(frozenEvidence),
            suspects.isEmpty() ? RecommendedAction.PROCEED : RecommendedAction.EXCLUDE_FROM_AGGREGATION,
            context.now()
        );
    }
}
