package com.learningplatform.coordinator.logger;

import com.learningplatform.common.model.AggregationResult;
import com.learningplatform.common.model.ByzantineDetectionResult;
import com.learningplatform.common.model.LearningRound;
import com.learningplatform.common.model.ModelUpdate;
import com.learningplatform.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Signal;

import java.util.function.Consumer;

/**
 * Observability component for the learning-round lifecycle. Pure side effects; no
 * business logic.
 *
 * <p>Lifecycle stages (in order):
 * <ol>
 *   <li>{@link #ROUND_CREATED}        : participants selected, round stored</li>
 *   <li>{@link #UPDATE_ACCEPTED}      : an agent's update admitted to the round</li>
 *   <li>{@link #AGGREGATION_REQUESTED}: caller asked for aggregation (REST layer)</li>
 *   <li>{@link #DETECTION_COMPLETED}  : Byzantine ensemble ran</li>
 *   <li>{@link #AGGREGATION_COMPLETED}: weights combined, round completed</li>
 *   <li>{@link #ROUND_ROLLED_BACK}    : a precondition failed, round terminated</li>
 * </ol>
 *
 * <p>The round id is the trace id: every line is bridged into MDC under
 * {@link TraceContextUtil#TRACE_ID_KEY} for its duration only.
 */
@Component
public class LearningFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(LearningFlowLogger.class);

    public static final String ROUND_CREATED         = "ROUND_CREATED";
    public static final String UPDATE_ACCEPTED       = "UPDATE_ACCEPTED";
    public static final String AGGREGATION_REQUESTED = "AGGREGATION_REQUESTED";
    public static final String DETECTION_COMPLETED   = "DETECTION_COMPLETED";
    public static final String AGGREGATION_COMPLETED = "AGGREGATION_COMPLETED";
    public static final String ROUND_ROLLED_BACK     = "ROUND_ROLLED_BACK";

    /**
     * {@code doOnEach} consumer logging {@code stageName} on {@code onNext}, with the trace id
     * read from the Reactor Context.
     */
    public <T> Consumer<Signal<T>> stage(String stageName) {
        return signal -> {
            if (!signal.isOnNext()) return;
            String traceId = TraceContextUtil.getTraceId(signal.getContextView());
            TraceContextUtil.withMdc(traceId, () ->
                log.info("[LearningFlow] stage={} traceId={}", stageName, traceId)
            );
        };
    }

    public void roundCreated(LearningRound round) {
        TraceContextUtil.withMdc(round.roundId(), () ->
            log.info("[LearningFlow] stage={} roundId={} strategy={} participants={} tolerance={} deadline={}",
                     ROUND_CREATED, round.roundId(), round.strategy(), round.participatingAgents().size(),
                     round.byzantineTolerance(), round.deadline())
        );
    }

    public void updateAccepted(ModelUpdate update) {
        TraceContextUtil.withMdc(update.roundId(), () ->
            log.info("[LearningFlow] stage={} roundId={} agentId={} updateId={} score={} noise={}",
                     UPDATE_ACCEPTED, update.roundId(), update.agentId(), update.updateId(),
                     update.validationScore(), update.differentialNoise())
        );
    }

    public void detectionCompleted(ByzantineDetectionResult detection) {
        TraceContextUtil.withMdc(detection.roundId(), () ->
            log.info("[LearningFlow] stage={} roundId={} suspects={} flagged={} threshold={} confidence={} action={}",
                     DETECTION_COMPLETED, detection.roundId(), detection.suspectedAgents(),
                     detection.flaggedCount(), String.format("%.3f", detection.threshold()),
                     String.format("%.3f", detection.detectionConfidence()), detection.recommendedAction())
        );
    }

    public void aggregationCompleted(AggregationResult result) {
        TraceContextUtil.withMdc(result.roundId(), () ->
            log.info("[LearningFlow] stage={} roundId={} aggregationId={} strategy={} updates={} "
                     + "quality={} consensus={} privacyLoss={}",
                     AGGREGATION_COMPLETED, result.roundId(), result.aggregationId(),
                     result.aggregationStrategy(), result.participatingUpdates().size(),
                     String.format("%.3f", result.qualityScore()), result.consensusAchieved(),
                     result.privacyLoss())
        );
    }

    public void roundRolledBack(String roundId, String reason) {
        TraceContextUtil.withMdc(roundId, () ->
            log.warn("[LearningFlow] stage={} roundId={} reason={}", ROUND_ROLLED_BACK, roundId, reason)
        );
    }
}
