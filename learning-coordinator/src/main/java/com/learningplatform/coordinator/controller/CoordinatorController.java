package com.learningplatform.coordinator.controller;

import com.learningplatform.common.model.Agent;
import com.learningplatform.common.model.AggregationResult;
import com.learningplatform.common.model.ByzantineDetectionResult;
import com.learningplatform.common.model.CoordinatorMetrics;
import com.learningplatform.common.model.LearningRound;
import com.learningplatform.common.model.ModelUpdate;
import com.learningplatform.common.trace.TraceContextUtil;
import com.learningplatform.coordinator.dto.CreateRoundRequest;
import com.learningplatform.coordinator.dto.RegisterAgentRequest;
import com.learningplatform.coordinator.dto.RegistrationResponse;
import com.learningplatform.coordinator.dto.SubmitUpdateRequest;
import com.learningplatform.coordinator.logger.LearningFlowLogger;
import com.learningplatform.coordinator.service.DistributedLearningCoordinator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * REST binding of the coordinator. The coordinator is synchronous and lock-based, so
 * every call is offloaded to the bounded-elastic scheduler.
 */
@RestController
@RequestMapping("/api/v1/coordinator")
public class CoordinatorController {

    private static final Logger log = LoggerFactory.getLogger(CoordinatorController.class);

    private final DistributedLearningCoordinator coordinator;
    private final LearningFlowLogger flowLogger;

    public CoordinatorController(DistributedLearningCoordinator coordinator, LearningFlowLogger flowLogger) {
        this.coordinator = coordinator;
        this.flowLogger  = flowLogger;
    }

    @PostMapping("/agents")
    public Mono<ResponseEntity<RegistrationResponse>> registerAgent(@RequestBody RegisterAgentRequest request) {
        log.info("Agent registration received. agentId={} role={}", request.agentId(), request.role());
        return blocking(() -> coordinator.registerAgent(request.agentId(), request.role(), request.networks(),
                                                        request.computationalCapacity(), request.specialization()))
            .map(registered -> ResponseEntity.ok(new RegistrationResponse(request.agentId(), registered)));
    }

    @GetMapping("/agents/{agentId}")
    public Mono<ResponseEntity<Agent>> agent(@PathVariable String agentId) {
        return blocking(() -> coordinator.getAgent(agentId)).map(ResponseEntity::ok);
    }

    @PostMapping("/rounds")
    public Mono<ResponseEntity<LearningRound>> createRound(@RequestBody CreateRoundRequest request) {
        log.info("Round creation received. modelId={} strategy={}", request.modelId(), request.strategy());
        return blocking(() -> coordinator.createLearningRound(request.modelId(), request.strategy(),
                                                              request.targetAccuracy(), request.maxIterations(),
                                                              request.privacyEpsilon()))
            .map(ResponseEntity::ok);
    }

    @GetMapping("/rounds/{roundId}")
    public Mono<ResponseEntity<LearningRound>> round(@PathVariable String roundId) {
        return blocking(() -> coordinator.getRound(roundId)).map(ResponseEntity::ok);
    }

    @PostMapping("/rounds/{roundId}/updates")
    public Mono<ResponseEntity<ModelUpdate>> submitUpdate(@PathVariable String roundId,
                                                          @RequestBody SubmitUpdateRequest request) {
        return TraceContextUtil.withTraceId(
            blocking(() -> coordinator.submitModelUpdate(request.agentId(), roundId, request.weights(),
                                                         request.validationScore()))
                .map(ResponseEntity::ok),
            roundId);
    }

    @PostMapping("/rounds/{roundId}/aggregate")
    public Mono<ResponseEntity<AggregationResult>> aggregate(@PathVariable String roundId) {
        return TraceContextUtil.withTraceId(
            Mono.just(roundId)
                .doOnEach(flowLogger.stage(LearningFlowLogger.AGGREGATION_REQUESTED))
                .flatMap(id -> blocking(() -> coordinator.aggregateModelUpdates(id)))
                .map(ResponseEntity::ok)
                .doOnError(e -> log.warn("Aggregation failed. roundId={} reason={}", roundId, e.getMessage())),
            roundId);
    }

    @GetMapping("/rounds/{roundId}/aggregation")
    public Mono<ResponseEntity<AggregationResult>> aggregation(@PathVariable String roundId) {
        return blocking(() -> coordinator.getAggregationResult(roundId)).map(ResponseEntity::ok);
    }

    @GetMapping("/rounds/{roundId}/detections")
    public Mono<ResponseEntity<List<ByzantineDetectionResult>>> detections(@PathVariable String roundId) {
        return blocking(() -> coordinator.getDetections(roundId)).map(ResponseEntity::ok);
    }

    @GetMapping("/metrics")
    public Mono<ResponseEntity<CoordinatorMetrics>> metrics() {
        return blocking(coordinator::getCoordinatorMetrics).map(ResponseEntity::ok);
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }

    private static <T> Mono<T> blocking(Callable<T> call) {
        return Mono.fromCallable(call).subscribeOn(Schedulers.boundedElastic());
    }
}
