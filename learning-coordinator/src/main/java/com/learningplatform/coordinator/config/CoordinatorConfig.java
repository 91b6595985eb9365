package com.learningplatform.coordinator.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.learningplatform.common.aggregation.AggregationStrategies;
import com.learningplatform.common.aggregation.Aggregator;
import com.learningplatform.common.detection.ByzantineDetector;
import com.learningplatform.common.integrity.ProofVerifier;
import com.learningplatform.common.privacy.GaussianMechanism;
import com.learningplatform.common.privacy.NoiseSource;
import com.learningplatform.common.privacy.RandomNoiseSource;
import com.learningplatform.coordinator.network.DeterministicNetworkProfiler;
import com.learningplatform.coordinator.network.NetworkProfiler;
import com.learningplatform.coordinator.store.CoordinatorStore;
import com.learningplatform.coordinator.store.InMemoryCoordinatorStore;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

@Configuration
public class CoordinatorConfig {

    @Value("${coordinator.id:coordinator-main}")
    private String coordinatorId;

    @Value("${coordinator.privacy-budget-total:10.0}")
    private double privacyBudgetTotal;

    @Value("${coordinator.consensus-threshold:0.67}")
    private double consensusThreshold;

    @Value("${coordinator.byzantine-tolerance-ratio:0.33}")
    private double byzantineToleranceRatio;

    @Value("${coordinator.max-concurrent-rounds:10}")
    private int maxConcurrentRounds;

    @Value("${coordinator.round-duration:PT1H}")
    private Duration roundDuration;

    @Value("${coordinator.proof-tolerance:PT1H}")
    private Duration proofTolerance;

    /** Negative → unseeded. */
    @Value("${coordinator.noise-seed:-1}")
    private long noiseSeed;

    @Bean
    public CoordinatorSettings coordinatorSettings() {
        return new CoordinatorSettings(coordinatorId, privacyBudgetTotal, consensusThreshold,
                                       byzantineToleranceRatio, maxConcurrentRounds, roundDuration);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public NoiseSource noiseSource() {
        return noiseSeed < 0 ? new RandomNoiseSource() : new RandomNoiseSource(noiseSeed);
    }

    @Bean
    public GaussianMechanism gaussianMechanism(NoiseSource noiseSource) {
        return new GaussianMechanism(noiseSource);
    }

    @Bean
    public ProofVerifier proofVerifier() {
        return new ProofVerifier(proofTolerance);
    }

    @Bean
    public ByzantineDetector byzantineDetector(ProofVerifier proofVerifier) {
        return ByzantineDetector.standard(proofVerifier);
    }

    @Bean
    public Aggregator aggregator(NoiseSource noiseSource) {
        return new Aggregator(new AggregationStrategies(noiseSource), consensusThreshold);
    }

    @Bean
    public CoordinatorStore coordinatorStore() {
        return new InMemoryCoordinatorStore();
    }

    @Bean
    public NetworkProfiler networkProfiler() {
        return new DeterministicNetworkProfiler();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
