package com.learningplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * One privacy expenditure charged to an agent.
 *
 * <ul>
 *   <li>{@code epsilon}    – privacy loss spent under sequential composition.</li>
 *   <li>{@code noiseScale} – standard deviation of the Gaussian noise that bought it.</li>
 * </ul>
 */
public record PrivacyLedgerEntry(
    @JsonProperty("roundId")    String  roundId,
    @JsonProperty("mechanism")  String  mechanism,
    @JsonProperty("epsilon")    double  epsilon,
    @JsonProperty("noiseScale") double  noiseScale,
    @JsonProperty("spentAt")    Instant spentAt
) {}
