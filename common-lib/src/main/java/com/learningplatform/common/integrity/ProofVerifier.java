package com.learningplatform.common.integrity;

import com.learningplatform.common.model.ModelUpdate;

import java.time.Duration;
import java.time.Instant;

/**
 * Checks a {@link ModelUpdate}'s {@link ComputationProof} against the update itself.
 *
 * <p>Checks, in order (first failure wins):
 * <ol>
 *   <li>proof present with every field set        → {@code missing_field_<name>}</li>
 *   <li>proof agent equals update agent           → {@code agent_id_mismatch}</li>
 *   <li>proof hash equals hash of stored weights  → {@code weights_hash_mismatch}</li>
 *   <li>signature recomputes                      → {@code signature_mismatch}</li>
 *   <li>|now − proof timestamp| ≤ tolerance       → {@code timestamp_out_of_range}</li>
 * </ol>
 */
public final class ProofVerifier {

    public static final Duration DEFAULT_TOLERANCE = Duration.ofHours(1);

    private final Duration tolerance;

    public ProofVerifier(Duration tolerance) {
        this.tolerance = tolerance;
    }

    public ProofVerifier() {
        this(DEFAULT_TOLERANCE);
    }

    public Verdict verify(ModelUpdate update, Instant now) {
        ComputationProof proof = update.computationProof();
        if (proof == null) {
            return Verdict.invalid("missing_proof");
        }
        if (isBlank(proof.agentId())) {
            return Verdict.invalid("missing_field_agent_id");
        }
        if (isBlank(proof.weightsHash())) {
            return Verdict.invalid("missing_field_weights_hash");
        }
        if (proof.timestamp() == null) {
            return Verdict.invalid("missing_field_timestamp");
        }
        if (isBlank(proof.signature())) {
            return Verdict.invalid("missing_field_signature");
        }
        if (!proof.agentId().equals(update.agentId())) {
            return Verdict.invalid("agent_id_mismatch");
        }
        if (!proof.weightsHash().equals(WeightHasher.hash(update.weights()))) {
            return Verdict.invalid("weights_hash_mismatch");
        }
        String expected = ComputationProof.signatureOf(
            proof.agentId(), proof.weightsHash(), proof.validationScore(), proof.timestamp());
        if (!expected.equals(proof.signature())) {
            return Verdict.invalid("signature_mismatch");
        }
        if (Duration.between(proof.timestamp(), now).abs().compareTo(tolerance) > 0) {
            return Verdict.invalid("timestamp_out_of_range");
        }
        return Verdict.VALID;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    public record Verdict(boolean valid, String reason) {
        static final Verdict VALID = new Verdict(true, "proof_validated");

        static Verdict invalid(String reason) {
            return new Verdict(false, reason);
        }
    }
}
