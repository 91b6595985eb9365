package com.learningplatform.common.integrity;

import com.learningplatform.common.model.ModelUpdate;
import com.learningplatform.common.tensor.ModelWeights;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

import static com.learningplatform.common.Fixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class ProofVerifierTest {

    private final ProofVerifier verifier = new ProofVerifier();

    private static ModelUpdate withProof(ModelUpdate u, ComputationProof proof) {
        return new ModelUpdate(u.updateId(), u.agentId(), u.roundId(), u.weights(), u.weightHash(),
                               u.differentialNoise(), u.epsilonSpent(), u.validationScore(), proof,
                               u.timestamp(), u.signature(), u.bandwidthUsedKb());
    }

    @Nested
    @DisplayName("WeightHasher")
    class Hashing {

        @Test
        @DisplayName("hash ignores the order layers were supplied in")
        void canonicalOrder() {
            Map<String, Object> ab = new LinkedHashMap<>();
            ab.put("a", 1.0);
            ab.put("b", 2.0);
            Map<String, Object> ba = new LinkedHashMap<>();
            ba.put("b", 2.0);
            ba.put("a", 1.0);
            assertEquals(WeightHasher.hash(ModelWeights.fromPlain(ab)),
                         WeightHasher.hash(ModelWeights.fromPlain(ba)));
        }

        @Test
        @DisplayName("hash is 64 lowercase hex characters")
        void hexFormat() {
            assertTrue(WeightHasher.hash(vector(1, 2, 3)).matches("[0-9a-f]{64}"));
        }

        @Test
        @DisplayName("different values hash differently")
        void sensitivity() {
            assertNotEquals(WeightHasher.hash(vector(1, 2)), WeightHasher.hash(vector(1, 2.0001)));
        }
    }

    @Nested
    @DisplayName("verify()")
    class Verify {

        @Test
        @DisplayName("freshly issued proof is valid")
        void valid() {
            ProofVerifier.Verdict v = verifier.verify(update("a1", vector(1, 2), 0.9), NOW);
            assertTrue(v.valid());
            assertEquals("proof_validated", v.reason());
        }

        @Test
        @DisplayName("missing proof")
        void missingProof() {
            ModelUpdate u = withProof(update("a1", vector(1, 2), 0.9), null);
            assertEquals("missing_proof", verifier.verify(u, NOW).reason());
        }

        @Test
        @DisplayName("proof issued for another agent")
        void agentMismatch() {
            ModelUpdate u = update("a1", vector(1, 2), 0.9);
            ModelUpdate forged = withProof(u, ComputationProof.issue("a2", u.weightHash(), 0.9, NOW));
            assertEquals("agent_id_mismatch", verifier.verify(forged, NOW).reason());
        }

        @Test
        @DisplayName("weights replaced after the proof was issued")
        void hashMismatch() {
            ModelUpdate u = update("a1", vector(1, 2), 0.9);
            ModelUpdate tampered = new ModelUpdate(u.updateId(), u.agentId(), u.roundId(), vector(9, 9),
                u.weightHash(), 0, 0, u.validationScore(), u.computationProof(), u.timestamp(),
                u.signature(), u.bandwidthUsedKb());
            assertEquals("weights_hash_mismatch", verifier.verify(tampered, NOW).reason());
        }

        @Test
        @DisplayName("validation score edited inside the proof")
        void signatureMismatch() {
            ModelUpdate u = update("a1", vector(1, 2), 0.4);
            ComputationProof p = u.computationProof();
            ModelUpdate edited = withProof(u,
                new ComputationProof(p.agentId(), p.weightsHash(), 0.99, p.timestamp(), p.signature()));
            assertEquals("signature_mismatch", verifier.verify(edited, NOW).reason());
        }

        @Test
        @DisplayName("proof older than the tolerance")
        void staleProof() {
            ModelUpdate u = update("a1", vector(1, 2), 0.9);
            assertEquals("timestamp_out_of_range",
                verifier.verify(u, NOW.plus(Duration.ofHours(2))).reason());
            assertTrue(verifier.verify(u, NOW.plus(Duration.ofMinutes(59))).valid());
        }
    }
}
