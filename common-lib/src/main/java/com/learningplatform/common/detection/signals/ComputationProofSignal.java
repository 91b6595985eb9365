package com.learningplatform.common.detection.signals;

import com.learningplatform.common.detection.DetectionContext;
import com.learningplatform.common.detection.SignalHit;
import com.learningplatform.common.detection.SuspicionSignal;
import com.learningplatform.common.integrity.ProofVerifier;
import com.learningplatform.common.model.ModelUpdate;

import java.util.ArrayList;
import java.util.List;

/** Computation proof fails {@link ProofVerifier} at the detection instant. */
public class ComputationProofSignal implements SuspicionSignal {

    static final double CONTRIBUTION = 0.5;

    private final ProofVerifier verifier;

    public ComputationProofSignal(ProofVerifier verifier) {
        this.verifier = verifier;
    }

    public ComputationProofSignal() {
        this(new ProofVerifier());
    }

    @Override
    public String name() {
        return "computation_proof";
    }

    @Override
    public List<SignalHit> evaluate(DetectionContext context) {
        List<SignalHit> hits = new ArrayList<>();
        for (ModelUpdate u : context.updates()) {
            ProofVerifier.Verdict verdict = verifier.verify(u, context.now());
            if (!verdict.valid()) {
                hits.add(new SignalHit(u.agentId(), CONTRIBUTION,
                    "invalid_computation_proof:" + verdict.reason()));
            }
        }
        return hits;
    }
}
