package com.learningplatform.common.detection;

import java.util.List;

/**
 * One independent check in the Byzantine detection ensemble.
 *
 * <p>Implementations must be:
 * <ul>
 *   <li><b>Pure</b>    : no side effects, no logging; same context → same hits</li>
 *   <li><b>Additive</b>: each hit carries the full contribution of this signal for one agent</li>
 *   <li><b>Partial</b> : agents the signal does not fire for are simply absent from the result</li>
 * </ul>
 *
 * <p>{@link ByzantineDetector} sums contributions and thresholds centrally.
 */
public interface SuspicionSignal {

    /** Short identifier used in logs. */
    String name();

    /** Fired hits, at most one per agent. */
    List<SignalHit> evaluate(DetectionContext context);
}
