package com.learningplatform.coordinator.store;

/** Outcome of {@link CoordinatorStore#admitUpdate}. Only {@link #ACCEPTED} changes state. */
public enum UpdateAdmission {
    ACCEPTED,
    DUPLICATE,
    SHAPE_MISMATCH,
    ROUND_CLOSED
}
