package com.starscape.borderframe.features.batch.domain;

public enum BatchStatus {
    COMPLETED,
    COMPLETED_WITH_ERRORS,
    FAILED,
    CANCELLED
}
