package com.starscape.borderframe.features.batch.domain;

public enum JobStatus {
    COMPLETED,
    FAILED,
    CANCELLED
}
