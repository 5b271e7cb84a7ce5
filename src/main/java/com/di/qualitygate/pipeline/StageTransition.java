package com.di.qualitygate.pipeline;

import com.di.qualitygate.model.TableStatus;

import java.time.Instant;

public record StageTransition(TableStatus status, Instant at) {
}
