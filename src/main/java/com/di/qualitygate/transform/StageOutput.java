package com.di.qualitygate.transform;

import com.di.qualitygate.model.Dataset;

/** Dataset produced by a single transform stage together with that stage's stats. */
public record StageOutput(Dataset dataset, StageStats stats) {
}
