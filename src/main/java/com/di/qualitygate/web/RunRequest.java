package com.di.qualitygate.web;

import lombok.Data;

import java.util.List;

/**
 * Body of {@code POST /api/etl/runs}. Missing fields fall back to configuration.
 */
@Data
public class RunRequest {
    private List<String> tables;
    private Boolean enableValidation;
    private Boolean enableTransformation;
}
