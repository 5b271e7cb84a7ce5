package com.di.qualitygate.web;

import com.di.qualitygate.model.RuleType;
import com.di.qualitygate.model.Severity;
import com.di.qualitygate.rules.ValidationRule;

import java.util.List;

public record RuleView(String name, RuleType type, List<String> columns, Severity severity, String description) {

    static RuleView of(ValidationRule rule) {
        return new RuleView(rule.getName(), rule.getRuleType(), rule.getColumns(), rule.getSeverity(),
                rule.getDescription() != null ? rule.getDescription() : rule.getCheck().describe());
    }
}
