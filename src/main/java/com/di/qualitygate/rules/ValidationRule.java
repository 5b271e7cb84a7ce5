package com.di.qualitygate.rules;

import com.di.qualitygate.model.RuleType;
import com.di.qualitygate.model.Severity;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.util.List;

/**
 * A named, immutable quality rule registered for a table.
 */
@Value
@Builder
public class ValidationRule {

    @NonNull
    String name;
    @NonNull
    RuleType ruleType;
    @NonNull
    RuleCheck check;
    @NonNull
    Severity severity;
    String description;

    public List<String> getColumns() {
        return check.columns();
    }
}
