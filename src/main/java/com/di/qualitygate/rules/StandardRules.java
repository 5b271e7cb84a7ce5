package com.di.qualitygate.rules;

import com.di.qualitygate.model.RuleType;
import com.di.qualitygate.model.Severity;
import com.di.qualitygate.rules.RuleChecks.Op;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rule catalog for the supply-chain tables.
 */
final class StandardRules {

    private StandardRules() {
    }

    static Map<String, List<ValidationRule>> catalog(Clock clock) {
        Map<String, List<ValidationRule>> rules = new LinkedHashMap<>();

        rules.put("suppliers", List.of(
                rule("supplier_id_unique", RuleType.UNIQUENESS, RuleChecks.unique("supplier_id"),
                        Severity.CRITICAL, "Supplier IDs must be unique"),
                rule("reliability_score_range", RuleType.VALIDITY, RuleChecks.range("reliability_score", 0, 100),
                        Severity.CRITICAL, "Reliability score must be between 0 and 100"),
                rule("lead_time_positive", RuleType.VALIDITY, RuleChecks.greaterThan("lead_time_days", 0),
                        Severity.WARNING, "Lead time should be positive")));

        rules.put("products", List.of(
                rule("product_id_unique", RuleType.UNIQUENESS, RuleChecks.unique("product_id"),
                        Severity.CRITICAL, "Product IDs must be unique"),
                rule("unit_cost_positive", RuleType.VALIDITY, RuleChecks.greaterThan("unit_cost", 0),
                        Severity.CRITICAL, "Unit cost must be positive"),
                rule("reorder_level_non_negative", RuleType.VALIDITY, RuleChecks.atLeast("reorder_level", 0),
                        Severity.WARNING, "Reorder level should not be negative")));

        rules.put("inventory", List.of(
                rule("quantity_on_hand_valid", RuleType.VALIDITY, RuleChecks.atLeast("quantity_on_hand", 0),
                        Severity.CRITICAL, "Quantity on hand must be non-negative"),
                rule("quantity_reserved_valid", RuleType.VALIDITY, RuleChecks.atLeast("quantity_reserved", 0),
                        Severity.CRITICAL, "Quantity reserved must be non-negative"),
                rule("reserved_not_exceed_onhand", RuleType.CONSISTENCY,
                        RuleChecks.compare("quantity_reserved", Op.LE, "quantity_on_hand"),
                        Severity.CRITICAL, "Reserved quantity cannot exceed quantity on hand")));

        rules.put("orders", List.of(
                rule("order_quantity_positive", RuleType.VALIDITY, RuleChecks.greaterThan("order_quantity", 0),
                        Severity.CRITICAL, "Order quantity must be positive"),
                rule("delivery_after_order", RuleType.CONSISTENCY,
                        RuleChecks.compare("actual_delivery_date", Op.GE, "order_date"),
                        Severity.WARNING, "Actual delivery date should not precede the order date"),
                rule("expected_delivery_after_order", RuleType.CONSISTENCY,
                        RuleChecks.compare("expected_delivery_date", Op.GE, "order_date"),
                        Severity.WARNING, "Expected delivery date should not precede the order date")));

        rules.put("sales", List.of(
                rule("quantity_sold_positive", RuleType.VALIDITY, RuleChecks.greaterThan("quantity_sold", 0),
                        Severity.CRITICAL, "Quantity sold must be positive"),
                rule("revenue_positive", RuleType.VALIDITY, RuleChecks.greaterThan("revenue", 0),
                        Severity.CRITICAL, "Revenue must be positive"),
                rule("revenue_unit_price_consistency", RuleType.CONSISTENCY,
                        RuleChecks.product("revenue", "quantity_sold", "unit_price", 0.01),
                        Severity.WARNING, "Revenue should equal quantity sold times unit price (1% tolerance)"),
                rule("sale_date_not_in_future", RuleType.VALIDITY, RuleChecks.notInFuture("sale_date", clock),
                        Severity.WARNING, "Sale date should not be in the future")));

        return rules;
    }

    private static ValidationRule rule(String name, RuleType type, RuleCheck check, Severity severity, String description) {
        return ValidationRule.builder()
                .name(name)
                .ruleType(type)
                .check(check)
                .severity(severity)
                .description(description)
                .build();
    }
}
