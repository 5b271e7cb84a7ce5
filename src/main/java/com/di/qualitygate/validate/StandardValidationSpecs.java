package com.di.qualitygate.validate;

import java.util.List;

/**
 * Required columns, keys and foreign-key map of the supply-chain schema.
 */
public final class StandardValidationSpecs {

    private StandardValidationSpecs() {
    }

    public static TableValidationSpec forTable(String table) {
        switch (table) {
            case "suppliers":
                return spec(table, List.of("supplier_id", "supplier_name"), "supplier_id");
            case "products":
                return spec(table, List.of("product_id", "product_name", "unit_cost", "supplier_id"), "product_id",
                        ForeignKey.to("supplier_id", "suppliers"));
            case "warehouses":
                return spec(table, List.of("warehouse_id", "warehouse_name"), "warehouse_id");
            case "inventory":
                return spec(table, List.of("inventory_id", "product_id", "warehouse_id", "quantity_on_hand",
                                "quantity_reserved", "snapshot_date"), "inventory_id",
                        ForeignKey.to("product_id", "products"),
                        ForeignKey.to("warehouse_id", "warehouses"));
            case "orders":
                return spec(table, List.of("order_id", "order_date", "supplier_id", "order_quantity"), "order_id",
                        ForeignKey.to("supplier_id", "suppliers"));
            case "sales":
                return spec(table, List.of("sale_id", "sale_date", "product_id", "warehouse_id", "quantity_sold",
                                "revenue"), "sale_id",
                        ForeignKey.to("product_id", "products"),
                        ForeignKey.to("warehouse_id", "warehouses"));
            case "price_history":
                return spec(table, List.of("price_history_id", "product_id", "supplier_id", "effective_date"),
                        "price_history_id",
                        ForeignKey.to("product_id", "products"),
                        ForeignKey.to("supplier_id", "suppliers"));
            default:
                return TableValidationSpec.empty(table);
        }
    }

    private static TableValidationSpec spec(String table, List<String> required, String pk, ForeignKey... fks) {
        return TableValidationSpec.builder()
                .table(table)
                .requiredColumns(required)
                .primaryKey(List.of(pk))
                .foreignKeys(List.of(fks))
                .build();
    }
}
