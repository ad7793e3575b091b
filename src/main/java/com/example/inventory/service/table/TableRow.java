package com.example.inventory.service.table;

import java.util.List;

public record TableRow(
        int rowNo,
        List<String> values
) {
    public TableRow {
        values = List.copyOf(values);
    }

    public String value(int column) {
        if (column < 0 || column >= values.size()) {
            return "";
        }
        return values.get(column);
    }
}
