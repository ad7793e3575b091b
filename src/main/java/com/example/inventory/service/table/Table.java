package com.example.inventory.service.table;

import java.util.List;

/**
 * Rows read from one sheet or delimited file. Row values line up with {@code headers} by index.
 */
public record Table(
        String sourceName,
        List<String> headers,
        List<TableRow> rows,
        int hiddenRowsSkipped
) {
    public Table {
        headers = List.copyOf(headers);
        rows = List.copyOf(rows);
    }

    public int columnCount() {
        return headers.size();
    }
}
