package com.example.inventory.service.table;

import java.util.List;

/**
 * A named result table ready to be written: {@code name} becomes the file base name and sheet name.
 */
public record TableView(
        String name,
        List<String> headers,
        List<List<String>> rows
) {
    public TableView {
        headers = List.copyOf(headers);
        rows = List.copyOf(rows);
    }
}
