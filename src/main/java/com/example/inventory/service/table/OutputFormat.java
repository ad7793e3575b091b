package com.example.inventory.service.table;

import java.util.Locale;

public enum OutputFormat {
    CSV("csv", "text/csv"),
    XLSX("xlsx", "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet");

    private final String extension;
    private final String contentType;

    OutputFormat(String extension, String contentType) {
        this.extension = extension;
        this.contentType = contentType;
    }

    public String extension() {
        return extension;
    }

    public String contentType() {
        return contentType;
    }

    public String fileName(String baseName) {
        return baseName + "." + extension;
    }

    public static OutputFormat fromName(String name) {
        if (name == null || name.isBlank()) {
            return CSV;
        }
        String value = name.trim().toUpperCase(Locale.ROOT);
        for (OutputFormat format : values()) {
            if (format.name().equals(value)) {
                return format;
            }
        }
        throw new IllegalArgumentException("Unsupported output format: " + name + " (use csv or xlsx)");
    }
}
