package com.example.inventory.service.table;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;

public final class HeaderNames {

    private HeaderNames() {
    }

    /**
     * "IP Address (primary)*" and "ip  address" both become "ipaddress".
     */
    public static String normalize(String raw) {
        if (raw == null) {
            return "";
        }
        String s = raw.replace("\uFEFF", "").trim();
        if (s.isBlank()) {
            return "";
        }
        s = s.replace("\n", "").replace("\r", "");
        s = s.replaceAll("\\(.*?\\)", "");
        s = s.replaceAll("\\*", "");
        s = s.replaceAll("[\\s_]+", "");
        return s.toLowerCase(Locale.ROOT);
    }

    public static List<String> normalizeAll(Collection<String> headers) {
        if (headers == null || headers.isEmpty()) {
            return List.of();
        }
        List<String> normalized = new ArrayList<>();
        for (String header : headers) {
            String value = normalize(header);
            if (!value.isBlank()) {
                normalized.add(value);
            }
        }
        return normalized;
    }
}
