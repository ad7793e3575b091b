package com.example.inventory.service;

import java.text.Normalizer;
import java.util.Locale;

public final class WorkstationNameNormalizer {

    private WorkstationNameNormalizer() {
    }

    /**
     * Comparison key for a workstation name: trimmed, NFC, lower case.
     * Blank or {@code null} input yields the empty string.
     */
    public static String normalize(String raw) {
        if (raw == null) {
            return "";
        }
        String s = raw.strip();
        if (s.isEmpty()) {
            return "";
        }
        s = Normalizer.normalize(s, Normalizer.Form.NFC);
        // lower-casing may split a precomposed character, so compose again
        return Normalizer.normalize(s.toLowerCase(Locale.ROOT), Normalizer.Form.NFC);
    }

    public static boolean sameWorkstation(String left, String right) {
        String a = normalize(left);
        return !a.isEmpty() && a.equals(normalize(right));
    }
}
