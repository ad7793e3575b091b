package com.example.inventory.service;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;

class WorkstationNameNormalizerTest {

    @Test
    void ignoresSurroundingWhitespaceAndCase() {
        assertThat(WorkstationNameNormalizer.normalize("  PC01 ")).isEqualTo(WorkstationNameNormalizer.normalize("pc01"));
        assertThat(WorkstationNameNormalizer.normalize("\tLab-01\n")).isEqualTo("lab-01");
    }

    @Test
    void keepsInnerWhitespace() {
        assertThat(WorkstationNameNormalizer.normalize("LAB 01")).isEqualTo("lab 01");
        assertThat(WorkstationNameNormalizer.sameWorkstation("LAB 01", "LAB01")).isFalse();
    }

    @Test
    void composesCombiningCharacters() {
        String decomposed = "Cafe\u0301-PC";
        String precomposed = "CAF\u00C9-PC";

        assertThat(WorkstationNameNormalizer.normalize(decomposed)).isEqualTo("caf\u00e9-pc");
        assertThat(WorkstationNameNormalizer.sameWorkstation(decomposed, precomposed)).isTrue();
    }

    @Test
    void isIdempotent() {
        List<String> samples = List.of("", "   ", "PC01", "  pc01  ", "Café", "İSTANBUL-01",
                "ß-Station", "Lab 01 ", "ÅNGSTRÖM", "Ω-ohm");
        for (String sample : samples) {
            String once = WorkstationNameNormalizer.normalize(sample);
            assertThat(WorkstationNameNormalizer.normalize(once)).as("normalize twice: %s", sample).isEqualTo(once);
        }
    }

    @Test
    void blankAndNullBecomeEmpty() {
        assertThat(WorkstationNameNormalizer.normalize(null)).isEmpty();
        assertThat(WorkstationNameNormalizer.normalize("")).isEmpty();
        assertThat(WorkstationNameNormalizer.normalize(" \t ")).isEmpty();
    }

    @Test
    void emptyNameNeverMatches() {
        assertThat(WorkstationNameNormalizer.sameWorkstation("", "PC01")).isFalse();
        assertThat(WorkstationNameNormalizer.sameWorkstation("  ", "")).isFalse();
        assertThat(WorkstationNameNormalizer.sameWorkstation(null, null)).isFalse();
    }

    @Test
    void doesNotDependOnDefaultLocale() {
        Locale previous = Locale.getDefault();
        try {
            Locale.setDefault(Locale.forLanguageTag("tr-TR"));
            assertThat(WorkstationNameNormalizer.normalize("TITLE-PC")).isEqualTo("title-pc");
        } finally {
            Locale.setDefault(previous);
        }
    }
}
