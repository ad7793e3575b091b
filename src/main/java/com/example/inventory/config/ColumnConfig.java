package com.example.inventory.config;

import com.example.inventory.service.InventoryField;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Header aliases accepted for each inventory field and for the roster name column.
 * The canonical header of a field is always accepted, in addition to any alias.
 */
public record ColumnConfig(
        Map<InventoryField, List<String>> inventory,
        List<String> roster
) {
    public static final String DEFAULT_ROSTER_HEADER = "PC Name";

    public ColumnConfig {
        Map<InventoryField, List<String>> aliases = new EnumMap<>(InventoryField.class);
        for (InventoryField field : InventoryField.values()) {
            List<String> configured = inventory == null ? null : inventory.get(field);
            aliases.put(field, withPrimary(field.header(), configured));
        }
        inventory = aliases;
        roster = withPrimary(DEFAULT_ROSTER_HEADER, roster);
    }

    public static ColumnConfig defaults() {
        return new ColumnConfig(Map.of(), List.of());
    }

    public static ColumnConfig load(Resource resource, ObjectMapper mapper) {
        if (resource == null || !resource.exists()) {
            return defaults();
        }
        try (InputStream input = resource.getInputStream()) {
            ColumnConfig config = mapper.readValue(input, ColumnConfig.class);
            return config == null ? defaults() : config;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read column config " + resource.getDescription()
                    + ": " + e.getMessage(), e);
        }
    }

    public List<String> aliases(InventoryField field) {
        return inventory.get(field);
    }

    private static List<String> withPrimary(String primary, List<String> configured) {
        Set<String> names = new LinkedHashSet<>();
        names.add(primary);
        if (configured != null) {
            for (String name : configured) {
                if (name != null && !name.isBlank()) {
                    names.add(name.trim());
                }
            }
        }
        return List.copyOf(new ArrayList<>(names));
    }
}
