package com.rfpanalytics.domain.service;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Board color names to hex values. Immutable once built.
 */
public final class ColorPalette {

    private final Map<String, String> colors;

    public ColorPalette(Map<String, String> colors) {
        Map<String, String> normalized = new HashMap<>();
        colors.forEach((name, hex) -> normalized.put(normalizeName(name), hex));
        this.colors = Map.copyOf(normalized);
    }

    /**
     * Resolves a board color name ("done_green", "Dark-Blue") or passes a
     * literal "#rrggbb" through. Empty for anything unknown.
     */
    public Optional<String> resolve(String color) {
        if (color == null || color.isBlank()) {
            return Optional.empty();
        }
        String hex = colors.get(normalizeName(color));
        if (hex != null) {
            return Optional.of(hex);
        }
        return color.startsWith("#") ? Optional.of(color) : Optional.empty();
    }

    private static String normalizeName(String name) {
        return name.trim().toLowerCase(Locale.ROOT).replace('_', '-');
    }
}
