package com.talewright.core.continuity;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * The run's canonical character names and the aliases they may appear under in prose.
 * <p>
 * A multi-word name is also matched by its first word, so "Mara Vell" is recognised as "Mara".
 */
public final class EntityNames {

    private final Map<String, String> aliasToCanonical = new LinkedHashMap<>();

    private EntityNames() {}

    public static EntityNames of(Collection<String> canonicalNames) {
        EntityNames names = new EntityNames();
        for (String name : canonicalNames) {
            if (name == null || name.isBlank()) {
                continue;
            }
            String trimmed = name.trim();
            names.aliasToCanonical.putIfAbsent(trimmed, trimmed);
            String first = trimmed.split("\\s+")[0];
            if (first.length() >= 3) {
                names.aliasToCanonical.putIfAbsent(first, trimmed);
            }
        }
        return names;
    }

    public boolean isEmpty() {
        return aliasToCanonical.isEmpty();
    }

    public Collection<String> aliases() {
        return aliasToCanonical.keySet();
    }

    public String canonical(String alias) {
        return aliasToCanonical.get(alias);
    }

    /**
     * Whether a constraint key is admissible: {@code char_*} keys must name a known character,
     * {@code world_*} and {@code plot_*} keys are always admissible, anything else is refused.
     */
    public boolean admits(String key) {
        if (key.startsWith("world_") || key.startsWith("plot_")) {
            return true;
        }
        if (!key.startsWith("char_")) {
            return false;
        }
        for (String canonical : aliasToCanonical.values()) {
            if (key.startsWith("char_" + slug(canonical) + "_")) {
                return true;
            }
        }
        return false;
    }

    /** Lower-case, underscore-separated form of a name used inside constraint keys. */
    public static String slug(String name) {
        return name.trim().toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "_").replaceAll("^_+|_+$", "");
    }
}
