package dev.heapqueue.config;

import lombok.Getter;
import lombok.Setter;
import lombok.experimental.Accessors;

@Getter
@Setter
@Accessors(chain = true)
public class HeapConfig {
    // System property helpers for test configurability (safe fallbacks)
    private static boolean boolProp(String key, boolean def) {
        String v = System.getProperty(key);
        return v == null ? def : Boolean.parseBoolean(v);
    }
    private static int nonNegativeIntProp(String key, int def) {
        String v = System.getProperty(key);
        if (v == null) return def;
        try {
            int parsed = Integer.parseInt(v.trim());
            return parsed < 0 ? def : parsed;
        } catch (NumberFormatException e) { return def; }
    }

    // Backing array
    private int initialCapacity = nonNegativeIntProp("hq.initialCapacity", 16); // pre-sized slots, grows past this as needed

    // Diagnostics
    private boolean verifyInvariants = boolProp("hq.verifyInvariants", false); // re-check heap property after each mutation
}
