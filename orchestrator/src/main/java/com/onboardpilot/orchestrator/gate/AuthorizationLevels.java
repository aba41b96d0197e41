package com.onboardpilot.orchestrator.gate;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Ranked operator roles used to authorize gate bypasses.
 *
 * A supplied level authorizes a requirement when it is the same role, or
 * when it ranks strictly higher. Two different roles at the same rank
 * (it_manager and hr_manager, say) do not stand in for each other.
 */
public class AuthorizationLevels {

    private final Map<String, Integer> ranks = new HashMap<>();

    public AuthorizationLevels(Map<String, Integer> ranks) {
        if (ranks != null) {
            ranks.forEach((level, rank) -> this.ranks.put(normalize(level), rank));
        }
    }

    public boolean isKnown(String level) {
        return level != null && ranks.containsKey(normalize(level));
    }

    public boolean authorizes(String supplied, String required) {
        if (!isKnown(supplied) || !isKnown(required)) return false;
        String s = normalize(supplied);
        String r = normalize(required);
        return s.equals(r) || ranks.get(s) > ranks.get(r);
    }

    public Map<String, Integer> asMap() {
        return Map.copyOf(ranks);
    }

    private static String normalize(String level) {
        return level.trim().toLowerCase(Locale.ROOT).replace('-', '_');
    }
}
