package com.eyelevel.batchorchestrator.model;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Locale;
import java.util.Map;

/**
 * Subscription tiers. Profiles store the plan as free text (English keys, marketing names or
 * localized labels), so {@link #fromValue(String)} normalizes leniently and defaults to the most
 * conservative tier.
 */
@Getter
@AllArgsConstructor
public enum PlanKey {
    FREE("free"),
    PERSONAL("personal"),
    PRO("pro"),
    ENTERPRISE("enterprise");

    private static final Map<String, PlanKey> ALIASES = Map.ofEntries(
            Map.entry("free", FREE),
            Map.entry("personal", PERSONAL),
            Map.entry("pro", PRO),
            Map.entry("professional", PRO),
            Map.entry("enterprise", ENTERPRISE),
            Map.entry("个人版", PERSONAL),
            Map.entry("个人", PERSONAL),
            Map.entry("专业版", PRO),
            Map.entry("专业", PRO),
            Map.entry("企业版", ENTERPRISE),
            Map.entry("企业", ENTERPRISE),
            Map.entry("基础版", FREE),
            Map.entry("基础", FREE),
            Map.entry("免费版", FREE),
            Map.entry("免费", FREE));

    private final String value;

    public static PlanKey fromValue(String raw) {
        if (raw == null) {
            return FREE;
        }
        String trimmed = raw.trim();
        String lower = trimmed.toLowerCase(Locale.ROOT);
        PlanKey direct = ALIASES.containsKey(trimmed) ? ALIASES.get(trimmed) : ALIASES.get(lower);
        if (direct != null) {
            return direct;
        }
        if (lower.contains("enterprise") || trimmed.contains("企业")) {
            return ENTERPRISE;
        }
        if (lower.contains("pro") || trimmed.contains("专业")) {
            return PRO;
        }
        if (lower.contains("personal") || trimmed.contains("个人")) {
            return PERSONAL;
        }
        return FREE;
    }
}
