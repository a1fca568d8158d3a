package io.markwise.core.provider;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

public final class ProviderRouting {
    private static final String ANTHROPIC_PREFIX = "anthropic/";

    private ProviderRouting() {
    }

    public static boolean pinnedToAnthropic(String model) {
        return model != null && model.toLowerCase(Locale.ROOT).contains("claude");
    }

    public static String resolveModel(String model) {
        if (!pinnedToAnthropic(model)) {
            return model;
        }
        String adjusted = model.replace("google/", ANTHROPIC_PREFIX);
        if (!adjusted.startsWith(ANTHROPIC_PREFIX) && !adjusted.contains("/")) {
            adjusted = ANTHROPIC_PREFIX + adjusted;
        }
        return adjusted;
    }

    public static Map<String, Object> providerPreferences(String model) {
        Map<String, Object> provider = new LinkedHashMap<>();
        provider.put("allow_fallbacks", false);
        if (pinnedToAnthropic(model)) {
            provider.put("require_parameters", true);
            provider.put("order", List.of("Anthropic"));
        }
        return provider;
    }
}
