package io.github.drompincen.bandwidth.runtime.schedule;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Guesses the role a task needs from its title and description. Keywords match
 * anywhere in the lower-cased text, so "redesign" counts as design work and
 * "rebuild" as "ui"; the first role in declaration order wins.
 */
public final class RequiredRoleInference {

    public static final String ANY_ROLE = "any";

    private static final Map<String, List<String>> ROLE_KEYWORDS = new LinkedHashMap<>();

    static {
        ROLE_KEYWORDS.put("designer", List.of("design", "ui", "ux", "mockup"));
        ROLE_KEYWORDS.put("developer", List.of("code", "develop", "api", "database"));
        ROLE_KEYWORDS.put("manager", List.of("manage", "plan", "coordinate"));
        ROLE_KEYWORDS.put("copywriter", List.of("content", "copy", "write"));
    }

    private RequiredRoleInference() {}

    public static String infer(String title, String description) {
        String content = ((title != null ? title : "") + " " + (description != null ? description : ""))
                .toLowerCase(Locale.ROOT);
        for (Map.Entry<String, List<String>> entry : ROLE_KEYWORDS.entrySet()) {
            for (String keyword : entry.getValue()) {
                if (content.contains(keyword)) return entry.getKey();
            }
        }
        return ANY_ROLE;
    }
}
