package io.github.drompincen.bandwidth.runtime.schedule;

import io.github.drompincen.bandwidth.protocol.api.PlannerSettings;

import java.util.List;
import java.util.Locale;

/**
 * Fuzzy match between the role a task asks for and the role label a resource
 * carries. All comparisons are case-insensitive.
 */
public class RoleCompatibility {

    private final PlannerSettings settings;

    public RoleCompatibility(PlannerSettings settings) {
        this.settings = settings;
    }

    public boolean isWildcard(String requiredRole) {
        return requiredRole == null || requiredRole.isBlank()
                || settings.wildcardRequiredRoles().contains(normalize(requiredRole));
    }

    public boolean isCompatible(String requiredRole, String resourceRole) {
        if (isWildcard(requiredRole)) return true;
        // a blank label would be "contained by" every synonym
        if (resourceRole == null || resourceRole.isBlank()) return false;

        String required = normalize(requiredRole);
        String actual = normalize(resourceRole);
        if (actual.equals(required)) return true;
        if (settings.universalResourceRoles().contains(actual)) return true;

        List<String> synonyms = settings.roleSynonyms().get(required);
        if (synonyms == null) return false;
        for (String synonym : synonyms) {
            String candidate = normalize(synonym);
            if (actual.contains(candidate) || candidate.contains(actual)) return true;
        }
        return false;
    }

    private static String normalize(String role) {
        return role.trim().toLowerCase(Locale.ROOT);
    }
}
