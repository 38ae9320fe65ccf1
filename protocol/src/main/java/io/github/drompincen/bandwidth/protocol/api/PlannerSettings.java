package io.github.drompincen.bandwidth.protocol.api;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Tunables shared by the timeline projector and the assignment planner.
 *
 * @param planningHorizonWeeks   weeks the assignment planner looks ahead
 * @param projectionHorizonWeeks weeks the timeline projector fills before giving up
 * @param highPriorityThreshold  priority at or above which week-1 placements get the urgency bonus
 * @param nearCapacityRatio      week-1 utilization above which a resource is reported as near capacity
 * @param roleSynonyms           canonical required role (lower case) to acceptable resource role fragments
 * @param universalResourceRoles resource roles (lower case) that can take any task
 * @param wildcardRequiredRoles  required roles (lower case) that any resource satisfies
 */
public record PlannerSettings(
        int planningHorizonWeeks,
        int projectionHorizonWeeks,
        int highPriorityThreshold,
        double nearCapacityRatio,
        Map<String, List<String>> roleSynonyms,
        Set<String> universalResourceRoles,
        Set<String> wildcardRequiredRoles
) {
    public static final int DEFAULT_HORIZON_WEEKS = 12;
    public static final int DEFAULT_HIGH_PRIORITY_THRESHOLD = 80;
    public static final double DEFAULT_NEAR_CAPACITY_RATIO = 0.9;

    public PlannerSettings {
        if (planningHorizonWeeks <= 0) {
            throw new IllegalArgumentException("planningHorizonWeeks must be positive: " + planningHorizonWeeks);
        }
        if (projectionHorizonWeeks <= 0) {
            throw new IllegalArgumentException("projectionHorizonWeeks must be positive: " + projectionHorizonWeeks);
        }
        roleSynonyms = roleSynonyms != null ? Map.copyOf(roleSynonyms) : Map.of();
        universalResourceRoles = universalResourceRoles != null ? Set.copyOf(universalResourceRoles) : Set.of();
        wildcardRequiredRoles = wildcardRequiredRoles != null ? Set.copyOf(wildcardRequiredRoles) : Set.of();
    }

    public static PlannerSettings defaults() {
        return new PlannerSettings(DEFAULT_HORIZON_WEEKS, DEFAULT_HORIZON_WEEKS,
                DEFAULT_HIGH_PRIORITY_THRESHOLD, DEFAULT_NEAR_CAPACITY_RATIO,
                defaultRoleSynonyms(), Set.of("other", "general"), Set.of("any"));
    }

    public static Map<String, List<String>> defaultRoleSynonyms() {
        Map<String, List<String>> synonyms = new LinkedHashMap<>();
        synonyms.put("developer", List.of("developer", "full stack developer", "backend developer", "frontend developer"));
        synonyms.put("designer", List.of("designer", "ui designer", "ux designer", "graphic designer"));
        synonyms.put("manager", List.of("manager", "project manager", "team lead"));
        synonyms.put("copywriter", List.of("copywriter", "content writer", "marketing specialist"));
        return synonyms;
    }

    public PlannerSettings withPlanningHorizon(int weeks) {
        return new PlannerSettings(weeks, projectionHorizonWeeks, highPriorityThreshold,
                nearCapacityRatio, roleSynonyms, universalResourceRoles, wildcardRequiredRoles);
    }

    public PlannerSettings withProjectionHorizon(int weeks) {
        return new PlannerSettings(planningHorizonWeeks, weeks, highPriorityThreshold,
                nearCapacityRatio, roleSynonyms, universalResourceRoles, wildcardRequiredRoles);
    }
}
