package io.github.drompincen.bandwidth.runtime.config;

import io.github.drompincen.bandwidth.protocol.api.PlannerSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.PropertySource;
import org.springframework.core.env.Environment;

import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Wires the scheduling engine. Defaults live in {@code bandwidth-planner.properties};
 * any {@code bandwidth.planner.*} property from the environment or a {@code -D} flag wins.
 */
@Configuration
@ComponentScan("io.github.drompincen.bandwidth.runtime")
@PropertySource("classpath:bandwidth-planner.properties")
public class SchedulingConfig {

    private static final Logger log = LoggerFactory.getLogger(SchedulingConfig.class);

    @Bean
    PlannerSettings plannerSettings(Environment environment) {
        PlannerSettings defaults = PlannerSettings.defaults();
        PlannerSettings settings = new PlannerSettings(
                environment.getProperty("bandwidth.planner.horizon-weeks", Integer.class,
                        defaults.planningHorizonWeeks()),
                environment.getProperty("bandwidth.planner.projection-horizon-weeks", Integer.class,
                        defaults.projectionHorizonWeeks()),
                environment.getProperty("bandwidth.planner.high-priority-threshold", Integer.class,
                        defaults.highPriorityThreshold()),
                environment.getProperty("bandwidth.planner.near-capacity-ratio", Double.class,
                        defaults.nearCapacityRatio()),
                defaults.roleSynonyms(),
                roles(environment.getProperty("bandwidth.planner.universal-resource-roles", String[].class),
                        defaults.universalResourceRoles()),
                roles(environment.getProperty("bandwidth.planner.wildcard-required-roles", String[].class),
                        defaults.wildcardRequiredRoles()));
        log.info("Planner settings: planning horizon={} weeks, projection horizon={} weeks, high priority>={}",
                settings.planningHorizonWeeks(), settings.projectionHorizonWeeks(), settings.highPriorityThreshold());
        return settings;
    }

    private static Set<String> roles(String[] configured, Set<String> fallback) {
        if (configured == null || configured.length == 0) return fallback;
        return Stream.of(configured)
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .map(s -> s.toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());
    }
}
