package com.example.routing.risk;

import java.time.DayOfWeek;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Environment and timing facts that adjust a policy's base risk level.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AssessmentContext(
    @JsonProperty("is_production") boolean isProduction,
    @JsonProperty("is_staging") boolean isStaging,
    @JsonProperty("is_weekend") boolean isWeekend,
    @JsonProperty("is_business_hours") Boolean isBusinessHours,
    @JsonProperty("is_urgent") boolean isUrgent,
    @JsonProperty("user_role") String userRole,
    @JsonProperty("affected_systems") List<String> affectedSystems,
    @JsonProperty("custom_factors") Map<String, Object> customFactors
) {

    private static final int BUSINESS_DAY_START = 9;
    private static final int BUSINESS_DAY_END = 18;

    public AssessmentContext {
        isBusinessHours = isBusinessHours == null || isBusinessHours;
        affectedSystems = affectedSystems == null ? List.of() : List.copyOf(affectedSystems);
        customFactors = customFactors == null ? Map.of() : Map.copyOf(customFactors);
    }

    public static AssessmentContext empty() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private boolean production;
        private boolean staging;
        private boolean weekend;
        private boolean businessHours = true;
        private boolean urgent;
        private String userRole;
        private List<String> affectedSystems = List.of();
        private Map<String, Object> customFactors = Map.of();

        private Builder() {}

        public Builder production(boolean production) {
            this.production = production;
            return this;
        }

        public Builder staging(boolean staging) {
            this.staging = staging;
            return this;
        }

        public Builder weekend(boolean weekend) {
            this.weekend = weekend;
            return this;
        }

        public Builder businessHours(boolean businessHours) {
            this.businessHours = businessHours;
            return this;
        }

        public Builder urgent(boolean urgent) {
            this.urgent = urgent;
            return this;
        }

        public Builder userRole(String userRole) {
            this.userRole = userRole;
            return this;
        }

        public Builder affectedSystems(List<String> affectedSystems) {
            this.affectedSystems = affectedSystems;
            return this;
        }

        public Builder customFactors(Map<String, Object> customFactors) {
            this.customFactors = customFactors;
            return this;
        }

        /** Derives the weekend and business-hours flags from a wall-clock time. */
        public Builder at(ZonedDateTime time) {
            DayOfWeek day = time.getDayOfWeek();
            this.weekend = day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY;
            int hour = time.getHour();
            this.businessHours = !weekend && hour >= BUSINESS_DAY_START && hour < BUSINESS_DAY_END;
            return this;
        }

        public AssessmentContext build() {
            return new AssessmentContext(production, staging, weekend, businessHours, urgent, userRole,
                affectedSystems, customFactors);
        }
    }
}
