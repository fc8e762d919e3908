package com.example.routing.risk;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;

public record RiskFactor(
    @JsonProperty("name") String name,
    @JsonProperty("description") String description,
    @JsonProperty("weight") double weight,
    @JsonProperty("value") Object value,
    @JsonProperty("impact") Impact impact
) {

    public enum Impact {
        INCREASE("increase"),
        DECREASE("decrease"),
        NEUTRAL("neutral");

        private final String value;

        Impact(String value) {
            this.value = value;
        }

        @JsonValue
        public String value() {
            return value;
        }
    }

    public RiskFactor {
        if (weight < 0.0 || weight > 1.0) {
            throw new IllegalArgumentException("weight must be between 0.0 and 1.0, got " + weight);
        }
        impact = impact != null ? impact : Impact.NEUTRAL;
    }

    /** Signed contribution to the risk score. */
    double scoreContribution() {
        return switch (impact) {
            case INCREASE -> weight * 0.1;
            case DECREASE -> -weight * 0.1;
            case NEUTRAL -> 0.0;
        };
    }
}
