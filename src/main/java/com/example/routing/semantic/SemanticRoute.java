package com.example.routing.semantic;

import java.util.List;

import com.example.routing.model.IntentCategory;
import com.example.routing.model.RiskLevel;
import com.example.routing.model.WorkflowType;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SemanticRoute(
    @JsonProperty("name") String name,
    @JsonProperty("category") IntentCategory category,
    @JsonProperty("sub_intent") String subIntent,
    @JsonProperty("utterances") List<String> utterances,
    @JsonProperty("workflow_type") WorkflowType workflowType,
    @JsonProperty("risk_level") RiskLevel riskLevel,
    @JsonProperty("description") String description
) {

    public SemanticRoute {
        category = category != null ? category : IntentCategory.UNKNOWN;
        utterances = utterances == null ? List.of() : List.copyOf(utterances);
        description = description != null ? description : "";
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record RouteFile(@JsonProperty("version") String version, @JsonProperty("routes") List<SemanticRoute> routes) {
        public RouteFile {
            routes = routes == null ? List.of() : List.copyOf(routes);
        }
    }
}
