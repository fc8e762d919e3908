package com.example.routing.gateway;

import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import com.example.routing.config.RuleTables;
import com.example.routing.model.IntentCategory;
import com.example.routing.model.RiskLevel;
import com.example.routing.model.RoutingDecision;
import com.example.routing.model.RoutingLayer;
import com.example.routing.model.WorkflowType;
import com.example.routing.pattern.PatternMatcher;

import io.opentelemetry.api.OpenTelemetry;

import static org.junit.jupiter.api.Assertions.*;

class ServiceNowHandlerTest {

    private final ServiceNowHandler handler = new ServiceNowHandler(
        new PatternMatcher(RuleTables.defaults().patternRules(), OpenTelemetry.noop()),
        new PayloadValidator(false));

    @Test
    void mappedCategoryIsAuthoritative() {
        RoutingDecision decision = handler.process(IncomingRequest.fromServiceNow(Map.of(
            "number", "INC0010001",
            "category", "Incident",
            "subcategory", "Database",
            "priority", "2")));

        assertEquals(IntentCategory.INCIDENT, decision.intentCategory());
        assertEquals("database_issue", decision.subIntent());
        assertEquals(1.0, decision.confidence());
        assertEquals("servicenow:incident/database", decision.ruleId());
        assertEquals(RiskLevel.HIGH, decision.riskLevel());
        assertEquals(RoutingLayer.SERVICENOW_MAPPING, decision.routingLayer());
        assertTrue(decision.completeness().isComplete());
        assertEquals("INC0010001", decision.metadata().get("ticket_number"));
    }

    @Test
    void unmappedPairFallsBackToPatternsOnShortDescription() {
        RoutingDecision decision = handler.process(IncomingRequest.fromServiceNow(Map.of(
            "category", "incident",
            "subcategory", "other",
            "short_description", "ETL 今天跑失敗了")));

        assertEquals("etl_failure", decision.subIntent());
        assertEquals("incident_etl_failure", decision.ruleId());
        assertEquals("pattern", decision.metadata().get("fallback"));
        assertEquals(WorkflowType.SEQUENTIAL, decision.workflowType());
    }

    @Test
    void unknownCategoryDefaultsToGenericIncident() {
        RoutingDecision decision = handler.process(IncomingRequest.fromServiceNow(Map.of(
            "category", "facilities",
            "short_description", "今天天氣很好")));

        assertEquals(IntentCategory.INCIDENT, decision.intentCategory());
        assertEquals("general_incident", decision.subIntent());
        assertEquals(0.5, decision.confidence());
        assertEquals("default", decision.metadata().get("fallback"));
    }

    @Test
    void knownCategoryWithUnmappedSubcategoryKeepsCategory() {
        RoutingDecision decision = handler.process(IncomingRequest.fromServiceNow(Map.of(
            "category", "request",
            "subcategory", "furniture")));

        assertEquals(IntentCategory.REQUEST, decision.intentCategory());
        assertEquals("general_request", decision.subIntent());
    }

    @ParameterizedTest
    @CsvSource({
        "1,            CRITICAL",
        "P2,           HIGH",
        "'3 - Moderate', MEDIUM",
        "4,            LOW",
        "5,            LOW",
    })
    void priorityDecidesRisk(String priority, RiskLevel expected) {
        assertEquals(Optional.of(expected), ServiceNowHandler.priorityRisk(Optional.of(priority)));
    }

    @Test
    void missingOrUnparseablePriorityYieldsNothing() {
        assertTrue(ServiceNowHandler.priorityRisk(Optional.empty()).isEmpty());
        assertTrue(ServiceNowHandler.priorityRisk(Optional.of("urgent")).isEmpty());
    }
}
