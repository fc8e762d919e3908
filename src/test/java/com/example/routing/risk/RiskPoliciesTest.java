package com.example.routing.risk;

import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import com.example.routing.config.RuleTables;
import com.example.routing.model.IntentCategory;
import com.example.routing.model.RiskLevel;

import static org.junit.jupiter.api.Assertions.*;

class RiskPoliciesTest {

    private static final RiskPolicy.PolicyFile FILE = RuleTables.defaults().riskPolicies();

    static RiskPolicy policy(String id, IntentCategory category, String subIntent, RiskLevel level,
                             Boolean enabled, Integer priority) {
        return new RiskPolicy(id, category, subIntent, level, false, null, null, null, enabled, priority);
    }

    @ParameterizedTest
    @CsvSource({
        "incident, etl_failure,     incident_etl_failure,    high",
        "incident, software_issue,  incident_software_issue, medium",
        "incident, no_such_intent,  incident_default,        medium",
        "change,   emergency_change, change_emergency_change, critical",
        "query,    status_inquiry,  query_status_inquiry,    low",
        "unknown,  anything,        unknown_default,         medium",
    })
    void lookupFallsBackFromExactToCategoryDefault(String category, String subIntent, String policyId,
                                                   String level) {
        RiskPolicies policies = RiskPolicies.fromFile(FILE, "default");

        RiskPolicy found = policies.lookup(IntentCategory.fromString(category), subIntent);

        assertEquals(policyId, found.id());
        assertEquals(RiskLevel.fromString(level), found.defaultRiskLevel());
    }

    @Test
    void missingSubIntentUsesCategoryDefault() {
        RiskPolicies policies = RiskPolicies.fromFile(FILE, null);

        assertEquals("incident_default", policies.lookup(IntentCategory.INCIDENT, null).id());
        assertEquals("incident_default", policies.lookup(IntentCategory.INCIDENT, " ").id());
        assertEquals("unknown_default", policies.lookup(null, null).id());
    }

    @Test
    void emptyTableFallsBackToGlobalDefault() {
        RiskPolicies policies = new RiskPolicies(List.of(), null);

        RiskPolicy found = policies.lookup(IntentCategory.CHANGE, "database_change");

        assertEquals("global_default", found.id());
        assertEquals(RiskLevel.MEDIUM, found.defaultRiskLevel());
        assertSame(policies.globalDefault(), found);
    }

    @Test
    void forPresetUsesBundledTable() {
        RiskPolicies strict = RiskPolicies.forPreset("strict");

        assertEquals("strict_incident_default", strict.lookup(IntentCategory.INCIDENT, "unlisted").id());
        assertEquals(FILE.policies().size(), RiskPolicies.forPreset("default").all().size());
        assertEquals(RiskPolicies.fromFile(FILE, null).globalDefault(),
            RiskPolicies.forPreset(null).globalDefault());
    }

    @Test
    void strictPresetRaisesCategoryDefaultsButKeepsExactPolicies() {
        RiskPolicies policies = RiskPolicies.fromFile(FILE, "strict");

        assertEquals("strict_incident_default", policies.lookup(IntentCategory.INCIDENT, "unlisted").id());
        assertEquals(RiskLevel.HIGH, policies.lookup(IntentCategory.CHANGE, "unlisted").defaultRiskLevel());
        assertEquals(RiskLevel.MEDIUM, policies.lookup(IntentCategory.INCIDENT, "software_issue").defaultRiskLevel());
    }

    @Test
    void relaxedPresetLowersChangeDefault() {
        RiskPolicies policies = RiskPolicies.fromFile(FILE, "relaxed");

        assertEquals(RiskLevel.LOW, policies.lookup(IntentCategory.CHANGE, "unlisted").defaultRiskLevel());
    }

    @Test
    void unknownPresetUsesDefaults() {
        assertEquals(FILE.policies().size(), RiskPolicies.withPreset(FILE, "paranoid").size());
    }

    @Test
    void higherPriorityWinsForSameKey() {
        RiskPolicies policies = new RiskPolicies(List.of(
            policy("low_prio", IntentCategory.REQUEST, "vpn", RiskLevel.LOW, true, 10),
            policy("high_prio", IntentCategory.REQUEST, "vpn", RiskLevel.HIGH, true, 90)), null);

        assertEquals("high_prio", policies.lookup(IntentCategory.REQUEST, "vpn").id());
    }

    @Test
    void disabledPoliciesAreNotIndexed() {
        RiskPolicies policies = new RiskPolicies(List.of(
            policy("off", IntentCategory.REQUEST, "vpn", RiskLevel.CRITICAL, false, null)), null);

        assertEquals("global_default", policies.lookup(IntentCategory.REQUEST, "vpn").id());
        assertEquals(1, policies.all().size());
    }

    @Test
    void addReplacesByIdAndRemoveReportsResult() {
        RiskPolicies policies = new RiskPolicies(List.of(
            policy("vpn", IntentCategory.REQUEST, "vpn", RiskLevel.LOW, true, null)), null);

        policies.add(policy("vpn", IntentCategory.REQUEST, "vpn", RiskLevel.HIGH, true, null));

        assertEquals(1, policies.all().size());
        assertEquals(RiskLevel.HIGH, policies.lookup(IntentCategory.REQUEST, "vpn").defaultRiskLevel());
        assertTrue(policies.remove("vpn"));
        assertFalse(policies.remove("vpn"));
        assertEquals("global_default", policies.lookup(IntentCategory.REQUEST, "vpn").id());
    }

    @Test
    void reloadSwapsTableAndGlobalDefault() {
        RiskPolicies policies = RiskPolicies.fromFile(FILE, null);
        RiskPolicy fallback = policy("fallback", IntentCategory.UNKNOWN, "*", RiskLevel.HIGH, true, 0);

        assertEquals(1, policies.reload(List.of(
            policy("only", IntentCategory.QUERY, "*", RiskLevel.LOW, true, null)), fallback));

        assertEquals("only", policies.lookup(IntentCategory.QUERY, "status_inquiry").id());
        assertEquals("fallback", policies.lookup(IntentCategory.INCIDENT, "etl_failure").id());
    }
}
