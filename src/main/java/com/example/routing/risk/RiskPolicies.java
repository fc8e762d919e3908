package com.example.routing.risk;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.example.routing.config.RuleTables;
import com.example.routing.config.TableLoader;
import com.example.routing.model.IntentCategory;

/**
 * Policy table with a fixed lookup chain: exact (category, sub-intent), then
 * (category, "*"), then the global default. Lookup never fails.
 */
public class RiskPolicies {

    private static final Logger log = LoggerFactory.getLogger(RiskPolicies.class);

    record Table(List<RiskPolicy> policies, Map<String, RiskPolicy> index, RiskPolicy globalDefault) {}

    private final AtomicReference<Table> table = new AtomicReference<>();

    public RiskPolicies(List<RiskPolicy> policies, RiskPolicy globalDefault) {
        table.set(build(policies, globalDefault));
    }

    /** Default policies plus the named preset's overrides ("default" adds nothing). */
    public static RiskPolicies fromFile(RiskPolicy.PolicyFile file, String preset) {
        return new RiskPolicies(withPreset(file, preset), file.globalDefault());
    }

    /** The bundled policy table with the named preset applied. */
    public static RiskPolicies forPreset(String preset) {
        return fromFile(TableLoader.load(null, RuleTables.RISK_POLICIES, RiskPolicy.PolicyFile.class), preset);
    }

    public static List<RiskPolicy> withPreset(RiskPolicy.PolicyFile file, String preset) {
        List<RiskPolicy> policies = new ArrayList<>(file.policies());
        if (preset != null && !preset.isBlank() && !"default".equalsIgnoreCase(preset)) {
            List<RiskPolicy> extra = file.presets().get(preset);
            if (extra == null) {
                log.warn("Unknown risk policy preset '{}', using defaults", preset);
            } else {
                policies.addAll(extra);
                log.info("Applied risk policy preset '{}' ({} policies)", preset, extra.size());
            }
        }
        return policies;
    }

    public RiskPolicy lookup(IntentCategory category, String subIntent) {
        Table current = table.get();
        IntentCategory effective = category != null ? category : IntentCategory.UNKNOWN;
        if (subIntent != null && !subIntent.isBlank()) {
            RiskPolicy exact = current.index().get(RiskPolicy.key(effective, subIntent));
            if (exact != null) {
                return exact;
            }
        }
        RiskPolicy categoryDefault = current.index().get(RiskPolicy.key(effective, RiskPolicy.WILDCARD));
        if (categoryDefault != null) {
            return categoryDefault;
        }
        return current.globalDefault();
    }

    public void add(RiskPolicy policy) {
        table.updateAndGet(current -> {
            List<RiskPolicy> next = new ArrayList<>();
            for (RiskPolicy existing : current.policies()) {
                if (!existing.id().equals(policy.id())) {
                    next.add(existing);
                }
            }
            next.add(policy);
            return build(next, current.globalDefault());
        });
    }

    public boolean remove(String policyId) {
        Table before = table.get();
        Table after = table.updateAndGet(current -> build(
            current.policies().stream().filter(p -> !p.id().equals(policyId)).toList(),
            current.globalDefault()));
        return after.policies().size() < before.policies().size();
    }

    public int reload(List<RiskPolicy> policies, RiskPolicy globalDefault) {
        Table next = build(policies, globalDefault);
        table.set(next);
        log.info("Loaded {} risk policies ({} lookup keys)", next.policies().size(), next.index().size());
        return next.policies().size();
    }

    public List<RiskPolicy> all() {
        return table.get().policies();
    }

    public RiskPolicy globalDefault() {
        return table.get().globalDefault();
    }

    private static Table build(List<RiskPolicy> policies, RiskPolicy globalDefault) {
        List<RiskPolicy> valid = new ArrayList<>();
        for (RiskPolicy policy : policies == null ? List.<RiskPolicy>of() : policies) {
            if (policy == null || policy.id() == null) {
                log.warn("Skipping risk policy without id");
                continue;
            }
            valid.add(policy);
        }

        Map<String, RiskPolicy> index = new HashMap<>();
        valid.stream()
            .filter(RiskPolicy::enabled)
            .sorted(Comparator.comparingInt(RiskPolicy::priority).reversed())
            .forEach(policy -> index.putIfAbsent(policy.key(), policy));

        return new Table(List.copyOf(valid), Map.copyOf(index),
            globalDefault != null ? globalDefault : RiskPolicy.globalDefault());
    }
}
