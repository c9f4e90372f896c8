package com.payments.controls.domain;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Portfolio-level counts of one engine run: how many transactions were evaluated,
 * how many hits they produced and how final actions split overall and per rail.
 */
public record RunSummary(
        int transactions,
        int hits,
        int controlsFired,
        Map<ControlAction, Integer> actionCounts,
        Map<String, Integer> railCounts
) {

    public RunSummary {
        Map<ControlAction, Integer> actionCopy = new EnumMap<>(ControlAction.class);
        actionCopy.putAll(actionCounts);
        actionCounts = Collections.unmodifiableMap(actionCopy);
        railCounts = Collections.unmodifiableMap(new TreeMap<>(railCounts));
    }

    public static RunSummary of(List<ControlDecision> decisions, List<ControlHit> hits, List<ControlMetric> metrics) {
        Map<ControlAction, Integer> actionCounts = new EnumMap<>(ControlAction.class);
        for (ControlAction action : ControlAction.values()) {
            actionCounts.put(action, 0);
        }
        Map<String, Integer> railCounts = new TreeMap<>();
        for (ControlDecision decision : decisions) {
            actionCounts.merge(decision.finalAction(), 1, Integer::sum);
            railCounts.merge(String.valueOf(decision.rail()), 1, Integer::sum);
        }
        return new RunSummary(decisions.size(), hits.size(), metrics.size(), actionCounts, railCounts);
    }

    public int count(ControlAction action) {
        return actionCounts.getOrDefault(action, 0);
    }

    /**
     * Share of transactions resolved to the given action, in percent.
     */
    public double percent(ControlAction action) {
        if (transactions == 0) {
            return 0.0;
        }
        return 100.0 * count(action) / transactions;
    }
}
