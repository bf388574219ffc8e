package dev.sfc.engine;

import dev.sfc.model.Step;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;

/**
 * Steps grouped by identical action text. Groups are ordered by text, members
 * by numeric step ID.
 */
public final class ActionGroups {

    private final SortedMap<String, List<Step>> groups;

    ActionGroups(SortedMap<String, List<Step>> groups) {
        this.groups = Collections.unmodifiableSortedMap(groups);
    }

    public SortedMap<String, List<Step>> groups() {
        return groups;
    }

    public List<Step> stepsFor(String actionText) {
        if (actionText == null) {
            return List.of();
        }
        return groups.getOrDefault(actionText, List.of());
    }

    /**
     * The same grouping with each step replaced by its operand number. Steps
     * without an operand number are left out.
     */
    public Map<String, List<Integer>> operandNumbersByAction() {
        var result = new LinkedHashMap<String, List<Integer>>();
        for (var entry : groups.entrySet()) {
            var numbers = new ArrayList<Integer>();
            for (Step step : entry.getValue()) {
                if (step.operandNumber() != null) {
                    numbers.add(step.operandNumber());
                }
            }
            result.put(entry.getKey(), List.copyOf(numbers));
        }
        return result;
    }

    public int size() {
        return groups.size();
    }

    public boolean isEmpty() {
        return groups.isEmpty();
    }
}
