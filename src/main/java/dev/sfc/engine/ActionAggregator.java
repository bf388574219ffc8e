package dev.sfc.engine;

import dev.sfc.model.Step;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.TreeMap;

/**
 * Groups steps that run the same structured-text action.
 */
public final class ActionAggregator {

    private static final Comparator<Step> BY_ID = Comparator.comparing(Step::id, NodeIds.NUMERIC_ORDER);

    private ActionAggregator() {}

    public static ActionGroups group(Collection<Step> steps) {
        var groups = new TreeMap<String, List<Step>>();
        for (Step step : steps) {
            String text = step.actionText();
            if (text.isEmpty()) {
                continue;
            }
            groups.computeIfAbsent(text, k -> new ArrayList<>()).add(step);
        }
        groups.values().forEach(members -> members.sort(BY_ID));
        groups.replaceAll((text, members) -> List.copyOf(members));
        return new ActionGroups(groups);
    }
}
