package dev.sfc.engine;

import dev.sfc.engine.Adjacency.Direction;
import dev.sfc.model.NodeKind;
import dev.sfc.model.Step;
import dev.sfc.model.Transition;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.Set;

/**
 * Finds, for every step and transition, its immediate neighbours of the
 * opposite kind and records them on both ends.
 *
 * <p>The search from a node walks through branches and legs only. It stops at
 * the first node of the opposite kind on each path and never passes through,
 * or reports, a node of its own kind.
 */
public final class RelationResolver {

    private final NodeRegistry registry;
    private final Adjacency adjacency;

    public RelationResolver(NodeRegistry registry, Adjacency adjacency) {
        this.registry = registry;
        this.adjacency = adjacency;
    }

    /**
     * Compute incoming/outgoing for every step and from/to for every
     * transition, sort them by {@link NodeIds#NUMERIC_ORDER} and bind them
     * onto the nodes. Every edge found from either end is recorded on both.
     */
    public void resolve() {
        var stepIncoming = new HashMap<String, Set<String>>();
        var stepOutgoing = new HashMap<String, Set<String>>();
        var fromSteps = new HashMap<String, Set<String>>();
        var toSteps = new HashMap<String, Set<String>>();

        for (Step step : registry.steps().values()) {
            for (String transitionId : neighbours(step.id(), Direction.FORWARD)) {
                record(stepOutgoing, step.id(), transitionId);
                record(fromSteps, transitionId, step.id());
            }
            for (String transitionId : neighbours(step.id(), Direction.REVERSE)) {
                record(stepIncoming, step.id(), transitionId);
                record(toSteps, transitionId, step.id());
            }
        }
        for (Transition transition : registry.transitions().values()) {
            for (String stepId : neighbours(transition.id(), Direction.FORWARD)) {
                record(toSteps, transition.id(), stepId);
                record(stepIncoming, stepId, transition.id());
            }
            for (String stepId : neighbours(transition.id(), Direction.REVERSE)) {
                record(fromSteps, transition.id(), stepId);
                record(stepOutgoing, stepId, transition.id());
            }
        }

        for (Step step : registry.steps().values()) {
            step.linkTransitions(sorted(stepIncoming, step.id()), sorted(stepOutgoing, step.id()));
        }
        for (Transition transition : registry.transitions().values()) {
            transition.linkSteps(sorted(fromSteps, transition.id()), sorted(toSteps, transition.id()));
        }
    }

    private static void record(Map<String, Set<String>> relations, String owner, String neighbour) {
        relations.computeIfAbsent(owner, k -> new HashSet<>()).add(neighbour);
    }

    private static List<String> sorted(Map<String, Set<String>> relations, String owner) {
        var ids = new ArrayList<>(relations.getOrDefault(owner, Set.of()));
        ids.sort(NodeIds.NUMERIC_ORDER);
        return ids;
    }

    /**
     * Immediate neighbours of the opposite kind reachable from {@code startId}
     * in the given direction, in discovery order. Returns an empty set when the
     * start is neither a step nor a transition.
     */
    public Set<String> neighbours(String startId, Direction direction) {
        NodeKind startKind = registry.kindOf(startId);
        NodeKind target;
        if (startKind == NodeKind.STEP) {
            target = NodeKind.TRANSITION;
        } else if (startKind == NodeKind.TRANSITION) {
            target = NodeKind.STEP;
        } else {
            return Set.of();
        }

        var found = new LinkedHashSet<String>();
        var visited = new HashSet<String>();
        Queue<String> queue = new ArrayDeque<>();
        visited.add(startId);
        queue.add(startId);

        while (!queue.isEmpty()) {
            String current = queue.poll();
            for (String next : adjacency.neighbours(current, direction)) {
                NodeKind kind = registry.kindOf(next);
                if (kind == target) {
                    found.add(next);
                } else if (kind.isPassThrough() && visited.add(next)) {
                    queue.add(next);
                }
                // Same-kind and unknown IDs end the path here.
            }
        }
        return found;
    }
}
