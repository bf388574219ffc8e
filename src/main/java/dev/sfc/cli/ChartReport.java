package dev.sfc.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.sfc.engine.SfcChart;
import dev.sfc.model.Branch;
import dev.sfc.model.Step;
import dev.sfc.model.Transition;

import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Renders a resolved chart as text or JSON.
 */
public final class ChartReport {

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .enable(SerializationFeature.INDENT_OUTPUT);

    private ChartReport() {}

    public static String text(SfcChart chart, Collection<Step> steps) {
        var sb = new StringBuilder();
        for (Step step : steps) {
            sb.append("Step ").append(step.id()).append(" (").append(step.operand()).append(")");
            if (step.initial()) {
                sb.append(" [initial]");
            }
            if (step.preset() != null) {
                sb.append(" preset=").append(step.preset()).append("ms");
            }
            sb.append("\n");
            sb.append("  in:  ").append(operands(chart.incomingTransitions(step))).append("\n");
            sb.append("  out: ").append(operands(chart.outgoingTransitions(step))).append("\n");
            for (Transition transition : chart.outgoingTransitions(step)) {
                sb.append("    ").append(transition.operand()).append(" -> ")
                  .append(stepOperands(chart.toSteps(transition)));
                if (!transition.condition().isEmpty()) {
                    sb.append("  when ").append(String.join(" ", transition.condition()));
                }
                sb.append("\n");
            }
        }
        return sb.toString();
    }

    public static String actions(SfcChart chart) {
        return actions(chart, chart.steps());
    }

    /**
     * Action groups that contain at least one of {@code steps}. Each group
     * still lists all of its members.
     */
    public static String actions(SfcChart chart, Collection<Step> steps) {
        Set<String> wanted = ids(steps);
        var groups = chart.actionGroups().groups();
        var sb = new StringBuilder();
        for (Map.Entry<String, List<Integer>> entry : chart.actionGroups().operandNumbersByAction().entrySet()) {
            if (groups.get(entry.getKey()).stream().noneMatch(step -> wanted.contains(step.id()))) {
                continue;
            }
            sb.append(entry.getValue()).append("\n");
            entry.getKey().lines().forEach(line -> sb.append("    ").append(line).append("\n"));
        }
        return sb.toString();
    }

    public static ObjectNode json(SfcChart chart) {
        return json(chart, chart.steps(), chart.transitions(), true);
    }

    /**
     * JSON for a subset of steps: only the transitions entering or leaving
     * them are listed, and branches are left out.
     */
    public static ObjectNode json(SfcChart chart, Collection<Step> steps) {
        Set<String> adjacent = new HashSet<>();
        for (Step step : steps) {
            adjacent.addAll(step.incoming());
            adjacent.addAll(step.outgoing());
        }
        List<Transition> transitions = chart.transitions().stream()
            .filter(transition -> adjacent.contains(transition.id()))
            .toList();
        return json(chart, steps, transitions, false);
    }

    private static ObjectNode json(SfcChart chart, Collection<Step> steps,
                                   Collection<Transition> transitions, boolean withBranches) {
        ObjectNode root = MAPPER.createObjectNode();

        ArrayNode stepsNode = root.putArray("steps");
        for (Step step : steps) {
            ObjectNode node = stepsNode.addObject();
            node.put("id", step.id());
            node.put("operand", step.operand());
            node.put("operandNumber", step.operandNumber());
            node.put("initial", step.initial());
            node.put("preset", step.preset());
            addAll(node.putArray("actions"), step.actions());
            addAll(node.putArray("incoming"), step.incoming());
            addAll(node.putArray("outgoing"), step.outgoing());
        }

        ArrayNode transitionsNode = root.putArray("transitions");
        for (Transition transition : transitions) {
            ObjectNode node = transitionsNode.addObject();
            node.put("id", transition.id());
            node.put("operand", transition.operand());
            node.put("operandNumber", transition.operandNumber());
            addAll(node.putArray("condition"), transition.condition());
            addAll(node.putArray("fromSteps"), transition.fromSteps());
            addAll(node.putArray("toSteps"), transition.toSteps());
        }

        if (!withBranches) {
            return root;
        }
        ArrayNode branchesNode = root.putArray("branches");
        for (Branch branch : chart.branches()) {
            ObjectNode node = branchesNode.addObject();
            node.put("id", branch.id());
            node.put("flow", branch.flow().name());
            node.put("kind", branch.kind());
            addAll(node.putArray("legs"), branch.legs());
        }
        return root;
    }

    public static String jsonString(ObjectNode root) {
        try {
            return MAPPER.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render chart as JSON", e);
        }
    }

    private static Set<String> ids(Collection<Step> steps) {
        return steps.stream().map(Step::id).collect(Collectors.toSet());
    }

    private static void addAll(ArrayNode array, List<String> values) {
        values.forEach(array::add);
    }

    private static String operands(List<Transition> transitions) {
        return transitions.stream().map(Transition::operand).toList().toString();
    }

    private static String stepOperands(List<Step> steps) {
        return steps.stream().map(Step::operand).toList().toString();
    }
}
