package dev.sfc.engine;

import dev.sfc.model.Branch;
import dev.sfc.model.BranchFlow;
import dev.sfc.model.DirectedLink;
import dev.sfc.model.NodeKind;
import dev.sfc.model.Step;
import dev.sfc.model.Transition;
import dev.sfc.xml.Elements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Typed view of the children of an {@code SFCContent} element: steps,
 * transitions and branches keyed by ID, the directed links, and which
 * branch each leg belongs to.
 *
 * <p>Elements without an {@code ID} are skipped. A second element of the
 * same kind with the same ID replaces the first.
 */
public final class NodeRegistry {

    private static final Logger log = LoggerFactory.getLogger(NodeRegistry.class);

    private final Map<String, Step> steps;
    private final Map<String, Transition> transitions;
    private final Map<String, Branch> branches;
    private final Map<String, String> legToBranch;
    private final List<DirectedLink> directedLinks;
    private final Map<String, NodeKind> kinds;

    private NodeRegistry(Map<String, Step> steps,
                         Map<String, Transition> transitions,
                         Map<String, Branch> branches,
                         Map<String, String> legToBranch,
                         List<DirectedLink> directedLinks) {
        this.steps = Collections.unmodifiableMap(steps);
        this.transitions = Collections.unmodifiableMap(transitions);
        this.branches = Collections.unmodifiableMap(branches);
        this.legToBranch = Collections.unmodifiableMap(legToBranch);
        this.directedLinks = List.copyOf(directedLinks);
        this.kinds = classify();
    }

    /**
     * Register every step, transition, branch and directed link under {@code sfcContent}.
     * A null element yields an empty registry.
     */
    public static NodeRegistry register(Element sfcContent) {
        var steps = new LinkedHashMap<String, Step>();
        var transitions = new LinkedHashMap<String, Transition>();
        var branches = new LinkedHashMap<String, Branch>();
        var legToBranch = new LinkedHashMap<String, String>();
        var links = new ArrayList<DirectedLink>();

        for (Element el : Elements.children(sfcContent, "Step")) {
            Step step = parseStep(el);
            if (step != null && steps.put(step.id(), step) != null) {
                log.debug("Step {} registered twice, keeping the later one", step.id());
            }
        }
        for (Element el : Elements.children(sfcContent, "Transition")) {
            Transition transition = parseTransition(el);
            if (transition != null && transitions.put(transition.id(), transition) != null) {
                log.debug("Transition {} registered twice, keeping the later one", transition.id());
            }
        }
        for (Element el : Elements.children(sfcContent, "Branch")) {
            Branch branch = parseBranch(el);
            if (branch == null) {
                continue;
            }
            if (branches.put(branch.id(), branch) != null) {
                log.debug("Branch {} registered twice, keeping the later one", branch.id());
            }
        }
        // Only legs of the surviving branches; a replaced branch takes its legs with it.
        for (Branch branch : branches.values()) {
            for (String leg : branch.legs()) {
                legToBranch.put(leg, branch.id());
            }
        }
        for (Element el : Elements.children(sfcContent, "DirectedLink")) {
            links.add(new DirectedLink(
                Elements.attribute(el, "ID"),
                Elements.attribute(el, "FromID"),
                Elements.attribute(el, "ToID")));
        }

        return new NodeRegistry(steps, transitions, branches, legToBranch, links);
    }

    private static Step parseStep(Element el) {
        String id = Elements.attribute(el, "ID");
        if (id == null) {
            log.debug("Skipping Step without ID");
            return null;
        }
        String operand = Elements.attribute(el, "Operand");
        boolean initial = "true".equalsIgnoreCase(Elements.attribute(el, "InitialStep"));

        var actions = new ArrayList<String>();
        for (Element stContent : Elements.path(el, "Action/Body/STContent")) {
            actions.addAll(Elements.stLines(stContent));
        }
        return new Step(id, operand, OperandIndex.parse(operand), initial, actions);
    }

    private static Transition parseTransition(Element el) {
        String id = Elements.attribute(el, "ID");
        if (id == null) {
            log.debug("Skipping Transition without ID");
            return null;
        }
        String operand = Elements.attribute(el, "Operand");
        List<String> condition = Elements.stLines(Elements.firstPath(el, "Condition/STContent"));
        return new Transition(id, operand, OperandIndex.parse(operand), condition);
    }

    private static Branch parseBranch(Element el) {
        String id = Elements.attribute(el, "ID");
        if (id == null) {
            log.debug("Skipping Branch without ID");
            return null;
        }
        var legs = new ArrayList<String>();
        for (Element leg : Elements.children(el, "Leg")) {
            String legId = Elements.attribute(leg, "ID");
            if (legId != null) {
                legs.add(legId);
            }
        }
        return new Branch(id, legs,
            BranchFlow.parse(Elements.attribute(el, "BranchFlow")),
            Elements.attribute(el, "BranchType"));
    }

    // Lowest priority first so that higher priorities overwrite on shared IDs.
    private Map<String, NodeKind> classify() {
        var result = new HashMap<String, NodeKind>();
        legToBranch.keySet().forEach(id -> result.put(id, NodeKind.LEG));
        branches.keySet().forEach(id -> result.put(id, NodeKind.BRANCH));
        transitions.keySet().forEach(id -> result.put(id, NodeKind.TRANSITION));
        steps.keySet().forEach(id -> result.put(id, NodeKind.STEP));
        return Collections.unmodifiableMap(result);
    }

    public NodeKind kindOf(String id) {
        return id == null ? NodeKind.OTHER : kinds.getOrDefault(id, NodeKind.OTHER);
    }

    public Map<String, Step> steps() { return steps; }
    public Map<String, Transition> transitions() { return transitions; }
    public Map<String, Branch> branches() { return branches; }
    public Map<String, String> legToBranch() { return legToBranch; }
    public List<DirectedLink> directedLinks() { return directedLinks; }
}
