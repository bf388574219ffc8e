package dev.sfc.engine;

import dev.sfc.model.Branch;
import dev.sfc.model.DirectedLink;
import dev.sfc.model.NodeKind;
import dev.sfc.model.Step;
import dev.sfc.model.Transition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A resolved Sequential Function Chart. Owns every step, transition and
 * branch; relations between steps and transitions are stored as IDs and
 * resolved through this chart.
 *
 * <p>Built once from an {@code SFCContent} element. After construction the
 * only change is the optional preset pass ({@link #loadPresets}).
 */
public final class SfcChart {

    private static final Logger log = LoggerFactory.getLogger(SfcChart.class);

    private final NodeRegistry registry;
    private final Adjacency adjacency;
    private final OperandIndex operandIndex;
    private ActionGroups actionGroups;

    private SfcChart(NodeRegistry registry, Adjacency adjacency) {
        this.registry = registry;
        this.adjacency = adjacency;
        this.operandIndex = new OperandIndex(registry.steps().values(), registry.transitions().values());
    }

    public static SfcChart from(Element sfcContent) {
        NodeRegistry registry = NodeRegistry.register(sfcContent);
        Adjacency adjacency = EdgeCollector.collect(registry);
        new RelationResolver(registry, adjacency).resolve();

        log.info("Resolved SFC: {} steps, {} transitions, {} branches, {} edges",
            registry.steps().size(), registry.transitions().size(),
            registry.branches().size(), adjacency.edgeCount());
        return new SfcChart(registry, adjacency);
    }

    /**
     * Build the chart and load step presets from {@code tags}, a program's
     * {@code Tags} element. A null {@code tags} skips the preset pass.
     */
    public static SfcChart from(Element sfcContent, Element tags) {
        SfcChart chart = from(sfcContent);
        if (tags != null) {
            chart.loadPresets(TagDictionary.fromElement(tags));
        }
        return chart;
    }

    /**
     * @return the number of steps that received a preset
     */
    public int loadPresets(TagDictionary tags) {
        int loaded = PresetLoader.apply(registry.steps().values(), tags);
        log.info("Loaded presets for {} of {} steps", loaded, registry.steps().size());
        return loaded;
    }

    public Optional<Step> step(String id) {
        return Optional.ofNullable(registry.steps().get(id));
    }

    public Optional<Transition> transition(String id) {
        return Optional.ofNullable(registry.transitions().get(id));
    }

    public Optional<Branch> branch(String id) {
        return Optional.ofNullable(registry.branches().get(id));
    }

    /** The branch owning {@code legId}. */
    public Optional<Branch> branchOfLeg(String legId) {
        String branchId = registry.legToBranch().get(legId);
        return branchId == null ? Optional.empty() : branch(branchId);
    }

    public List<Step> steps() {
        return List.copyOf(registry.steps().values());
    }

    public List<Transition> transitions() {
        return List.copyOf(registry.transitions().values());
    }

    public List<Branch> branches() {
        return List.copyOf(registry.branches().values());
    }

    public List<DirectedLink> directedLinks() {
        return registry.directedLinks();
    }

    public Map<String, String> legToBranch() {
        return registry.legToBranch();
    }

    public NodeKind kindOf(String id) {
        return registry.kindOf(id);
    }

    public Adjacency adjacency() {
        return adjacency;
    }

    public List<Step> initialSteps() {
        return registry.steps().values().stream().filter(Step::initial).toList();
    }

    public List<Transition> incomingTransitions(Step step) {
        return resolve(step.incoming(), registry.transitions());
    }

    public List<Transition> outgoingTransitions(Step step) {
        return resolve(step.outgoing(), registry.transitions());
    }

    public List<Step> fromSteps(Transition transition) {
        return resolve(transition.fromSteps(), registry.steps());
    }

    public List<Step> toSteps(Transition transition) {
        return resolve(transition.toSteps(), registry.steps());
    }

    public Optional<Step> stepByOperand(int number) {
        return operandIndex.stepByOperand(number);
    }

    public Optional<Step> stepByOperand(String number) {
        return operandIndex.stepByOperand(number);
    }

    public Optional<Transition> transitionByOperand(int number) {
        return operandIndex.transitionByOperand(number);
    }

    public Optional<Transition> transitionByOperand(String number) {
        return operandIndex.transitionByOperand(number);
    }

    /** Steps grouped by action text. Computed on first use. */
    public ActionGroups actionGroups() {
        if (actionGroups == null) {
            actionGroups = ActionAggregator.group(registry.steps().values());
        }
        return actionGroups;
    }

    private static <T> List<T> resolve(List<String> ids, Map<String, T> nodes) {
        var result = new ArrayList<T>(ids.size());
        for (String id : ids) {
            T node = nodes.get(id);
            if (node != null) {
                result.add(node);
            }
        }
        return result;
    }
}
