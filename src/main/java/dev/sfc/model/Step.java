package dev.sfc.model;

import java.util.List;

/**
 * A state of the chart. Identity and action text are fixed at registration;
 * the transition lists are filled in once by the relation resolver and the
 * preset by the optional preset pass.
 */
public final class Step {
    private final String id;
    private final String operand;         // nullable
    private final Integer operandNumber;  // nullable
    private final boolean initial;
    private final List<String> actions;
    private List<String> incoming = List.of();
    private List<String> outgoing = List.of();
    private boolean linked;
    private Integer preset;               // nullable, milliseconds

    public Step(String id, String operand, Integer operandNumber, boolean initial, List<String> actions) {
        this.id = id;
        this.operand = operand;
        this.operandNumber = operandNumber;
        this.initial = initial;
        this.actions = List.copyOf(actions);
    }

    public String id() { return id; }
    public String operand() { return operand; }
    public Integer operandNumber() { return operandNumber; }
    public boolean initial() { return initial; }
    public List<String> actions() { return actions; }
    public Integer preset() { return preset; }

    /** IDs of transitions leading into this step, ascending by numeric ID. */
    public List<String> incoming() { return incoming; }

    /** IDs of transitions leaving this step, ascending by numeric ID. */
    public List<String> outgoing() { return outgoing; }

    /**
     * Action lines joined with newlines, or an empty string when the step has no actions.
     */
    public String actionText() {
        return String.join("\n", actions);
    }

    public void setPreset(Integer preset) {
        this.preset = preset;
    }

    /**
     * Bind the resolved transition lists. Called once per step while the chart
     * is built; the lists are expected in final order.
     *
     * @throws IllegalStateException if the step is already linked
     */
    public void linkTransitions(List<String> incoming, List<String> outgoing) {
        if (linked) {
            throw new IllegalStateException("Step " + id + " is already linked");
        }
        this.incoming = List.copyOf(incoming);
        this.outgoing = List.copyOf(outgoing);
        this.linked = true;
    }

    @Override
    public String toString() {
        return "Step[" + id + ", " + operand + "]";
    }
}
