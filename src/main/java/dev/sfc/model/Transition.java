package dev.sfc.model;

import java.util.List;

/**
 * A guarded move between steps. {@link #fromSteps()} and {@link #toSteps()}
 * mirror the step side: a transition lists a step as a source exactly when
 * that step lists the transition as outgoing.
 */
public final class Transition {
    private final String id;
    private final String operand;         // nullable
    private final Integer operandNumber;  // nullable
    private final List<String> condition;
    private List<String> fromSteps = List.of();
    private List<String> toSteps = List.of();
    private boolean linked;

    public Transition(String id, String operand, Integer operandNumber, List<String> condition) {
        this.id = id;
        this.operand = operand;
        this.operandNumber = operandNumber;
        this.condition = List.copyOf(condition);
    }

    public String id() { return id; }
    public String operand() { return operand; }
    public Integer operandNumber() { return operandNumber; }
    public List<String> condition() { return condition; }
    public List<String> fromSteps() { return fromSteps; }
    public List<String> toSteps() { return toSteps; }

    /**
     * Bind the resolved step lists, once.
     *
     * @throws IllegalStateException if the transition is already linked
     */
    public void linkSteps(List<String> fromSteps, List<String> toSteps) {
        if (linked) {
            throw new IllegalStateException("Transition " + id + " is already linked");
        }
        this.fromSteps = List.copyOf(fromSteps);
        this.toSteps = List.copyOf(toSteps);
        this.linked = true;
    }

    @Override
    public String toString() {
        return "Transition[" + id + ", " + operand + "]";
    }
}
