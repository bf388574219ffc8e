package dev.sfc.model;

/**
 * What an element ID refers to inside a chart. Branches and legs are
 * pass-through points; steps and transitions are the nodes callers query.
 */
public enum NodeKind {
    STEP,
    TRANSITION,
    BRANCH,
    LEG,
    OTHER;

    public boolean isPassThrough() {
        return this == BRANCH || this == LEG;
    }
}
