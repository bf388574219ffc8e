package dev.sfc.model;

/**
 * A raw edge between any two element IDs. Either end may be missing in a
 * half-drawn chart; such links are kept here but never become edges.
 */
public record DirectedLink(
    String id,     // nullable
    String fromId, // nullable
    String toId    // nullable
) {
    public boolean isComplete() {
        return fromId != null && toId != null;
    }
}
