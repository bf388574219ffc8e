package dev.sfc.model;

import java.util.List;

/**
 * A fan-out or fan-in construct. Legs are referenced by ID only.
 */
public record Branch(
    String id,
    List<String> legs,
    BranchFlow flow,
    String kind // nullable, raw BranchType, e.g. "Simultaneous" or "Selection"
) {
    public Branch {
        legs = List.copyOf(legs);
    }
}
