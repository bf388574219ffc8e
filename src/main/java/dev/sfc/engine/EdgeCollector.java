package dev.sfc.engine;

import dev.sfc.model.Branch;
import dev.sfc.model.BranchFlow;
import dev.sfc.model.DirectedLink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Collects every edge of a chart into an {@link Adjacency}: the explicit
 * directed links plus the implicit edges between a branch and its legs.
 */
public final class EdgeCollector {

    private static final Logger log = LoggerFactory.getLogger(EdgeCollector.class);

    private EdgeCollector() {}

    public static Adjacency collect(NodeRegistry registry) {
        var adjacency = new Adjacency();

        for (DirectedLink link : registry.directedLinks()) {
            if (!link.isComplete()) {
                log.debug("Ignoring incomplete DirectedLink {} ({} -> {})",
                    link.id(), link.fromId(), link.toId());
                continue;
            }
            adjacency.addEdge(link.fromId(), link.toId());
        }

        // A diverging branch fans out to its legs; converging (or unmarked) legs feed the branch.
        for (Branch branch : registry.branches().values()) {
            for (String leg : branch.legs()) {
                if (branch.flow() == BranchFlow.DIVERGE) {
                    adjacency.addEdge(branch.id(), leg);
                } else {
                    adjacency.addEdge(leg, branch.id());
                }
            }
        }

        return adjacency;
    }
}
