package com.bomanalyzer.core.analysis;

import com.bomanalyzer.core.model.ProductId;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when a traversal reaches a product that is already on its current path.
 *
 * <p>BOM data must be acyclic. A cycle makes depth and rolled-up cost undefined, so the pass
 * aborts and its partial results are discarded.
 */
public class CycleDetectedException extends IllegalStateException {

    private final List<ProductId> cycle;

    /**
     * Creates the exception for a cycle.
     *
     * @param cycle products along the cycle, first and last entries equal
     */
    public CycleDetectedException(List<ProductId> cycle) {
        super("Cycle detected in product structure: " + cycle.stream()
            .map(ProductId::toString)
            .collect(Collectors.joining(" -> ")));
        this.cycle = List.copyOf(cycle);
    }

    /**
     * Creates the exception for a traversal that reached {@code revisited} again.
     *
     * @param path products on the current path, root first
     * @param revisited product reached a second time, must be on {@code path}
     * @return exception whose cycle starts and ends at {@code revisited}
     */
    static CycleDetectedException revisiting(Collection<ProductId> path, ProductId revisited) {
        List<ProductId> cycle = new ArrayList<>();
        boolean inCycle = false;
        for (ProductId id : path) {
            inCycle |= id.equals(revisited);
            if (inCycle) {
                cycle.add(id);
            }
        }
        cycle.add(revisited);
        return new CycleDetectedException(cycle);
    }

    /**
     * Returns the products along the cycle.
     *
     * @return cycle path, first and last entries equal
     */
    public List<ProductId> cycle() {
        return cycle;
    }
}
