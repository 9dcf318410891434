package com.bomanalyzer.core.analysis;

import com.bomanalyzer.core.model.Catalogue;
import com.bomanalyzer.core.model.ComponentRef;
import com.bomanalyzer.core.model.CostLine;
import com.bomanalyzer.core.model.Diagnostic;
import com.bomanalyzer.core.model.Product;
import com.bomanalyzer.core.model.ProductId;
import com.bomanalyzer.core.model.RollUpResult;

import java.math.BigDecimal;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * State of one cost roll-up from a single root: the running total, the quantity-per-top table
 * and the crawl stack. Created by {@link CostRollUpEngine} and run once.
 */
final class RollUpTraversal {

    private final Catalogue catalogue;
    private final Product root;
    private final DiagnosticLog diagnostics;

    private final Deque<Frame> stack = new ArrayDeque<>();
    private final Set<ProductId> onPath = new LinkedHashSet<>();
    private final Map<ProductId, BigDecimal> quantityPerTop = new LinkedHashMap<>();
    private final List<CostLine> lines = new ArrayList<>();
    private BigDecimal total = BigDecimal.ZERO;
    private boolean completed;

    RollUpTraversal(Catalogue catalogue, Product root, DiagnosticLog diagnostics) {
        this.catalogue = catalogue;
        this.root = root;
        this.diagnostics = diagnostics;
    }

    /**
     * Crawls the root's expansion and sums purchased component costs.
     *
     * @return roll-up result for the root
     * @throws CycleDetectedException if a product is reached from inside its own expansion
     * @throws IllegalStateException if this traversal already ran
     */
    RollUpResult run() {
        if (completed) {
            throw new IllegalStateException("Cost roll-up of product " + root.id() + " has already completed");
        }

        quantityPerTop.put(root.id(), BigDecimal.ONE);
        push(root, 0, BigDecimal.ONE);
        while (!stack.isEmpty()) {
            step(stack.peek());
        }

        completed = true;
        return new RollUpResult(root.id(), total, quantityPerTop, lines, diagnostics.snapshot());
    }

    private void step(Frame frame) {
        if (frame.next >= frame.product.components().size()) {
            stack.pop();
            onPath.remove(frame.product.id());
            return;
        }

        ComponentRef ref = frame.product.components().get(frame.next++);
        Optional<Product> found = catalogue.find(ref.componentId());
        if (found.isEmpty()) {
            diagnostics.append(Diagnostic.unresolvedReference(frame.product.id(), ref.componentId()));
            return;
        }
        if (onPath.contains(ref.componentId())) {
            throw CycleDetectedException.revisiting(onPath, ref.componentId());
        }

        Product child = found.get();
        BigDecimal childQuantityPerTop = frame.quantityPerTop.multiply(ref.quantityPer());
        quantityPerTop.put(child.id(), childQuantityPerTop);

        BigDecimal componentCost = BigDecimal.ZERO;
        if (child.isPurchased()) {
            componentCost = child.unitCost().multiply(childQuantityPerTop);
            total = total.add(componentCost);
        }

        int level = frame.level + 1;
        lines.add(new CostLine(level, frame.product.id(), child.id(), ref.quantityPer(), componentCost,
            childQuantityPerTop, child.replenishmentSystem(), child.unitCost()));

        push(child, level, childQuantityPerTop);
    }

    private void push(Product product, int level, BigDecimal productQuantityPerTop) {
        stack.push(new Frame(product, level, productQuantityPerTop));
        onPath.add(product.id());
    }

    private static final class Frame {
        private final Product product;
        private final int level;
        private final BigDecimal quantityPerTop;
        private int next;

        private Frame(Product product, int level, BigDecimal quantityPerTop) {
            this.product = product;
            this.level = level;
            this.quantityPerTop = quantityPerTop;
        }
    }
}
