package com.bomanalyzer.core.analysis;

import com.bomanalyzer.core.model.Catalogue;
import com.bomanalyzer.core.model.ComponentRef;
import com.bomanalyzer.core.model.Diagnostic;
import com.bomanalyzer.core.model.Product;
import com.bomanalyzer.core.model.ProductId;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * State of one depth crawl from a single root. Created by {@link DepthAnalyzer} and run once.
 */
final class DepthTraversal {

    private final Catalogue catalogue;
    private final Product root;
    private final DiagnosticLog diagnostics;

    private final Deque<Frame> stack = new ArrayDeque<>();
    private final Set<ProductId> onPath = new LinkedHashSet<>();
    private int maxLevel;
    private boolean completed;

    DepthTraversal(Catalogue catalogue, Product root, DiagnosticLog diagnostics) {
        this.catalogue = catalogue;
        this.root = root;
        this.diagnostics = diagnostics;
    }

    /**
     * Crawls the root's expansion.
     *
     * @return length of the longest component chain below the root
     * @throws CycleDetectedException if a product is reached from inside its own expansion
     * @throws IllegalStateException if this traversal already ran
     */
    int run() {
        if (completed) {
            throw new IllegalStateException("Depth traversal of product " + root.id() + " has already completed");
        }

        push(root, 0);
        while (!stack.isEmpty()) {
            step(stack.peek());
        }

        completed = true;
        return maxLevel;
    }

    private void step(Frame frame) {
        if (frame.next >= frame.product.components().size()) {
            stack.pop();
            onPath.remove(frame.product.id());
            return;
        }

        ComponentRef ref = frame.product.components().get(frame.next++);
        int level = frame.level + 1;
        maxLevel = Math.max(maxLevel, level);

        Optional<Product> child = catalogue.find(ref.componentId());
        if (child.isEmpty()) {
            diagnostics.append(Diagnostic.unresolvedReference(frame.product.id(), ref.componentId()));
            return;
        }
        if (onPath.contains(ref.componentId())) {
            throw CycleDetectedException.revisiting(onPath, ref.componentId());
        }
        push(child.get(), level);
    }

    private void push(Product product, int level) {
        stack.push(new Frame(product, level));
        onPath.add(product.id());
    }

    private static final class Frame {
        private final Product product;
        private final int level;
        private int next;

        private Frame(Product product, int level) {
            this.product = product;
            this.level = level;
        }
    }
}
