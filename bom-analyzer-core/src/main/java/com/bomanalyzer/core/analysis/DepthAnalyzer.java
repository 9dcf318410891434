package com.bomanalyzer.core.analysis;

import com.bomanalyzer.core.model.Catalogue;
import com.bomanalyzer.core.model.DepthResult;
import com.bomanalyzer.core.model.Product;
import com.bomanalyzer.core.model.ProductId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Computes the depth of each product's component tree.
 *
 * <p>Depth is the number of edges on the longest chain of component references below a product;
 * a product without components has depth 0. Every edge counts once whatever its quantity. An
 * edge to an undefined component still counts, ends the chain, and adds an unresolved-reference
 * diagnostic to the referencing product each time the crawl crosses it.
 *
 * <p>Each product is crawled independently as its own root, so shared sub-assemblies are
 * crawled again for every product that uses them. Results are returned per root; the catalogue
 * is not modified.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * DepthResult result = new DepthAnalyzer().computeDepths(catalogue);
 * int depth = result.depthOf(ProductId.of(1001));
 * }</pre>
 */
public class DepthAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(DepthAnalyzer.class);

    /**
     * Computes the depth of every product, in catalogue order.
     *
     * @param catalogue catalogue to analyse
     * @return depth per product with the diagnostics of the pass
     * @throws CycleDetectedException if the product structure contains a cycle
     */
    public DepthResult computeDepths(Catalogue catalogue) {
        Objects.requireNonNull(catalogue, "catalogue must not be null");

        DiagnosticLog diagnostics = new DiagnosticLog("depth");
        Map<ProductId, Integer> depths = new LinkedHashMap<>();
        for (Product product : catalogue.all()) {
            int depth = new DepthTraversal(catalogue, product, diagnostics).run();
            log.debug("Product {} depth {}", product.id(), depth);
            depths.put(product.id(), depth);
        }

        DepthResult result = new DepthResult(depths, diagnostics.snapshot());
        log.info("Computed depths for {} products (max depth {}, {} diagnostics)",
            depths.size(), result.maxDepth(), diagnostics.size());
        return result;
    }

    /**
     * Computes the depth of a single product.
     *
     * @param catalogue catalogue to analyse
     * @param rootId product to crawl
     * @return depth result holding only the root
     * @throws IllegalArgumentException if the product is not in the catalogue
     * @throws CycleDetectedException if the root's expansion contains a cycle
     */
    public DepthResult computeDepth(Catalogue catalogue, ProductId rootId) {
        Objects.requireNonNull(catalogue, "catalogue must not be null");
        Objects.requireNonNull(rootId, "rootId must not be null");

        Product root = catalogue.find(rootId)
            .orElseThrow(() -> new IllegalArgumentException("Product " + rootId + " is not in the catalogue"));

        DiagnosticLog diagnostics = new DiagnosticLog("depth");
        int depth = new DepthTraversal(catalogue, root, diagnostics).run();
        return new DepthResult(Map.of(rootId, depth), diagnostics.snapshot());
    }
}
