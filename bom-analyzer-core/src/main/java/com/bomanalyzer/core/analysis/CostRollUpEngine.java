package com.bomanalyzer.core.analysis;

import com.bomanalyzer.core.model.Catalogue;
import com.bomanalyzer.core.model.Product;
import com.bomanalyzer.core.model.ProductId;
import com.bomanalyzer.core.model.RollUpResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Rolls up the purchase cost of products through their full component expansion.
 *
 * <p>Starting from the root with a quantity-per-top of 1, each resolved component reference sets
 * the component's quantity-per-top to the parent's value times the reference's quantity-per.
 * Purchased components add {@code unitCost x quantityPerTop} to the root's total. The crawl
 * continues below every component regardless of replenishment system, so purchased parts inside
 * manufactured sub-assemblies are counted. Unresolved references add a diagnostic to the
 * referencing product and are not followed.
 *
 * <p><b>Example:</b> {@code P1 -(2)-> C1 (Prod. Order) -(3)-> C2 (Purchase, 4.0)} gives
 * quantity-per-top 6 for C2 and a total of 24.0 for P1.
 */
public class CostRollUpEngine {

    private static final Logger log = LoggerFactory.getLogger(CostRollUpEngine.class);

    /**
     * Rolls up the cost of one product.
     *
     * @param catalogue catalogue to analyse
     * @param rootId product to cost
     * @return total, quantity-per-top table, cost lines and diagnostics for the root
     * @throws IllegalArgumentException if the product is not in the catalogue
     * @throws CycleDetectedException if the root's expansion contains a cycle
     */
    public RollUpResult computeRolledUpCost(Catalogue catalogue, ProductId rootId) {
        Objects.requireNonNull(catalogue, "catalogue must not be null");
        Objects.requireNonNull(rootId, "rootId must not be null");

        Product root = catalogue.find(rootId)
            .orElseThrow(() -> new IllegalArgumentException("Product " + rootId + " is not in the catalogue"));

        RollUpResult result = new RollUpTraversal(catalogue, root, new DiagnosticLog("roll-up")).run();
        log.debug("Product {} rolled-up cost {} ({} component visits)",
            rootId, result.totalCost(), result.lines().size());
        return result;
    }

    /**
     * Rolls up the cost of every product, each as an independent root, in catalogue order.
     *
     * @param catalogue catalogue to analyse
     * @return one result per product
     * @throws CycleDetectedException if the product structure contains a cycle
     */
    public List<RollUpResult> computeRolledUpCosts(Catalogue catalogue) {
        Objects.requireNonNull(catalogue, "catalogue must not be null");

        List<RollUpResult> results = new ArrayList<>(catalogue.size());
        for (Product product : catalogue.all()) {
            results.add(computeRolledUpCost(catalogue, product.id()));
        }

        log.info("Rolled up costs for {} products", results.size());
        return results;
    }
}
