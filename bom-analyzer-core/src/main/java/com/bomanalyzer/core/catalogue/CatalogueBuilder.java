package com.bomanalyzer.core.catalogue;

import com.bomanalyzer.core.model.BomRow;
import com.bomanalyzer.core.model.Catalogue;
import com.bomanalyzer.core.model.ComponentRef;
import com.bomanalyzer.core.model.Diagnostic;
import com.bomanalyzer.core.model.Product;
import com.bomanalyzer.core.model.ProductId;
import com.bomanalyzer.core.model.ReplenishmentSystem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds a {@link Catalogue} from decoded BOM rows.
 *
 * <p>Rows are applied in order. The first row naming a product creates its entry and fixes its
 * replenishment system and unit cost; every row carrying a component appends one edge.
 *
 * <p><b>Data-quality handling:</b>
 * <ul>
 *   <li>Blank or non-numeric "Item No." - the row is filed under {@link ProductId#INVALID} and
 *       a diagnostic records the raw value and row number</li>
 *   <li>Non-numeric component id - the edge is skipped and a diagnostic is attached to the
 *       product</li>
 *   <li>Component listed twice - both edges are kept and a diagnostic is attached to the
 *       product</li>
 * </ul>
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * Catalogue catalogue = new CatalogueBuilder()
 *     .addAll(readResult.rows())
 *     .build();
 * }</pre>
 */
public class CatalogueBuilder {

    private static final Logger log = LoggerFactory.getLogger(CatalogueBuilder.class);

    private final Map<ProductId, Draft> drafts = new LinkedHashMap<>();
    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Applies one row.
     *
     * @param row decoded row
     * @return this builder
     * @throws IllegalArgumentException if the row carries a component with a non-positive quantity
     */
    public CatalogueBuilder add(BomRow row) {
        Objects.requireNonNull(row, "row must not be null");

        Optional<ProductId> parsedId = ProductId.parse(row.productId());
        ProductId productId = parsedId.orElse(ProductId.INVALID);

        Draft draft = drafts.computeIfAbsent(productId, id -> new Draft(
            id,
            ReplenishmentSystem.fromLabel(row.replenishmentSystem()),
            row.unitCost()
        ));

        if (row.hasComponent()) {
            addComponent(draft, row);
        }

        if (parsedId.isEmpty()) {
            report(Diagnostic.invalidProductId(row.productId(), row.rowNumber()));
        }
        return this;
    }

    /**
     * Applies rows in order.
     *
     * @param rows decoded rows
     * @return this builder
     */
    public CatalogueBuilder addAll(Iterable<BomRow> rows) {
        for (BomRow row : rows) {
            add(row);
        }
        return this;
    }

    /**
     * Creates the immutable catalogue from the rows applied so far.
     *
     * @return catalogue
     */
    public Catalogue build() {
        Map<ProductId, Product> products = new LinkedHashMap<>();
        drafts.forEach((id, draft) -> products.put(id, draft.toProduct()));

        log.info("Built catalogue with {} products and {} ingestion diagnostics",
            products.size(), diagnostics.size());
        return new Catalogue(products, diagnostics);
    }

    private void addComponent(Draft draft, BomRow row) {
        Optional<ProductId> componentId = ProductId.parse(row.componentId());
        if (componentId.isEmpty()) {
            report(Diagnostic.invalidComponentId(draft.id, row.componentId(), row.rowNumber()));
            return;
        }

        boolean alreadyListed = draft.components.stream()
            .anyMatch(ref -> ref.componentId().equals(componentId.get()));
        if (alreadyListed) {
            report(Diagnostic.duplicateReference(draft.id, componentId.get()));
        }

        draft.components.add(new ComponentRef(componentId.get(), row.quantityPer()));
    }

    private void report(Diagnostic diagnostic) {
        log.debug("{}", diagnostic.message());
        diagnostics.add(diagnostic);
    }

    /**
     * Mutable product state while rows are still being applied.
     */
    private static final class Draft {
        private final ProductId id;
        private final ReplenishmentSystem replenishmentSystem;
        private final BigDecimal unitCost;
        private final List<ComponentRef> components = new ArrayList<>();

        private Draft(ProductId id, ReplenishmentSystem replenishmentSystem, BigDecimal unitCost) {
            this.id = id;
            this.replenishmentSystem = replenishmentSystem;
            this.unitCost = unitCost;
        }

        private Product toProduct() {
            return new Product(id, replenishmentSystem, unitCost, components);
        }
    }
}
