package com.bomanalyzer.core.model;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link Product} and {@link ComponentRef}.
 */
class ProductTest {

    @Test
    void constructor_nullOptionalFields_appliesDefaults() {
        Product product = new Product(ProductId.of(1), null, null, null);

        assertThat(product.replenishmentSystem()).isEqualTo(ReplenishmentSystem.UNKNOWN);
        assertThat(product.unitCost()).isEqualByComparingTo("0");
        assertThat(product.components()).isEmpty();
        assertThat(product.isLeaf()).isTrue();
        assertThat(product.isPurchased()).isFalse();
    }

    @Test
    void constructor_negativeCost_throwsException() {
        assertThatThrownBy(() -> new Product(ProductId.of(1), ReplenishmentSystem.PURCHASE,
            new BigDecimal("-1"), List.of()))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void components_areDefensivelyCopied() {
        List<ComponentRef> refs = new ArrayList<>();
        refs.add(new ComponentRef(ProductId.of(2), BigDecimal.ONE));
        Product product = new Product(ProductId.of(1), ReplenishmentSystem.PROD_ORDER, BigDecimal.ZERO, refs);

        refs.add(new ComponentRef(ProductId.of(3), BigDecimal.ONE));

        assertThat(product.components()).hasSize(1);
        assertThat(product.isLeaf()).isFalse();
    }

    @Test
    void componentRef_nonPositiveQuantity_throwsException() {
        assertThatThrownBy(() -> new ComponentRef(ProductId.of(2), BigDecimal.ZERO))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("quantityPer");
        assertThatThrownBy(() -> new ComponentRef(ProductId.of(2), new BigDecimal("-2")))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void bomRow_componentWithoutQuantity_throwsException() {
        assertThatThrownBy(() -> new BomRow(0, "1", "2", null, "Purchase", BigDecimal.ONE))
            .isInstanceOf(NullPointerException.class);
    }

    @Test
    void bomRow_blankComponent_isDefinitionRow() {
        BomRow row = new BomRow(0, "1", "  ", null, "Purchase", null);

        assertThat(row.hasComponent()).isFalse();
        assertThat(row.unitCost()).isEqualByComparingTo("0");
    }
}
