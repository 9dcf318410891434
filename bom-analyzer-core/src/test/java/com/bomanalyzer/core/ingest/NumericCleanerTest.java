package com.bomanalyzer.core.ingest;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link NumericCleaner}.
 */
class NumericCleanerTest {

    @Test
    void clean_thousandsSeparatorsAndTrailingPoint_areRemoved() {
        assertThat(NumericCleaner.clean(" 1,234.50 ")).hasValueSatisfying(
            v -> assertThat(v).isEqualByComparingTo("1234.5"));
        assertThat(NumericCleaner.clean("12.")).hasValueSatisfying(
            v -> assertThat(v).isEqualByComparingTo("12"));
    }

    @Test
    void clean_blank_isEmpty() {
        assertThat(NumericCleaner.clean(null)).isEmpty();
        assertThat(NumericCleaner.clean("")).isEmpty();
        assertThat(NumericCleaner.clean("   ")).isEmpty();
    }

    @Test
    void clean_garbage_throwsException() {
        assertThatThrownBy(() -> NumericCleaner.clean("12 pcs"))
            .isInstanceOf(NumberFormatException.class)
            .hasMessageContaining("12 pcs");
    }

    @Test
    void stripTrailingDecimalPoint_removesOnlyOnePoint() {
        assertThat(NumericCleaner.stripTrailingDecimalPoint("5..")).isEqualTo("5.");
        assertThat(NumericCleaner.stripTrailingDecimalPoint("5.0")).isEqualTo("5.0");
    }
}
