package com.baselinesentinel.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link EntityKey}.
 */
class EntityKeyTest {

    @Test
    @DisplayName("Should compare components after trimming")
    void shouldTrimComponents() {
        assertThat(EntityKey.of(" GET", "orders ", "/v1")).isEqualTo(EntityKey.of("GET", "orders", "/v1"));
        assertThat(EntityKey.of("GET", "orders")).isNotEqualTo(EntityKey.of("orders", "GET"));
    }

    @Test
    @DisplayName("Should replace null components with unknown")
    void shouldDefaultNullComponents() {
        assertThat(EntityKey.of(Arrays.asList("orders", null)).get(1)).isEqualTo(LabeledSeries.UNKNOWN);
    }

    @Test
    @DisplayName("Should display non-empty components joined by spaces")
    void shouldDisplay() {
        assertThat(EntityKey.of("cart", "", "cart-7f9c").display()).isEqualTo("cart cart-7f9c");
        assertThat(EntityKey.of("cart").with("5xx").toString()).isEqualTo("cart 5xx");
    }
}
