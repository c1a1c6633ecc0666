package com.baselinesentinel.core.normalize;

import com.baselinesentinel.core.model.EntityKey;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link EntityFilter}.
 */
class EntityFilterTest {

    @Test
    @DisplayName("Should reject entities with any component matching an exclude prefix")
    void shouldExcludeByPrefix() {
        EntityFilter filter = new EntityFilter(null, List.of("kafka-", " "));

        assertThat(filter.test(EntityKey.of("payments", "kafka-connect-0"))).isFalse();
        assertThat(filter.test(EntityKey.of("payments", "api-0"))).isTrue();
    }

    @Test
    @DisplayName("Should only accept allow-listed entities when include prefixes are set")
    void shouldApplyAllowList() {
        EntityFilter filter = new EntityFilter(List.of("orders"), List.of("orders-batch"));

        assertThat(filter.test(EntityKey.of("orders-api-1"))).isTrue();
        assertThat(filter.test(EntityKey.of("orders-batch-1"))).isFalse();
        assertThat(filter.test(EntityKey.of("cart-api-1"))).isFalse();
    }

    @Test
    @DisplayName("Should accept everything by default")
    void shouldAcceptAll() {
        assertThat(EntityFilter.acceptAll().test(EntityKey.of("anything"))).isTrue();
    }
}
