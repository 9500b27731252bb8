package com.growfolio.synccore.cache;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CacheKeyTest {

    @Test
    @DisplayName("Nested key belongs to its scoped key, not to a sibling scope")
    void nestedKeyIsWithinScope() {
        CacheKey scope = CacheKey.of("holding", "p1");

        assertThat(CacheKey.of("holding", "p1", "h1").isWithin(scope)).isTrue();
        assertThat(CacheKey.of("holding", "p2", "h1").isWithin(scope)).isFalse();
        assertThat(CacheKey.of("holdings", "p1").isWithin(scope)).isFalse();
    }

    @Test
    @DisplayName("Every key of a scope is within the scope's singleton")
    void singletonCoversScope() {
        assertThat(CacheKey.of("goal", "g1").isWithin(CacheKey.singleton("goal"))).isTrue();
        assertThat(CacheKey.singleton("goal").isWithin(CacheKey.singleton("goal"))).isTrue();
        assertThat(CacheKey.singleton("goal").isWithin(CacheKey.of("goal", "g1"))).isFalse();
    }

    @Test
    @DisplayName("Scoped key is not within a different nested key")
    void scopedKeyNotWithinChild() {
        assertThat(CacheKey.of("holding", "p1").isWithin(CacheKey.of("holding", "p1", "h1"))).isFalse();
    }

    @Test
    void childWithoutParentIsRejected() {
        assertThatThrownBy(() -> new CacheKey("holding", null, "h1"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void toStringJoinsParts() {
        assertThat(CacheKey.of("holding", "p1", "h1")).hasToString("holding:p1:h1");
        assertThat(CacheKey.singleton("user")).hasToString("user");
    }
}
