package com.growfolio.synccore.invalidation;

import com.growfolio.synccore.cache.CacheKey;
import com.growfolio.synccore.cache.CacheStoreFactory;
import com.growfolio.synccore.cache.FreshnessPolicy;
import com.growfolio.synccore.cache.MutableClock;
import com.growfolio.synccore.metrics.SyncMetrics;
import com.growfolio.synccore.resource.CachedResource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InvalidationRulesTest {

    enum TestMutation implements MutationKind {
        DEPOSIT, RENAME, UNUSED;

        @Override
        public String domain() {
            return "test";
        }
    }

    private static final CacheTarget<String> BALANCE = CacheTarget.named("balance");
    private static final CacheTarget<List<String>> ITEMS = CacheTarget.named("items");
    private static final CacheTarget<String> ITEM = CacheTarget.named("item");
    private static final CacheTarget<String> ORPHAN = CacheTarget.named("orphan");

    private static final CacheKey BALANCE_KEY = CacheKey.singleton("balance");
    private static final CacheKey ITEMS_KEY = CacheKey.singleton("items");

    private SyncMetrics metrics;
    private CacheStoreFactory stores;
    private CachedResource<String> balance;
    private CachedResource<List<String>> items;
    private CachedResource<String> item;
    private InvalidationRules rules;

    @BeforeEach
    void setUp() {
        metrics = SyncMetrics.inMemory();
        stores = new CacheStoreFactory(new MutableClock(Instant.parse("2024-03-01T10:00:00Z")), 100, metrics);
        balance = stores.newResource(FreshnessPolicy.of("balance", Duration.ofSeconds(30)));
        items = stores.newResource(FreshnessPolicy.of("items", Duration.ofMinutes(1)));
        item = stores.newResource(FreshnessPolicy.of("item", Duration.ofMinutes(1)));

        rules = InvalidationRules.builder()
                .on(TestMutation.DEPOSIT,
                        InvalidationEdge.clearSingleton(TestMutation.DEPOSIT, BALANCE, BALANCE_KEY),
                        InvalidationEdge.clearCollection(TestMutation.DEPOSIT, ORPHAN))
                .on(TestMutation.RENAME,
                        InvalidationEdge.removeKey(TestMutation.RENAME, ITEM,
                                c -> c.get(InvalidationContext.ID).map(id -> CacheKey.of("item", id))))
                .metrics(metrics)
                .build();
        rules.register(BALANCE, balance);
        rules.register(ITEMS, items);
        rules.register(ITEM, item);
    }

    @Test
    @DisplayName("Edges drop their targets; unregistered targets are skipped")
    void edgesApplied() {
        balance.put(BALANCE_KEY, "100");

        rules.apply(TestMutation.DEPOSIT, InvalidationContext.empty());

        assertThat(balance.current(BALANCE_KEY)).isEmpty();
        assertThat(metrics.count("growfolio.cache.invalidations", "balance")).isEqualTo(1.0);
    }

    @Test
    @DisplayName("removeKey derives the key from context and leaves other keys")
    void removeKeyFromContext() {
        item.put(CacheKey.of("item", "a"), "A");
        item.put(CacheKey.of("item", "b"), "B");

        rules.apply(TestMutation.RENAME, InvalidationContext.of(InvalidationContext.ID, "a"));

        assertThat(item.current(CacheKey.of("item", "a"))).isEmpty();
        assertThat(item.current(CacheKey.of("item", "b"))).contains("B");
    }

    @Test
    @DisplayName("Missing context attribute skips the edge")
    void missingAttributeSkipsEdge() {
        item.put(CacheKey.of("item", "a"), "A");

        rules.apply(TestMutation.RENAME, InvalidationContext.empty());

        assertThat(item.current(CacheKey.of("item", "a"))).contains("A");
    }

    @Test
    @DisplayName("Applying the same mutation twice equals applying it once")
    void idempotent() {
        items.put(ITEMS_KEY, List.of("a"));
        item.put(CacheKey.of("item", "a"), "A");
        InvalidationContext context = InvalidationContext.builder()
                .with(InvalidationContext.ID, "a")
                .merge(ITEMS, r -> r.merge(ITEMS_KEY, list -> List.of("a-renamed")))
                .build();

        rules.apply(TestMutation.RENAME, context);
        rules.apply(TestMutation.RENAME, context);

        assertThat(items.current(ITEMS_KEY)).contains(List.of("a-renamed"));
        assertThat(item.current(CacheKey.of("item", "a"))).isEmpty();
    }

    @Test
    @DisplayName("Merge runs under the target store's lock")
    void mergeRunsAtomically() {
        items.put(ITEMS_KEY, List.of("a"));
        List<Boolean> lockHeld = new ArrayList<>();

        rules.apply(TestMutation.UNUSED, InvalidationContext.builder()
                .merge(ITEMS, r -> {
                    lockHeld.add(isWriteLocked(r));
                    r.merge(ITEMS_KEY, list -> List.of("a", "b"));
                })
                .build());

        assertThat(lockHeld).containsExactly(true);
        assertThat(items.current(ITEMS_KEY)).contains(List.of("a", "b"));
    }

    @Test
    @DisplayName("Kind without edges is a no-op")
    void undeclaredKind() {
        balance.put(BALANCE_KEY, "100");

        rules.apply(TestMutation.UNUSED, InvalidationContext.empty());

        assertThat(balance.current(BALANCE_KEY)).contains("100");
        assertThat(rules.edgesFor(TestMutation.UNUSED)).isEmpty();
    }

    @Test
    @DisplayName("A kind can be declared only once")
    void duplicateDeclaration() {
        InvalidationRules.Builder builder = InvalidationRules.builder()
                .on(TestMutation.DEPOSIT, InvalidationEdge.clearSingleton(TestMutation.DEPOSIT, BALANCE, BALANCE_KEY));

        assertThatThrownBy(() -> builder.on(TestMutation.DEPOSIT))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Edge must be declared under its own trigger")
    void edgeUnderWrongKind() {
        assertThatThrownBy(() -> InvalidationRules.builder()
                .on(TestMutation.RENAME, InvalidationEdge.clearSingleton(TestMutation.DEPOSIT, BALANCE, BALANCE_KEY)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("A target has one owner")
    void targetRegisteredTwice() {
        CachedResource<String> other = stores.newResource(FreshnessPolicy.of("balance", Duration.ofSeconds(30)));

        assertThatThrownBy(() -> rules.register(BALANCE, other)).isInstanceOf(IllegalStateException.class);
        rules.register(BALANCE, balance);
    }

    @Test
    @DisplayName("clearAll empties every registered store")
    void clearAll() {
        balance.put(BALANCE_KEY, "100");
        items.put(ITEMS_KEY, List.of("a"));

        rules.clearAll();

        assertThat(balance.current(BALANCE_KEY)).isEmpty();
        assertThat(items.current(ITEMS_KEY)).isEmpty();
        assertThat(rules.registeredTargets()).hasSize(3);
    }

    private static boolean isWriteLocked(CachedResource<?> resource) {
        // a reader on another thread blocks while the write lock is held
        Thread reader = new Thread(() -> resource.current(ITEMS_KEY));
        reader.start();
        try {
            reader.join(200);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return reader.isAlive();
    }
}
