package com.growfolio.dataclient.repository;

import com.growfolio.synccore.invalidation.CacheTarget;
import com.growfolio.synccore.invalidation.InvalidationEdge;
import com.growfolio.synccore.invalidation.InvalidationRules;
import com.growfolio.synccore.invalidation.KeyStrategy;
import com.growfolio.synccore.metrics.SyncMetrics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static com.growfolio.dataclient.repository.CacheTargets.*;
import static org.assertj.core.api.Assertions.assertThat;

class InvalidationTableTest {

    /** Mutations whose only cache effect is the write merge their repository performs. */
    private static final Set<DataMutation> MERGE_ONLY =
            EnumSet.of(DataMutation.CREATE_PORTFOLIO, DataMutation.CREATE_GOAL, DataMutation.UPDATE_FAMILY);

    private InvalidationRules rules;

    @BeforeEach
    void setUp() {
        rules = InvalidationTable.rules(SyncMetrics.inMemory());
    }

    private List<CacheTarget<?>> targetsOf(DataMutation kind) {
        return rules.edgesFor(kind).stream().<CacheTarget<?>>map(InvalidationEdge::target).toList();
    }

    @Test
    @DisplayName("Every mutation kind is declared")
    void everyKindDeclared() {
        assertThat(rules.mutationKinds()).containsExactlyInAnyOrder(DataMutation.values());
    }

    @ParameterizedTest
    @EnumSource(DataMutation.class)
    @DisplayName("Every mutation except pure merges drops at least one store")
    void edgesPresent(DataMutation kind) {
        if (MERGE_ONLY.contains(kind)) {
            assertThat(rules.edgesFor(kind)).isEmpty();
        } else {
            assertThat(rules.edgesFor(kind)).isNotEmpty();
        }
    }

    @Test
    @DisplayName("Holding mutations drop the portfolio's holdings, holding entries, portfolio and list")
    void holdingEdges() {
        assertThat(targetsOf(DataMutation.ADD_HOLDING))
                .containsExactlyInAnyOrder(HOLDINGS, HOLDING, PORTFOLIO, PORTFOLIOS);
    }

    @Test
    @DisplayName("Cash transfer covers both portfolios but clears the list once")
    void transferEdges() {
        List<CacheTarget<?>> targets = targetsOf(DataMutation.TRANSFER_CASH);

        assertThat(targets).filteredOn(PORTFOLIOS::equals).hasSize(1);
        assertThat(targets).filteredOn(HOLDINGS::equals).hasSize(2);
        assertThat(targets).filteredOn(PORTFOLIO::equals).hasSize(2);
    }

    @Test
    @DisplayName("Goal progress also drops the goal's insights")
    void goalProgressEdges() {
        assertThat(targetsOf(DataMutation.UPDATE_GOAL_PROGRESS)).containsExactlyInAnyOrder(GOAL, GOAL_INSIGHTS);
        assertThat(targetsOf(DataMutation.UPDATE_GOAL)).containsExactly(GOAL);
    }

    @Test
    @DisplayName("Buy order clears holdings and portfolios wholesale plus the funding balance")
    void buyOrderEdges() {
        List<InvalidationEdge<?>> edges = rules.edgesFor(DataMutation.SUBMIT_BUY_ORDER);

        assertThat(targetsOf(DataMutation.SUBMIT_BUY_ORDER)).containsExactlyInAnyOrder(HOLDINGS, HOLDING, PORTFOLIO, PORTFOLIOS, FUNDING_BALANCE);
        assertThat(edges).filteredOn(e -> e.target().equals(HOLDINGS))
                .extracting(InvalidationEdge::strategy).containsExactly(KeyStrategy.CLEAR_COLLECTION);
    }

    @ParameterizedTest
    @EnumSource(value = DataMutation.class, names = {"CREATE_FAMILY", "DELETE_FAMILY", "LEAVE_FAMILY", "ACCEPT_INVITE"})
    @DisplayName("Family membership changes drop the cached user")
    void membershipDropsUser(DataMutation kind) {
        assertThat(targetsOf(kind)).contains(USER);
    }

    @ParameterizedTest
    @EnumSource(value = DataMutation.class, names = {"CONFIRM_DEPOSIT", "CONFIRM_WITHDRAWAL", "CANCEL_TRANSFER"})
    @DisplayName("Settling or cancelling a transfer drops the balance and that transfer")
    void transferSettlement(DataMutation kind) {
        assertThat(targetsOf(kind)).containsExactlyInAnyOrder(FUNDING_BALANCE, TRANSFER);
    }

    @Test
    @DisplayName("Every edge is declared under its own trigger")
    void triggersMatch() {
        for (DataMutation kind : DataMutation.values()) {
            assertThat(rules.edgesFor(kind)).allSatisfy(edge -> assertThat(edge.trigger()).isEqualTo(kind));
        }
    }
}
