package com.growfolio.dataclient.repository;

/*
 * 09/25/2026 - 1:26 PM
 * @author Growfolio Engineering
 */

import com.growfolio.common.dto.Requests.CashTransferRequest;
import com.growfolio.common.dto.Requests.HoldingRequest;
import com.growfolio.common.dto.Requests.LedgerEntryRequest;
import com.growfolio.common.dto.Requests.PortfolioRequest;
import com.growfolio.common.enums.AllocationGrouping;
import com.growfolio.common.enums.LedgerEntryType;
import com.growfolio.common.exception.ApiExceptions.DomainRuleViolationException;
import com.growfolio.common.logging.LogContext;
import com.growfolio.common.model.Holding;
import com.growfolio.common.model.LedgerEntry;
import com.growfolio.common.model.Page;
import com.growfolio.common.model.Portfolio;
import com.growfolio.common.model.Summaries.AllocationItem;
import com.growfolio.common.model.Summaries.HoldingsSummary;
import com.growfolio.common.model.Summaries.PortfolioAllocation;
import com.growfolio.common.model.Summaries.PortfoliosSummary;
import com.growfolio.dataclient.remote.PortfolioRemoteDataSource;
import com.growfolio.synccore.cache.CacheStoreFactory;
import com.growfolio.synccore.invalidation.InvalidationContext;
import com.growfolio.synccore.invalidation.InvalidationRules;
import com.growfolio.synccore.resource.CachedResource;
import com.growfolio.synccore.resource.RefreshOutcome;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;

import static com.growfolio.dataclient.repository.CacheTargets.HOLDING;
import static com.growfolio.dataclient.repository.CacheTargets.HOLDINGS;
import static com.growfolio.dataclient.repository.CacheTargets.PORTFOLIO;
import static com.growfolio.dataclient.repository.CacheTargets.PORTFOLIOS;
import static com.growfolio.dataclient.repository.CacheTargets.PORTFOLIOS_KEY;
import static com.growfolio.dataclient.repository.CacheTargets.holdingKey;
import static com.growfolio.dataclient.repository.CacheTargets.holdingScope;
import static com.growfolio.dataclient.repository.CacheTargets.holdingsKey;
import static com.growfolio.dataclient.repository.CacheTargets.portfolioKey;

@Slf4j
public class CachedPortfolioRepository implements PortfolioRepository {

    private static final String DOMAIN = "portfolio";

    private final PortfolioRemoteDataSource remote;
    private final InvalidationRules rules;
    private final Clock clock;
    private final int maxPageSize;

    private final CachedResource<List<Portfolio>> portfolios;
    private final CachedResource<Portfolio> portfolio;
    private final CachedResource<List<Holding>> holdings;
    private final CachedResource<Holding> holding;

    public CachedPortfolioRepository(PortfolioRemoteDataSource remote, CacheStoreFactory stores,
                                     InvalidationRules rules, int maxPageSize) {
        this.remote = remote;
        this.rules = rules;
        this.clock = stores.clock();
        this.maxPageSize = maxPageSize;
        this.portfolios = stores.newResource(Freshness.PORTFOLIOS);
        this.portfolio = stores.newResource(Freshness.PORTFOLIO);
        this.holdings = stores.newResource(Freshness.HOLDINGS);
        this.holding = stores.newResource(Freshness.HOLDING);
        rules.register(PORTFOLIOS, portfolios);
        rules.register(PORTFOLIO, portfolio);
        rules.register(HOLDINGS, holdings);
        rules.register(HOLDING, holding);
    }

    // ==================== Portfolios ====================

    @Override
    public List<Portfolio> fetchPortfolios() {
        return portfolios.fetch(PORTFOLIOS_KEY, remote::listPortfolios);
    }

    @Override
    public RefreshOutcome<List<Portfolio>> refreshPortfolios() {
        return portfolios.refresh(PORTFOLIOS_KEY, remote::listPortfolios);
    }

    @Override
    public Portfolio fetchPortfolio(String portfolioId) {
        return portfolios.peek(PORTFOLIOS_KEY)
                .flatMap(list -> findById(list, portfolioId, Portfolio::id))
                .orElseGet(() -> portfolio.fetch(portfolioKey(portfolioId), () -> remote.getPortfolio(portfolioId)));
    }

    @Override
    public Optional<Portfolio> defaultPortfolio() {
        return portfolios.current(PORTFOLIOS_KEY)
                .flatMap(list -> list.stream().filter(Portfolio::isDefault).findFirst());
    }

    @Override
    public Portfolio createPortfolio(PortfolioRequest request) {
        return mutation("createPortfolio", null, () -> {
            Portfolio created = remote.createPortfolio(request);
            rules.apply(DataMutation.CREATE_PORTFOLIO, InvalidationContext.builder()
                    .with(InvalidationContext.ID, created.id())
                    .merge(PORTFOLIOS, r -> r.merge(PORTFOLIOS_KEY, list -> ListMerges.appended(list, created)))
                    .build());
            log.info("Created portfolio {} ({})", created.id(), created.name());
            return created;
        });
    }

    @Override
    public Portfolio updatePortfolio(String portfolioId, PortfolioRequest request) {
        return mutation("updatePortfolio", portfolioId, () -> {
            Portfolio updated = remote.updatePortfolio(portfolioId, request);
            rules.apply(DataMutation.UPDATE_PORTFOLIO, InvalidationContext.builder()
                    .with(InvalidationContext.ID, portfolioId)
                    .merge(PORTFOLIOS, r -> r.merge(PORTFOLIOS_KEY, list -> ListMerges.replaced(list, updated, Portfolio::id)))
                    .build());
            log.info("Updated portfolio {}", portfolioId);
            return updated;
        });
    }

    @Override
    public Portfolio setDefaultPortfolio(String portfolioId) {
        return mutation("setDefaultPortfolio", portfolioId, () -> {
            Portfolio updated = remote.setDefaultPortfolio(portfolioId);
            // every other portfolio loses its default flag, so nothing cached can be patched
            rules.apply(DataMutation.SET_DEFAULT_PORTFOLIO, InvalidationContext.of(InvalidationContext.ID, portfolioId));
            log.info("Portfolio {} is now the default", portfolioId);
            return updated;
        });
    }

    @Override
    public void deletePortfolio(String portfolioId) {
        boolean isDefault = portfolios.current(PORTFOLIOS_KEY)
                .flatMap(list -> findById(list, portfolioId, Portfolio::id))
                .or(() -> portfolio.current(portfolioKey(portfolioId)))
                .map(Portfolio::isDefault)
                .orElse(false);
        if (isDefault) {
            throw new DomainRuleViolationException("Cannot delete the default portfolio", DomainRules.DEFAULT_PORTFOLIO);
        }
        mutation("deletePortfolio", portfolioId, () -> {
            remote.deletePortfolio(portfolioId);
            rules.apply(DataMutation.DELETE_PORTFOLIO, InvalidationContext.builder()
                    .with(InvalidationContext.ID, portfolioId)
                    .merge(PORTFOLIOS, r -> r.merge(PORTFOLIOS_KEY,
                            list -> ListMerges.removed(list, p -> portfolioId.equals(p.id()))))
                    .build());
            log.info("Deleted portfolio {}", portfolioId);
            return null;
        });
    }

    // ==================== Holdings ====================

    @Override
    public List<Holding> fetchHoldings(String portfolioId) {
        return holdings.fetch(holdingsKey(portfolioId), () -> remote.listHoldings(portfolioId));
    }

    @Override
    public Holding fetchHolding(String portfolioId, String holdingId) {
        return holdings.peek(holdingsKey(portfolioId))
                .flatMap(list -> findById(list, holdingId, Holding::id))
                .orElseGet(() -> holding.fetch(holdingKey(portfolioId, holdingId),
                        () -> remote.getHolding(portfolioId, holdingId)));
    }

    @Override
    public Holding addHolding(String portfolioId, HoldingRequest request) {
        return portfolioScoped(DataMutation.ADD_HOLDING, "addHolding", portfolioId,
                () -> remote.addHolding(portfolioId, request));
    }

    @Override
    public Holding updateHolding(String portfolioId, String holdingId, HoldingRequest request) {
        return portfolioScoped(DataMutation.UPDATE_HOLDING, "updateHolding", portfolioId,
                () -> remote.updateHolding(portfolioId, holdingId, request));
    }

    @Override
    public void removeHolding(String portfolioId, String holdingId) {
        portfolioScoped(DataMutation.REMOVE_HOLDING, "removeHolding", portfolioId, () -> {
            remote.removeHolding(portfolioId, holdingId);
            return holdingId;
        });
    }

    @Override
    public RefreshOutcome<List<Holding>> refreshHoldingPrices(String portfolioId) {
        RefreshOutcome<List<Holding>> outcome =
                holdings.refresh(holdingsKey(portfolioId), () -> remote.listHoldings(portfolioId));
        // single-holding entries are only priced as recently as the list they would now disagree with
        if (!outcome.stale()) {
            holding.invalidateWithin(holdingScope(portfolioId));
        }
        return outcome;
    }

    // ==================== Ledger ====================

    @Override
    public Page<LedgerEntry> fetchLedgerEntries(String portfolioId, int page, int limit) {
        int cappedLimit = Math.max(1, Math.min(limit, maxPageSize));
        return remote.listLedgerEntries(portfolioId, Math.max(1, page), cappedLimit);
    }

    @Override
    public LedgerEntry addLedgerEntry(String portfolioId, LedgerEntryRequest request) {
        return portfolioScoped(DataMutation.ADD_LEDGER_ENTRY, "addLedgerEntry", portfolioId,
                () -> remote.addLedgerEntry(portfolioId, request));
    }

    @Override
    public LedgerEntry updateLedgerEntry(String portfolioId, String entryId, LedgerEntryRequest request) {
        return portfolioScoped(DataMutation.UPDATE_LEDGER_ENTRY, "updateLedgerEntry", portfolioId,
                () -> remote.updateLedgerEntry(portfolioId, entryId, request));
    }

    @Override
    public void deleteLedgerEntry(String portfolioId, String entryId) {
        portfolioScoped(DataMutation.DELETE_LEDGER_ENTRY, "deleteLedgerEntry", portfolioId, () -> {
            remote.deleteLedgerEntry(portfolioId, entryId);
            return entryId;
        });
    }

    @Override
    public LedgerEntry depositCash(String portfolioId, BigDecimal amount, String notes) {
        LedgerEntryRequest request = cashEntry(LedgerEntryType.DEPOSIT, DomainRules.requirePositive(amount), notes);
        return portfolioScoped(DataMutation.DEPOSIT_CASH, "depositCash", portfolioId,
                () -> remote.addLedgerEntry(portfolioId, request));
    }

    @Override
    public LedgerEntry withdrawCash(String portfolioId, BigDecimal amount, String notes) {
        LedgerEntryRequest request = cashEntry(LedgerEntryType.WITHDRAWAL, DomainRules.requirePositive(amount), notes);
        return portfolioScoped(DataMutation.WITHDRAW_CASH, "withdrawCash", portfolioId,
                () -> remote.addLedgerEntry(portfolioId, request));
    }

    @Override
    public void transferCash(CashTransferRequest request) {
        DomainRules.requirePositive(request.amount());
        if (Objects.equals(request.sourcePortfolioId(), request.destinationPortfolioId())) {
            throw new DomainRuleViolationException("Source and destination portfolio must differ",
                    DomainRules.SAME_PORTFOLIO);
        }
        mutation("transferCash", request.sourcePortfolioId(), () -> {
            remote.transferCash(request);
            rules.apply(DataMutation.TRANSFER_CASH, InvalidationContext.builder()
                    .with(InvalidationContext.PARENT_ID, request.sourcePortfolioId())
                    .with(InvalidationContext.TARGET_PARENT_ID, request.destinationPortfolioId())
                    .build());
            log.info("Transferred {} from portfolio {} to {}", request.amount(),
                    request.sourcePortfolioId(), request.destinationPortfolioId());
            return null;
        });
    }

    // ==================== Derived ====================

    @Override
    public PortfolioAllocation allocation(String portfolioId, AllocationGrouping grouping) {
        List<Holding> cached = holdings.current(holdingsKey(portfolioId)).orElse(List.of());
        Function<Holding, String> category = switch (grouping) {
            case SECTOR -> h -> Objects.requireNonNullElse(h.sector(), "Other");
            case INDUSTRY -> h -> Objects.requireNonNullElse(h.industry(), "Other");
            case ASSET_TYPE -> h -> h.assetType() != null ? h.assetType().getValue() : "other";
            case HOLDING -> Holding::stockSymbol;
        };
        Map<String, BigDecimal> values = new LinkedHashMap<>();
        for (Holding h : cached) {
            values.merge(category.apply(h), h.marketValue(), BigDecimal::add);
        }
        BigDecimal total = values.values().stream().reduce(BigDecimal.ZERO, BigDecimal::add);
        List<AllocationItem> items = values.entrySet().stream()
                .map(e -> new AllocationItem(e.getKey(), e.getValue(), percentage(e.getValue(), total)))
                .sorted(Comparator.comparing(AllocationItem::value).reversed())
                .toList();
        return new PortfolioAllocation(portfolioId, items, clock.instant());
    }

    @Override
    public HoldingsSummary holdingsSummary(String portfolioId) {
        List<Holding> cached = holdings.current(holdingsKey(portfolioId)).orElse(List.of());
        BigDecimal marketValue = sum(cached, Holding::marketValue);
        BigDecimal costBasis = sum(cached, Holding::costBasis);
        int profitable = (int) cached.stream().filter(Holding::isProfitable).count();
        int unprofitable = (int) cached.stream().filter(h -> h.unrealizedGainLoss().signum() < 0).count();
        return new HoldingsSummary(cached.size(), marketValue, costBasis, marketValue.subtract(costBasis),
                profitable, unprofitable);
    }

    @Override
    public PortfoliosSummary portfoliosSummary() {
        List<Portfolio> cached = portfolios.current(PORTFOLIOS_KEY).orElse(List.of());
        return new PortfoliosSummary(cached.size(),
                sum(cached, p -> p.totalValue()),
                sum(cached, p -> p.totalCostBasis()),
                sum(cached, p -> p.cashBalance()));
    }

    // ==================== Cache control ====================

    @Override
    public void invalidateCache() {
        portfolios.invalidateAll();
        portfolio.invalidateAll();
        holdings.invalidateAll();
        holding.invalidateAll();
        log.debug("Portfolio caches cleared");
    }

    @Override
    public void invalidateCache(String portfolioId) {
        portfolio.invalidate(portfolioKey(portfolioId));
        holdings.invalidate(holdingsKey(portfolioId));
        holding.invalidateWithin(holdingScope(portfolioId));
    }

    // ==================== Internals ====================

    private <T> T portfolioScoped(DataMutation kind, String operation, String portfolioId, Supplier<T> call) {
        return mutation(operation, portfolioId, () -> {
            T result = call.get();
            rules.apply(kind, InvalidationContext.of(InvalidationContext.PARENT_ID, portfolioId));
            log.info("{} on portfolio {} succeeded", operation, portfolioId);
            return result;
        });
    }

    private <T> T mutation(String operation, String resourceId, Supplier<T> call) {
        return LogContext.forOperation(DOMAIN, operation)
                .and(LogContext.RESOURCE_ID, resourceId)
                .supply(call);
    }

    private LedgerEntryRequest cashEntry(LedgerEntryType type, BigDecimal amount, String notes) {
        return LedgerEntryRequest.builder()
                .type(type)
                .totalAmount(amount)
                .transactionDate(clock.instant())
                .notes(notes)
                .build();
    }

    private static <T> Optional<T> findById(List<T> list, String id, Function<T, String> idOf) {
        return list.stream().filter(item -> Objects.equals(idOf.apply(item), id)).findFirst();
    }

    private static <T> BigDecimal sum(List<T> items, Function<T, BigDecimal> value) {
        return items.stream()
                .map(value)
                .filter(Objects::nonNull)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    private static BigDecimal percentage(BigDecimal part, BigDecimal whole) {
        if (whole.signum() == 0) {
            return BigDecimal.ZERO;
        }
        return part.multiply(BigDecimal.valueOf(100)).divide(whole, 2, RoundingMode.HALF_UP);
    }
}
