package com.growfolio.dataclient.repository;

/*
 * 09/25/2026 - 1:08 PM
 * @author Growfolio Engineering
 */

import com.growfolio.common.dto.Requests.ConfirmTransferRequest;
import com.growfolio.common.dto.Requests.TransferRequest;
import com.growfolio.common.enums.TransferStatus;
import com.growfolio.common.enums.TransferType;
import com.growfolio.common.exception.ApiExceptions.DomainRuleViolationException;
import com.growfolio.common.logging.LogContext;
import com.growfolio.common.model.FundingBalance;
import com.growfolio.common.model.FxRate;
import com.growfolio.common.model.Page;
import com.growfolio.common.model.Summaries.TransferSummary;
import com.growfolio.common.model.Transfer;
import com.growfolio.dataclient.remote.FundingRemoteDataSource;
import com.growfolio.synccore.cache.CacheStoreFactory;
import com.growfolio.synccore.invalidation.InvalidationContext;
import com.growfolio.synccore.invalidation.InvalidationRules;
import com.growfolio.synccore.resource.CachedResource;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.function.Supplier;

import static com.growfolio.dataclient.repository.CacheTargets.FUNDING_BALANCE;
import static com.growfolio.dataclient.repository.CacheTargets.FUNDING_BALANCE_KEY;
import static com.growfolio.dataclient.repository.CacheTargets.FX_RATE_KEY;
import static com.growfolio.dataclient.repository.CacheTargets.TRANSFER;
import static com.growfolio.dataclient.repository.CacheTargets.TRANSFERS;
import static com.growfolio.dataclient.repository.CacheTargets.TRANSFERS_KEY;
import static com.growfolio.dataclient.repository.CacheTargets.transferKey;

@Slf4j
public class CachedFundingRepository implements FundingRepository {

    private static final String DOMAIN = "funding";

    private final FundingRemoteDataSource remote;
    private final InvalidationRules rules;
    private final Clock clock;
    private final String currency;
    private final int maxPageSize;

    private final CachedResource<FundingBalance> balance;
    private final CachedResource<FxRate> fxRate;
    private final CachedResource<List<Transfer>> transfers;
    private final CachedResource<Transfer> transfer;

    public CachedFundingRepository(FundingRemoteDataSource remote, CacheStoreFactory stores, InvalidationRules rules,
                                   String currency, int maxPageSize) {
        this.remote = remote;
        this.rules = rules;
        this.clock = stores.clock();
        this.currency = currency;
        this.maxPageSize = maxPageSize;
        this.balance = stores.newResource(Freshness.FUNDING_BALANCE);
        this.fxRate = stores.newResource(Freshness.FX_RATE);
        this.transfers = stores.newResource(Freshness.TRANSFERS);
        this.transfer = stores.newResource(Freshness.TRANSFER);
        rules.register(FUNDING_BALANCE, balance);
        rules.register(TRANSFERS, transfers);
        rules.register(TRANSFER, transfer);
    }

    @Override
    public FundingBalance fetchBalance() {
        return balance.fetch(FUNDING_BALANCE_KEY, remote::getBalance);
    }

    @Override
    public FxRate fetchFxRate() {
        return fxRate.fetch(FX_RATE_KEY, remote::getFxRate, this::freshUntilExpiry);
    }

    // ==================== Deposits ====================

    @Override
    public Transfer initiateDeposit(BigDecimal amount, String notes) {
        TransferRequest request = new TransferRequest(DomainRules.requirePositive(amount), currency, notes);
        return initiate(DataMutation.INITIATE_DEPOSIT, () -> remote.initiateDeposit(request));
    }

    @Override
    public Transfer confirmDeposit(String transferId, BigDecimal rate) {
        ConfirmTransferRequest request = new ConfirmTransferRequest(transferId, rate);
        return settle(DataMutation.CONFIRM_DEPOSIT, transferId, () -> remote.confirmDeposit(request));
    }

    // ==================== Withdrawals ====================

    @Override
    public Transfer initiateWithdrawal(BigDecimal amount, String notes) {
        DomainRules.requirePositive(amount);
        BigDecimal available = fetchBalance().available(currency);
        if (amount.compareTo(available) > 0) {
            throw new DomainRuleViolationException(
                    String.format("Insufficient funds: %s %s available, %s requested", available, currency, amount),
                    DomainRules.INSUFFICIENT_FUNDS);
        }
        TransferRequest request = new TransferRequest(amount, currency, notes);
        return initiate(DataMutation.INITIATE_WITHDRAWAL, () -> remote.initiateWithdrawal(request));
    }

    @Override
    public Transfer confirmWithdrawal(String transferId, BigDecimal rate) {
        ConfirmTransferRequest request = new ConfirmTransferRequest(transferId, rate);
        return settle(DataMutation.CONFIRM_WITHDRAWAL, transferId, () -> remote.confirmWithdrawal(request));
    }

    // ==================== Transfers ====================

    @Override
    public Transfer fetchTransfer(String transferId) {
        return cachedTransfer(transferId)
                .orElseGet(() -> transfer.fetch(transferKey(transferId), () -> remote.getTransfer(transferId)));
    }

    @Override
    public Transfer cancelTransfer(String transferId) {
        Optional<Transfer> cached = transfers.current(TRANSFERS_KEY)
                .flatMap(list -> findById(list, transferId))
                .or(() -> transfer.current(transferKey(transferId)));
        if (cached.isPresent() && !cached.get().canCancel()) {
            throw new DomainRuleViolationException(
                    "Transfer " + transferId + " cannot be cancelled in status " + cached.get().status(),
                    DomainRules.TRANSFER_NOT_CANCELLABLE);
        }
        return settle(DataMutation.CANCEL_TRANSFER, transferId, () -> remote.cancelTransfer(transferId));
    }

    @Override
    public List<Transfer> fetchAllTransfers() {
        return transfers.fetch(TRANSFERS_KEY, () -> remote.listTransfers(1, maxPageSize).data());
    }

    @Override
    public Page<Transfer> fetchTransferHistory(int page, int limit) {
        return remote.listTransfers(Math.max(1, page), Math.max(1, Math.min(limit, maxPageSize)));
    }

    // ==================== Derived ====================

    @Override
    public List<Transfer> transfersByType(TransferType type) {
        return cachedTransfers(t -> t.type() == type);
    }

    @Override
    public List<Transfer> transfersByStatus(TransferStatus status) {
        return cachedTransfers(t -> t.status() == status);
    }

    @Override
    public List<Transfer> pendingTransfers() {
        return cachedTransfers(Transfer::isInProgress);
    }

    @Override
    public TransferSummary summary() {
        List<Transfer> all = cachedTransfers(t -> true);
        return new TransferSummary(all,
                total(all, TransferType.DEPOSIT, t -> t.status() == TransferStatus.COMPLETED),
                total(all, TransferType.WITHDRAWAL, t -> t.status() == TransferStatus.COMPLETED),
                total(all, TransferType.DEPOSIT, Transfer::isInProgress),
                total(all, TransferType.WITHDRAWAL, Transfer::isInProgress));
    }

    @Override
    public void invalidateCache() {
        balance.invalidateAll();
        fxRate.invalidateAll();
        transfers.invalidateAll();
        transfer.invalidateAll();
    }

    // ==================== Internals ====================

    private Transfer initiate(DataMutation kind, Supplier<Transfer> call) {
        return LogContext.forOperation(DOMAIN, kind.name()).supply(() -> {
            Transfer created = call.get();
            rules.apply(kind, InvalidationContext.builder()
                    .with(InvalidationContext.ID, created.id())
                    .merge(TRANSFERS, r -> r.merge(TRANSFERS_KEY, list -> ListMerges.prepended(list, created)))
                    .build());
            log.info("{} {} {} created as transfer {}", kind, created.amount(), created.currency(), created.id());
            return created;
        });
    }

    private Transfer settle(DataMutation kind, String transferId, Supplier<Transfer> call) {
        return LogContext.forOperation(DOMAIN, kind.name()).and(LogContext.RESOURCE_ID, transferId).supply(() -> {
            Transfer updated = call.get();
            rules.apply(kind, InvalidationContext.builder()
                    .with(InvalidationContext.ID, transferId)
                    .merge(TRANSFERS, r -> r.merge(TRANSFERS_KEY, list -> ListMerges.replaced(list, updated, Transfer::id)))
                    .build());
            log.info("{} succeeded, transfer {} is {}", kind, transferId, updated.status());
            return updated;
        });
    }

    private Duration freshUntilExpiry(FxRate rate) {
        if (rate.expiresAt() == null) {
            return Freshness.FX_RATE.freshFor();
        }
        Duration remaining = Duration.between(clock.instant(), rate.expiresAt());
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    private Optional<Transfer> cachedTransfer(String transferId) {
        return transfers.peek(TRANSFERS_KEY).flatMap(list -> findById(list, transferId));
    }

    private static Optional<Transfer> findById(List<Transfer> list, String transferId) {
        return list.stream().filter(t -> Objects.equals(t.id(), transferId)).findFirst();
    }

    private List<Transfer> cachedTransfers(Predicate<Transfer> matching) {
        return transfers.current(TRANSFERS_KEY).orElse(List.of()).stream().filter(matching).toList();
    }

    private static BigDecimal total(List<Transfer> all, TransferType type, Predicate<Transfer> matching) {
        return all.stream()
                .filter(t -> t.type() == type)
                .filter(matching)
                .map(Transfer::amount)
                .filter(Objects::nonNull)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
