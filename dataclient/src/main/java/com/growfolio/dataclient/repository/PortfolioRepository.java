package com.growfolio.dataclient.repository;

/*
 * 09/25/2026 - 2:47 PM
 * @author Growfolio Engineering
 */

import com.growfolio.common.dto.Requests.CashTransferRequest;
import com.growfolio.common.dto.Requests.HoldingRequest;
import com.growfolio.common.dto.Requests.LedgerEntryRequest;
import com.growfolio.common.dto.Requests.PortfolioRequest;
import com.growfolio.common.enums.AllocationGrouping;
import com.growfolio.common.model.Holding;
import com.growfolio.common.model.LedgerEntry;
import com.growfolio.common.model.Page;
import com.growfolio.common.model.Portfolio;
import com.growfolio.common.model.Summaries.HoldingsSummary;
import com.growfolio.common.model.Summaries.PortfolioAllocation;
import com.growfolio.common.model.Summaries.PortfoliosSummary;
import com.growfolio.synccore.resource.RefreshOutcome;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * Portfolios with their holdings and ledgers.
 * <p>
 * Reads are served from cache while fresh. Any write scoped to one portfolio (holding, ledger or cash
 * movement) drops that portfolio's holdings and the portfolio list, since totals change server side.
 * Derived reads ({@link #defaultPortfolio()}, summaries, allocation) only look at what is cached.
 */
public interface PortfolioRepository {

    // ==================== Portfolios ====================

    List<Portfolio> fetchPortfolios();

    /**
     * Reload the list even when fresh. On a transient failure the cached list comes back marked stale.
     */
    RefreshOutcome<List<Portfolio>> refreshPortfolios();

    /**
     * Answered from the cached list when it holds the portfolio; otherwise loaded and cached on its own.
     */
    Portfolio fetchPortfolio(String portfolioId);

    Optional<Portfolio> defaultPortfolio();

    Portfolio createPortfolio(PortfolioRequest request);

    Portfolio updatePortfolio(String portfolioId, PortfolioRequest request);

    Portfolio setDefaultPortfolio(String portfolioId);

    /**
     * @throws com.growfolio.common.exception.ApiExceptions.DomainRuleViolationException when the cached
     *         data shows {@code portfolioId} is the default portfolio
     */
    void deletePortfolio(String portfolioId);

    // ==================== Holdings ====================

    List<Holding> fetchHoldings(String portfolioId);

    Holding fetchHolding(String portfolioId, String holdingId);

    Holding addHolding(String portfolioId, HoldingRequest request);

    Holding updateHolding(String portfolioId, String holdingId, HoldingRequest request);

    void removeHolding(String portfolioId, String holdingId);

    RefreshOutcome<List<Holding>> refreshHoldingPrices(String portfolioId);

    // ==================== Ledger ====================

    /**
     * One page of ledger entries, never cached. {@code limit} is capped at the configured page size.
     */
    Page<LedgerEntry> fetchLedgerEntries(String portfolioId, int page, int limit);

    LedgerEntry addLedgerEntry(String portfolioId, LedgerEntryRequest request);

    LedgerEntry updateLedgerEntry(String portfolioId, String entryId, LedgerEntryRequest request);

    void deleteLedgerEntry(String portfolioId, String entryId);

    LedgerEntry depositCash(String portfolioId, BigDecimal amount, String notes);

    LedgerEntry withdrawCash(String portfolioId, BigDecimal amount, String notes);

    void transferCash(CashTransferRequest request);

    // ==================== Derived ====================

    PortfolioAllocation allocation(String portfolioId, AllocationGrouping grouping);

    HoldingsSummary holdingsSummary(String portfolioId);

    PortfoliosSummary portfoliosSummary();

    // ==================== Cache control ====================

    void invalidateCache();

    /**
     * Drop the cached data of one portfolio: the portfolio itself and its holdings.
     */
    void invalidateCache(String portfolioId);
}
