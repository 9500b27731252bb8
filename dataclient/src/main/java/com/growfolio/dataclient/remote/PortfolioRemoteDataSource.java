package com.growfolio.dataclient.remote;

/*
 * 09/24/2026 - 9:59 AM
 * @author Growfolio Engineering
 */

import com.growfolio.common.dto.Requests.CashTransferRequest;
import com.growfolio.common.dto.Requests.HoldingRequest;
import com.growfolio.common.dto.Requests.LedgerEntryRequest;
import com.growfolio.common.dto.Requests.PortfolioRequest;
import com.growfolio.common.model.Holding;
import com.growfolio.common.model.LedgerEntry;
import com.growfolio.common.model.Page;
import com.growfolio.common.model.Portfolio;

import java.util.List;

/**
 * Portfolios, their holdings and their ledgers on the Growfolio API.
 */
public interface PortfolioRemoteDataSource {

    List<Portfolio> listPortfolios();

    Portfolio getPortfolio(String portfolioId);

    Portfolio createPortfolio(PortfolioRequest request);

    Portfolio updatePortfolio(String portfolioId, PortfolioRequest request);

    Portfolio setDefaultPortfolio(String portfolioId);

    void deletePortfolio(String portfolioId);

    List<Holding> listHoldings(String portfolioId);

    Holding getHolding(String portfolioId, String holdingId);

    Holding addHolding(String portfolioId, HoldingRequest request);

    Holding updateHolding(String portfolioId, String holdingId, HoldingRequest request);

    void removeHolding(String portfolioId, String holdingId);

    Page<LedgerEntry> listLedgerEntries(String portfolioId, int page, int limit);

    LedgerEntry addLedgerEntry(String portfolioId, LedgerEntryRequest request);

    LedgerEntry updateLedgerEntry(String portfolioId, String entryId, LedgerEntryRequest request);

    void deleteLedgerEntry(String portfolioId, String entryId);

    void transferCash(CashTransferRequest request);
}
