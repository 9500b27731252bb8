package com.growfolio.dataclient.remote;

/*
 * 09/24/2026 - 10:44 AM
 * @author Growfolio Engineering
 */

import com.fasterxml.jackson.core.type.TypeReference;
import com.growfolio.common.dto.Requests.CashTransferRequest;
import com.growfolio.common.dto.Requests.HoldingRequest;
import com.growfolio.common.dto.Requests.LedgerEntryRequest;
import com.growfolio.common.dto.Requests.PortfolioRequest;
import com.growfolio.common.model.Holding;
import com.growfolio.common.model.LedgerEntry;
import com.growfolio.common.model.Page;
import com.growfolio.common.model.Portfolio;
import org.springframework.http.HttpMethod;

import java.util.List;
import java.util.Map;

public class RestPortfolioRemoteDataSource implements PortfolioRemoteDataSource {

    private static final TypeReference<List<Portfolio>> PORTFOLIOS = new TypeReference<>() {};
    private static final TypeReference<Portfolio> PORTFOLIO = new TypeReference<>() {};
    private static final TypeReference<List<Holding>> HOLDINGS = new TypeReference<>() {};
    private static final TypeReference<Holding> HOLDING = new TypeReference<>() {};
    private static final TypeReference<Page<LedgerEntry>> LEDGER_PAGE = new TypeReference<>() {};
    private static final TypeReference<LedgerEntry> LEDGER_ENTRY = new TypeReference<>() {};

    private final ApiClient api;

    public RestPortfolioRemoteDataSource(ApiClient api) {
        this.api = api;
    }

    @Override
    public List<Portfolio> listPortfolios() {
        return api.get(PORTFOLIOS, "/portfolios");
    }

    @Override
    public Portfolio getPortfolio(String portfolioId) {
        return api.get(PORTFOLIO, "/portfolios/{id}", portfolioId);
    }

    @Override
    public Portfolio createPortfolio(PortfolioRequest request) {
        return api.post(PORTFOLIO, request, "/portfolios");
    }

    @Override
    public Portfolio updatePortfolio(String portfolioId, PortfolioRequest request) {
        return api.patch(PORTFOLIO, request, "/portfolios/{id}", portfolioId);
    }

    @Override
    public Portfolio setDefaultPortfolio(String portfolioId) {
        return api.post(PORTFOLIO, Map.of(), "/portfolios/{id}/default", portfolioId);
    }

    @Override
    public void deletePortfolio(String portfolioId) {
        api.delete("/portfolios/{id}", portfolioId);
    }

    // ==================== Holdings ====================

    @Override
    public List<Holding> listHoldings(String portfolioId) {
        return api.get(HOLDINGS, "/portfolios/{id}/holdings", portfolioId);
    }

    @Override
    public Holding getHolding(String portfolioId, String holdingId) {
        return api.get(HOLDING, "/portfolios/{id}/holdings/{holdingId}", portfolioId, holdingId);
    }

    @Override
    public Holding addHolding(String portfolioId, HoldingRequest request) {
        return api.post(HOLDING, request, "/portfolios/{id}/holdings", portfolioId);
    }

    @Override
    public Holding updateHolding(String portfolioId, String holdingId, HoldingRequest request) {
        return api.patch(HOLDING, request, "/portfolios/{id}/holdings/{holdingId}", portfolioId, holdingId);
    }

    @Override
    public void removeHolding(String portfolioId, String holdingId) {
        api.delete("/portfolios/{id}/holdings/{holdingId}", portfolioId, holdingId);
    }

    // ==================== Ledger ====================

    @Override
    public Page<LedgerEntry> listLedgerEntries(String portfolioId, int page, int limit) {
        return api.get(LEDGER_PAGE, Map.of("page", page, "limit", limit), "/portfolios/{id}/ledger", portfolioId);
    }

    @Override
    public LedgerEntry addLedgerEntry(String portfolioId, LedgerEntryRequest request) {
        return api.post(LEDGER_ENTRY, request, "/portfolios/{id}/ledger", portfolioId);
    }

    @Override
    public LedgerEntry updateLedgerEntry(String portfolioId, String entryId, LedgerEntryRequest request) {
        return api.patch(LEDGER_ENTRY, request, "/portfolios/{id}/ledger/{entryId}", portfolioId, entryId);
    }

    @Override
    public void deleteLedgerEntry(String portfolioId, String entryId) {
        api.delete("/portfolios/{id}/ledger/{entryId}", portfolioId, entryId);
    }

    @Override
    public void transferCash(CashTransferRequest request) {
        api.send(HttpMethod.POST, request, "/portfolios/transfer-cash");
    }
}
