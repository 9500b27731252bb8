package com.growfolio.dataclient.repository;

/*
 * 09/25/2026 - 2:18 PM
 * @author Growfolio Engineering
 */

import com.growfolio.common.enums.TransferStatus;
import com.growfolio.common.enums.TransferType;
import com.growfolio.common.model.FundingBalance;
import com.growfolio.common.model.FxRate;
import com.growfolio.common.model.Page;
import com.growfolio.common.model.Summaries.TransferSummary;
import com.growfolio.common.model.Transfer;

import java.math.BigDecimal;
import java.util.List;

/**
 * Funding balance, FX quotes and transfers in and out of the funding account.
 * <p>
 * Every transfer mutation clears the cached balance. New transfers go to the head of the cached transfer
 * list, updated ones replace their entry.
 */
public interface FundingRepository {

    FundingBalance fetchBalance();

    /**
     * Cached until the rate's own expiry.
     */
    FxRate fetchFxRate();

    /**
     * @throws com.growfolio.common.exception.ApiExceptions.DomainRuleViolationException for a non-positive amount
     */
    Transfer initiateDeposit(BigDecimal amount, String notes);

    Transfer confirmDeposit(String transferId, BigDecimal fxRate);

    /**
     * Checks the balance first; fails with {@code INSUFFICIENT_FUNDS} without calling the API when the
     * available amount is lower than {@code amount}.
     */
    Transfer initiateWithdrawal(BigDecimal amount, String notes);

    Transfer confirmWithdrawal(String transferId, BigDecimal fxRate);

    Transfer fetchTransfer(String transferId);

    /**
     * Fails with {@code TRANSFER_NOT_CANCELLABLE} when the cached transfer is no longer pending or processing.
     */
    Transfer cancelTransfer(String transferId);

    List<Transfer> fetchAllTransfers();

    Page<Transfer> fetchTransferHistory(int page, int limit);

    // ==================== Derived ====================

    List<Transfer> transfersByType(TransferType type);

    List<Transfer> transfersByStatus(TransferStatus status);

    List<Transfer> pendingTransfers();

    TransferSummary summary();

    void invalidateCache();
}
