package com.growfolio.dataclient.remote;

/*
 * 09/24/2026 - 9:45 AM
 * @author Growfolio Engineering
 */

import com.growfolio.common.dto.Requests.ConfirmTransferRequest;
import com.growfolio.common.dto.Requests.TransferRequest;
import com.growfolio.common.model.FundingBalance;
import com.growfolio.common.model.FxRate;
import com.growfolio.common.model.Page;
import com.growfolio.common.model.Transfer;

/**
 * Funding account: balance, FX quotes, deposits and withdrawals.
 */
public interface FundingRemoteDataSource {

    FundingBalance getBalance();

    FxRate getFxRate();

    Transfer initiateDeposit(TransferRequest request);

    Transfer confirmDeposit(ConfirmTransferRequest request);

    Transfer initiateWithdrawal(TransferRequest request);

    Transfer confirmWithdrawal(ConfirmTransferRequest request);

    Transfer getTransfer(String transferId);

    Transfer cancelTransfer(String transferId);

    Page<Transfer> listTransfers(int page, int limit);
}
