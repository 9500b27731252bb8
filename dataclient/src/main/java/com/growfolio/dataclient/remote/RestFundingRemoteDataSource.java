package com.growfolio.dataclient.remote;

/*
 * 09/24/2026 - 10:26 AM
 * @author Growfolio Engineering
 */

import com.fasterxml.jackson.core.type.TypeReference;
import com.growfolio.common.dto.Requests.ConfirmTransferRequest;
import com.growfolio.common.dto.Requests.TransferRequest;
import com.growfolio.common.model.FundingBalance;
import com.growfolio.common.model.FxRate;
import com.growfolio.common.model.Page;
import com.growfolio.common.model.Transfer;

import java.util.Map;

public class RestFundingRemoteDataSource implements FundingRemoteDataSource {

    private static final TypeReference<FundingBalance> BALANCE = new TypeReference<>() {};
    private static final TypeReference<FxRate> FX_RATE = new TypeReference<>() {};
    private static final TypeReference<Transfer> TRANSFER = new TypeReference<>() {};
    private static final TypeReference<Page<Transfer>> TRANSFER_PAGE = new TypeReference<>() {};

    private final ApiClient api;

    public RestFundingRemoteDataSource(ApiClient api) {
        this.api = api;
    }

    @Override
    public FundingBalance getBalance() {
        return api.get(BALANCE, "/funding/balance");
    }

    @Override
    public FxRate getFxRate() {
        return api.get(FX_RATE, "/funding/fx-rate");
    }

    @Override
    public Transfer initiateDeposit(TransferRequest request) {
        return api.post(TRANSFER, request, "/funding/deposit");
    }

    @Override
    public Transfer confirmDeposit(ConfirmTransferRequest request) {
        return api.post(TRANSFER, request, "/funding/deposit/confirm");
    }

    @Override
    public Transfer initiateWithdrawal(TransferRequest request) {
        return api.post(TRANSFER, request, "/funding/withdraw");
    }

    @Override
    public Transfer confirmWithdrawal(ConfirmTransferRequest request) {
        return api.post(TRANSFER, request, "/funding/withdraw/confirm");
    }

    @Override
    public Transfer getTransfer(String transferId) {
        return api.get(TRANSFER, "/funding/transfers/{id}", transferId);
    }

    @Override
    public Transfer cancelTransfer(String transferId) {
        return api.post(TRANSFER, Map.of(), "/funding/transfers/{id}/cancel", transferId);
    }

    @Override
    public Page<Transfer> listTransfers(int page, int limit) {
        return api.get(TRANSFER_PAGE, Map.of("page", page, "limit", limit), "/funding/history");
    }
}
