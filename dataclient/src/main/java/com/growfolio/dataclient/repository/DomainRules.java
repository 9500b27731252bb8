package com.growfolio.dataclient.repository;

/*
 * 09/25/2026 - 2:01 PM
 * @author Growfolio Engineering
 */

import com.growfolio.common.exception.ApiExceptions.DomainRuleViolationException;

import java.math.BigDecimal;

/**
 * Checks repositories run against their arguments and cached state before calling the API.
 */
final class DomainRules {

    static final String INVALID_AMOUNT = "INVALID_AMOUNT";
    static final String INSUFFICIENT_FUNDS = "INSUFFICIENT_FUNDS";
    static final String TRANSFER_NOT_CANCELLABLE = "TRANSFER_NOT_CANCELLABLE";
    static final String DEFAULT_PORTFOLIO = "DEFAULT_PORTFOLIO";
    static final String SAME_PORTFOLIO = "SAME_PORTFOLIO";

    private DomainRules() {}

    static BigDecimal requirePositive(BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new DomainRuleViolationException("Amount must be greater than zero", INVALID_AMOUNT);
        }
        return amount;
    }
}
