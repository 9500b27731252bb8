package com.growfolio.common.model;

/*
 * 09/18/2026 - 11:28 AM
 * @author Growfolio Engineering
 */

import com.growfolio.common.enums.OrderSide;

import java.math.BigDecimal;
import java.time.Instant;

public record StockOrder(
        String id,
        String symbol,
        OrderSide side,
        String type,
        String status,
        BigDecimal notional,
        BigDecimal quantity,
        BigDecimal filledQuantity,
        BigDecimal filledAvgPrice,
        Instant submittedAt,
        Instant filledAt,
        String clientOrderId) {
}
