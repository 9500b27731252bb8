package com.growfolio.common.model;

/*
 * 09/18/2026 - 11:22 AM
 * @author Growfolio Engineering
 */

import com.growfolio.common.enums.HistoryPeriod;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

public record StockHistory(String symbol, HistoryPeriod period, List<DataPoint> dataPoints) {

    public StockHistory {
        dataPoints = dataPoints != null ? List.copyOf(dataPoints) : List.of();
    }

    public record DataPoint(Instant date, BigDecimal open, BigDecimal high, BigDecimal low, BigDecimal close, long volume) {
    }
}
