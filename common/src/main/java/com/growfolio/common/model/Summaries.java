package com.growfolio.common.model;

/*
 * 09/18/2026 - 11:53 AM
 * @author Growfolio Engineering
 */

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.List;

/**
 * Aggregates computed on the client from cached collections.
 */
public final class Summaries {

    private Summaries() {}

    public record AllocationItem(String category, BigDecimal value, BigDecimal percentage) {
    }

    public record PortfolioAllocation(String portfolioId, List<AllocationItem> allocations, Instant calculatedAt) {
        public PortfolioAllocation {
            allocations = List.copyOf(allocations);
        }
    }

    public record PortfoliosSummary(
            int totalPortfolios,
            BigDecimal totalValue,
            BigDecimal totalCostBasis,
            BigDecimal totalCashBalance) {

        public BigDecimal totalReturn() {
            return totalValue.subtract(totalCostBasis);
        }

        public BigDecimal totalReturnPercentage() {
            return percentage(totalReturn(), totalCostBasis);
        }
    }

    public record HoldingsSummary(
            int totalHoldings,
            BigDecimal totalMarketValue,
            BigDecimal totalCostBasis,
            BigDecimal totalUnrealizedGainLoss,
            int profitableHoldings,
            int unprofitableHoldings) {

        public BigDecimal overallGainLossPercentage() {
            return percentage(totalUnrealizedGainLoss, totalCostBasis);
        }
    }

    public record GoalsSummary(
            int totalGoals,
            int achievedGoals,
            int inProgressGoals,
            BigDecimal totalTargetAmount,
            BigDecimal totalCurrentAmount) {

        public double overallProgress() {
            if (totalTargetAmount.signum() <= 0) {
                return 0.0;
            }
            return totalCurrentAmount.divide(totalTargetAmount, 6, RoundingMode.HALF_UP).doubleValue();
        }
    }

    public record TransferSummary(
            List<Transfer> transfers,
            BigDecimal totalDeposits,
            BigDecimal totalWithdrawals,
            BigDecimal pendingDeposits,
            BigDecimal pendingWithdrawals) {

        public TransferSummary {
            transfers = List.copyOf(transfers);
        }

        public BigDecimal netDeposits() {
            return totalDeposits.subtract(totalWithdrawals);
        }
    }

    public record DcaSummary(
            int activeSchedules,
            BigDecimal totalMonthlyInvestment,
            BigDecimal totalInvested,
            int totalExecutions) {
    }

    public record UpcomingExecution(
            String scheduleId,
            String stockSymbol,
            String stockName,
            BigDecimal amount,
            Instant executionDate,
            String portfolioId) {
    }

    static BigDecimal percentage(BigDecimal part, BigDecimal whole) {
        if (whole == null || whole.signum() == 0) {
            return BigDecimal.ZERO;
        }
        return part.multiply(BigDecimal.valueOf(100)).divide(whole, 2, RoundingMode.HALF_UP);
    }
}
