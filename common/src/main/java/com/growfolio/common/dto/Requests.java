package com.growfolio.common.dto;

/*
 * 09/14/2026 - 9:00 AM
 * @author Growfolio Engineering
 */

import com.fasterxml.jackson.annotation.JsonProperty;
import com.growfolio.common.enums.AssetType;
import com.growfolio.common.enums.DcaFrequency;
import com.growfolio.common.enums.FamilyMemberRole;
import com.growfolio.common.enums.GoalCategory;
import com.growfolio.common.enums.LedgerEntryType;
import com.growfolio.common.enums.OrderSide;
import com.growfolio.common.enums.PortfolioType;
import lombok.Builder;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Request bodies sent to the Growfolio API. Field names are serialized in snake case.
 */
public final class Requests {

    private Requests() {}

    // ==================== Portfolio ====================

    @Builder
    public record PortfolioRequest(String name, String description, PortfolioType type, String currencyCode,
                                   String colorHex, String iconName) {
    }

    @Builder
    public record HoldingRequest(String stockSymbol, String stockName, BigDecimal quantity,
                                 BigDecimal averageCostPerShare, AssetType assetType, String sector, String industry) {
    }

    @Builder
    public record LedgerEntryRequest(LedgerEntryType type, String stockSymbol, BigDecimal quantity,
                                     BigDecimal pricePerShare, BigDecimal totalAmount, BigDecimal fees,
                                     String currencyCode, Instant transactionDate, String notes) {
    }

    public record CashTransferRequest(String sourcePortfolioId, String destinationPortfolioId,
                                      BigDecimal amount, String notes) {
    }

    // ==================== Goal ====================

    @Builder
    public record GoalRequest(String name, BigDecimal targetAmount, BigDecimal currentAmount, Instant targetDate,
                              String linkedPortfolioId, GoalCategory category, String iconName, String colorHex,
                              String notes,
                              @JsonProperty("is_archived") Boolean isArchived) {
    }

    // ==================== DCA ====================

    @Builder
    public record DcaScheduleRequest(String stockSymbol, String stockName, BigDecimal amount, DcaFrequency frequency,
                                     Integer preferredDayOfWeek, Integer preferredDayOfMonth, Instant startDate,
                                     Instant endDate, String portfolioId,
                                     @JsonProperty("is_active") Boolean isActive) {
    }

    // ==================== Family ====================

    public record FamilyRequest(String name, String description) {
    }

    public record InviteRequest(String email, FamilyMemberRole role, String message) {
    }

    public record MemberRoleRequest(FamilyMemberRole role) {
    }

    // ==================== Funding ====================

    public record TransferRequest(BigDecimal amount, String currency, String notes) {
    }

    public record ConfirmTransferRequest(String transferId, BigDecimal fxRate) {
    }

    // ==================== Stocks ====================

    public record OrderRequest(String symbol, OrderSide side, BigDecimal notional) {
    }

    public record WatchlistRequest(String symbol, String notes) {
    }

    // ==================== User ====================

    public record ProfileRequest(String displayName) {
    }

    @Builder
    public record PreferencesRequest(String preferredCurrency, Boolean notificationsEnabled, Boolean biometricEnabled,
                                     String timezoneIdentifier, String theme, Boolean hapticFeedbackEnabled,
                                     Boolean showBalances) {
    }
}
