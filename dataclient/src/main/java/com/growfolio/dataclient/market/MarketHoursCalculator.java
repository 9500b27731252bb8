package com.growfolio.dataclient.market;

/*
 * 09/23/2026 - 12:59 PM
 * @author Growfolio Engineering
 */

import com.growfolio.common.enums.MarketSession;
import com.growfolio.common.model.MarketHours;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * Local estimate of the NYSE session, used when the market status endpoint cannot be reached.
 * Weekends are closed; exchange holidays are not known and count as trading days.
 */
public class MarketHoursCalculator {

    public static final String EXCHANGE = "NYSE";
    public static final ZoneId NEW_YORK = ZoneId.of("America/New_York");

    private static final LocalTime PRE_MARKET_OPEN = LocalTime.of(4, 0);
    private static final LocalTime REGULAR_OPEN = LocalTime.of(9, 30);
    private static final LocalTime REGULAR_CLOSE = LocalTime.of(16, 0);
    private static final LocalTime AFTER_HOURS_CLOSE = LocalTime.of(20, 0);

    public MarketHours statusAt(Instant now) {
        ZonedDateTime local = now.atZone(NEW_YORK);
        LocalTime time = local.toLocalTime();
        boolean tradingDay = isTradingDay(local.toLocalDate());

        MarketSession session = sessionAt(tradingDay, time);
        Instant nextOpen = tradingDay && time.isBefore(REGULAR_OPEN)
                ? at(local.toLocalDate(), REGULAR_OPEN)
                : at(nextTradingDay(local.toLocalDate()), REGULAR_OPEN);
        Instant nextClose = tradingDay && time.isBefore(REGULAR_CLOSE)
                ? at(local.toLocalDate(), REGULAR_CLOSE)
                : at(nextTradingDay(local.toLocalDate()), REGULAR_CLOSE);

        return new MarketHours(EXCHANGE, session == MarketSession.REGULAR, session, nextOpen, nextClose, now);
    }

    private static MarketSession sessionAt(boolean tradingDay, LocalTime time) {
        if (!tradingDay || time.isBefore(PRE_MARKET_OPEN)) {
            return MarketSession.CLOSED;
        }
        if (time.isBefore(REGULAR_OPEN)) {
            return MarketSession.PRE_MARKET;
        }
        if (time.isBefore(REGULAR_CLOSE)) {
            return MarketSession.REGULAR;
        }
        if (time.isBefore(AFTER_HOURS_CLOSE)) {
            return MarketSession.AFTER_HOURS;
        }
        return MarketSession.CLOSED;
    }

    private static boolean isTradingDay(LocalDate date) {
        DayOfWeek day = date.getDayOfWeek();
        return day != DayOfWeek.SATURDAY && day != DayOfWeek.SUNDAY;
    }

    private static LocalDate nextTradingDay(LocalDate date) {
        LocalDate next = date.plusDays(1);
        while (!isTradingDay(next)) {
            next = next.plusDays(1);
        }
        return next;
    }

    private static Instant at(LocalDate date, LocalTime time) {
        return ZonedDateTime.of(date, time, NEW_YORK).toInstant();
    }
}
