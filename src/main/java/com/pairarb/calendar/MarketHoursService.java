package com.pairarb.calendar;

import com.pairarb.domain.enums.AssetClass;
import com.pairarb.domain.model.Instrument;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import org.springframework.stereotype.Service;

/**
 * Session rules per asset class.
 *
 * <p>Crypto venues trade around the clock. Equity venues are open on weekdays that are
 * not listed holidays, between the regular open (inclusive) and close (exclusive) in the
 * exchange time zone, or between the extended open and close when extended hours are
 * enabled.
 */
@Service
public class MarketHoursService implements MarketSessionGate {

    private final MarketHoursProperties marketHoursProperties;

    public MarketHoursService(MarketHoursProperties marketHoursProperties) {
        this.marketHoursProperties = marketHoursProperties;
    }

    @Override
    public boolean isMarketOpen(Instrument instrument, Instant now) {
        if (instrument.assetClass() == AssetClass.CRYPTO) {
            return true;
        }
        ZonedDateTime local = now.atZone(ZoneId.of(marketHoursProperties.getTimezone()));
        if (!isTradingDay(local.toLocalDate())) {
            return false;
        }
        return isWithinSession(local.toLocalTime());
    }

    /** Weekdays that are not configured holidays. */
    public boolean isTradingDay(LocalDate date) {
        DayOfWeek dow = date.getDayOfWeek();
        if (dow == DayOfWeek.SATURDAY || dow == DayOfWeek.SUNDAY) {
            return false;
        }
        return !marketHoursProperties.getHolidays().contains(date);
    }

    private boolean isWithinSession(LocalTime time) {
        LocalTime open = marketHoursProperties.isExtendedHoursEnabled()
                ? marketHoursProperties.getExtendedOpen()
                : marketHoursProperties.getRegularOpen();
        LocalTime close = marketHoursProperties.isExtendedHoursEnabled()
                ? marketHoursProperties.getExtendedClose()
                : marketHoursProperties.getRegularClose();
        return !time.isBefore(open) && time.isBefore(close);
    }
}
