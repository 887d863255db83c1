package com.pairarb.calendar;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Equity session hours, loaded from application.properties via the
 * {@code pairarb.market-hours} prefix. Crypto venues ignore these settings.
 */
@Component
@ConfigurationProperties(prefix = "pairarb.market-hours")
public class MarketHoursProperties {

    private String timezone = "America/New_York";
    private LocalTime regularOpen = LocalTime.of(9, 30);
    private LocalTime regularClose = LocalTime.of(16, 0);
    private LocalTime extendedOpen = LocalTime.of(4, 0);
    private LocalTime extendedClose = LocalTime.of(20, 0);

    /** When true, pre- and post-market hours count as open. */
    private boolean extendedHoursEnabled = false;

    /** Full-day exchange holidays. Weekends are always closed and need not be listed. */
    private List<LocalDate> holidays = new ArrayList<>();

    public String getTimezone() {
        return timezone;
    }

    public void setTimezone(String timezone) {
        this.timezone = timezone;
    }

    public LocalTime getRegularOpen() {
        return regularOpen;
    }

    public void setRegularOpen(LocalTime regularOpen) {
        this.regularOpen = regularOpen;
    }

    public LocalTime getRegularClose() {
        return regularClose;
    }

    public void setRegularClose(LocalTime regularClose) {
        this.regularClose = regularClose;
    }

    public LocalTime getExtendedOpen() {
        return extendedOpen;
    }

    public void setExtendedOpen(LocalTime extendedOpen) {
        this.extendedOpen = extendedOpen;
    }

    public LocalTime getExtendedClose() {
        return extendedClose;
    }

    public void setExtendedClose(LocalTime extendedClose) {
        this.extendedClose = extendedClose;
    }

    public boolean isExtendedHoursEnabled() {
        return extendedHoursEnabled;
    }

    public void setExtendedHoursEnabled(boolean extendedHoursEnabled) {
        this.extendedHoursEnabled = extendedHoursEnabled;
    }

    public List<LocalDate> getHolidays() {
        return holidays;
    }

    public void setHolidays(List<LocalDate> holidays) {
        this.holidays = holidays;
    }
}
