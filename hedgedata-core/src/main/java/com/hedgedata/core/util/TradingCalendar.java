package com.hedgedata.core.util;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.Month;
import java.time.temporal.TemporalAdjusters;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * US equity (NYSE) trading days: weekdays minus the exchange's full-day holidays.
 * Used to decide whether a gap in cached prices can contain any bar at all.
 */
public final class TradingCalendar {

    private static final Map<Integer, Set<LocalDate>> HOLIDAYS_BY_YEAR = new ConcurrentHashMap<>();

    private TradingCalendar() {
        // Prevent instantiation
    }

    public static boolean isTradingDay(LocalDate date) {
        DayOfWeek dow = date.getDayOfWeek();
        if (dow == DayOfWeek.SATURDAY || dow == DayOfWeek.SUNDAY) {
            return false;
        }
        return !holidays(date.getYear()).contains(date);
    }

    /**
     * True if [from, to] (inclusive) contains at least one trading day.
     */
    public static boolean hasTradingDay(LocalDate from, LocalDate to) {
        for (LocalDate d = from; !d.isAfter(to); d = d.plusDays(1)) {
            if (isTradingDay(d)) {
                return true;
            }
        }
        return false;
    }

    static Set<LocalDate> holidays(int year) {
        return HOLIDAYS_BY_YEAR.computeIfAbsent(year, TradingCalendar::computeHolidays);
    }

    private static Set<LocalDate> computeHolidays(int year) {
        Set<LocalDate> days = new HashSet<>();
        days.add(observed(LocalDate.of(year, Month.JANUARY, 1)));
        days.add(nth(year, Month.JANUARY, DayOfWeek.MONDAY, 3));        // Martin Luther King Jr. Day
        days.add(nth(year, Month.FEBRUARY, DayOfWeek.MONDAY, 3));       // Washington's Birthday
        days.add(easterSunday(year).minusDays(2));                      // Good Friday
        days.add(LocalDate.of(year, Month.MAY, 31)
            .with(TemporalAdjusters.lastInMonth(DayOfWeek.MONDAY)));    // Memorial Day
        if (year >= 2022) {
            days.add(observed(LocalDate.of(year, Month.JUNE, 19)));     // Juneteenth
        }
        days.add(observed(LocalDate.of(year, Month.JULY, 4)));
        days.add(nth(year, Month.SEPTEMBER, DayOfWeek.MONDAY, 1));      // Labor Day
        days.add(nth(year, Month.NOVEMBER, DayOfWeek.THURSDAY, 4));     // Thanksgiving
        days.add(observed(LocalDate.of(year, Month.DECEMBER, 25)));
        return Set.copyOf(days);
    }

    // Saturday holidays are observed on Friday, Sunday holidays on Monday
    private static LocalDate observed(LocalDate date) {
        return switch (date.getDayOfWeek()) {
            case SATURDAY -> date.minusDays(1);
            case SUNDAY -> date.plusDays(1);
            default -> date;
        };
    }

    private static LocalDate nth(int year, Month month, DayOfWeek dow, int n) {
        return LocalDate.of(year, month, 1).with(TemporalAdjusters.dayOfWeekInMonth(n, dow));
    }

    // Meeus/Jones/Butcher computus
    private static LocalDate easterSunday(int year) {
        int a = year % 19;
        int b = year / 100;
        int c = year % 100;
        int d = b / 4;
        int e = b % 4;
        int f = (b + 8) / 25;
        int g = (b - f + 1) / 3;
        int h = (19 * a + b - d - g + 15) % 30;
        int i = c / 4;
        int k = c % 4;
        int l = (32 + 2 * e + 2 * i - h - k) % 7;
        int m = (a + 11 * h + 22 * l) / 451;
        int month = (h + l - 7 * m + 114) / 31;
        int day = ((h + l - 7 * m + 114) % 31) + 1;
        return LocalDate.of(year, month, day);
    }
}
