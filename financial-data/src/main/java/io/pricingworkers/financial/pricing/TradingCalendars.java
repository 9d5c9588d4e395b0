package io.pricingworkers.financial.pricing;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.Month;
import java.util.ArrayList;
import java.util.List;

/**
 * US equity trading calendar: weekdays minus NYSE holidays.
 */
public final class TradingCalendars {
    private TradingCalendars() {}

    public static boolean isWeekday(LocalDate d) {
        DayOfWeek dow = d.getDayOfWeek();
        return dow != DayOfWeek.SATURDAY && dow != DayOfWeek.SUNDAY;
    }

    public static boolean isUsEquityTradingDay(LocalDate d) {
        return isWeekday(d) && !isUsEquityHoliday(d);
    }

    /** Trading days strictly between {@code from} and {@code to}. */
    public static List<LocalDate> tradingDaysBetween(LocalDate from, LocalDate to) {
        List<LocalDate> out = new ArrayList<>();
        for (LocalDate d = from.plusDays(1); d.isBefore(to); d = d.plusDays(1)) {
            if (isUsEquityTradingDay(d)) out.add(d);
        }
        return out;
    }

    // Fixed-date holidays with observed rules, floating Monday holidays, Thanksgiving and Good Friday.
    public static boolean isUsEquityHoliday(LocalDate d) {
        if (isObserved(d, Month.JANUARY, 1)) return true;       // New Year's Day
        if (isObserved(d, Month.JUNE, 19) && d.getYear() >= 2022) return true; // Juneteenth
        if (isObserved(d, Month.JULY, 4)) return true;          // Independence Day
        if (isObserved(d, Month.DECEMBER, 25)) return true;     // Christmas Day

        if (isNthWeekdayOfMonth(d, 3, DayOfWeek.MONDAY, Month.JANUARY)) return true;    // MLK Day
        if (isNthWeekdayOfMonth(d, 3, DayOfWeek.MONDAY, Month.FEBRUARY)) return true;   // Presidents' Day
        if (isLastWeekdayOfMonth(d, DayOfWeek.MONDAY, Month.MAY)) return true;          // Memorial Day
        if (isNthWeekdayOfMonth(d, 1, DayOfWeek.MONDAY, Month.SEPTEMBER)) return true;  // Labor Day
        if (isNthWeekdayOfMonth(d, 4, DayOfWeek.THURSDAY, Month.NOVEMBER)) return true; // Thanksgiving

        return d.equals(easterSunday(d.getYear()).minusDays(2));                      // Good Friday
    }

    private static boolean isObserved(LocalDate d, Month m, int day) {
        LocalDate date = LocalDate.of(d.getYear(), m, day);
        DayOfWeek dow = date.getDayOfWeek();
        LocalDate observed = date;
        // NYSE does not observe New Year's Day on the preceding Friday
        if (dow == DayOfWeek.SATURDAY && m != Month.JANUARY) observed = date.minusDays(1);
        else if (dow == DayOfWeek.SUNDAY) observed = date.plusDays(1);
        return d.equals(observed);
    }

    private static boolean isNthWeekdayOfMonth(LocalDate d, int n, DayOfWeek dow, Month m) {
        if (d.getMonth() != m || d.getDayOfWeek() != dow) return false;
        return (d.getDayOfMonth() + 6) / 7 == n;
    }

    private static boolean isLastWeekdayOfMonth(LocalDate d, DayOfWeek dow, Month m) {
        if (d.getMonth() != m || d.getDayOfWeek() != dow) return false;
        return d.getDayOfMonth() + 7 > d.lengthOfMonth();
    }

    // Anonymous Gregorian algorithm
    static LocalDate easterSunday(int year) {
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
