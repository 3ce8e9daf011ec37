package com.deepansh.historyagent.fetch;

import com.deepansh.historyagent.history.DateRange;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.temporal.TemporalAdjusters;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns relative time phrases into concrete date ranges against the injected clock.
 *
 * Calendar phrases ("last year", "last month", "last week") mean the previous whole
 * calendar period; counted phrases ("last 30 days", "past 3 months") are trailing
 * windows that end today.
 */
@Component
public class TimeRangeResolver {

    private static final Pattern TRAILING = Pattern.compile("(?:last|past|previous)\\s+(\\d{1,4})\\s+(day|week|month|year)s?");
    private static final Pattern YEAR = Pattern.compile("(?:in\\s+)?(\\d{4})");
    private static final Pattern YEAR_MONTH = Pattern.compile("(\\d{4})-(\\d{2})");

    private final Clock clock;

    public TimeRangeResolver(Clock clock) {
        this.clock = clock;
    }

    /** Empty when the phrase is not recognised */
    public Optional<DateRange> resolve(String expression) {
        if (expression == null || expression.isBlank()) {
            return Optional.empty();
        }
        String phrase = expression.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
        LocalDate today = LocalDate.now(clock);

        switch (phrase) {
            case "all time", "all", "ever", "overall":
                return Optional.of(DateRange.ALL);
            case "today":
                return Optional.of(new DateRange(today, today));
            case "yesterday":
                return Optional.of(new DateRange(today.minusDays(1), today.minusDays(1)));
            case "this week":
                return Optional.of(new DateRange(today.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY)), today));
            case "last week", "previous week": {
                LocalDate monday = today.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY)).minusWeeks(1);
                return Optional.of(new DateRange(monday, monday.plusDays(6)));
            }
            case "this month":
                return Optional.of(new DateRange(today.withDayOfMonth(1), today));
            case "last month", "previous month": {
                YearMonth month = YearMonth.from(today).minusMonths(1);
                return Optional.of(new DateRange(month.atDay(1), month.atEndOfMonth()));
            }
            case "this year":
                return Optional.of(new DateRange(today.withDayOfYear(1), today));
            case "last year", "previous year": {
                int year = today.getYear() - 1;
                return Optional.of(new DateRange(LocalDate.of(year, 1, 1), LocalDate.of(year, 12, 31)));
            }
            default:
                return resolvePattern(phrase, today);
        }
    }

    private Optional<DateRange> resolvePattern(String phrase, LocalDate today) {
        Matcher trailing = TRAILING.matcher(phrase);
        if (trailing.matches()) {
            int n = Integer.parseInt(trailing.group(1));
            if (n == 0) return Optional.empty();
            LocalDate start = switch (trailing.group(2)) {
                case "day" -> today.minusDays(n - 1L);
                case "week" -> today.minusWeeks(n).plusDays(1);
                case "month" -> today.minusMonths(n).plusDays(1);
                default -> today.minusYears(n).plusDays(1);
            };
            return Optional.of(new DateRange(start, today));
        }

        Matcher year = YEAR.matcher(phrase);
        if (year.matches()) {
            int y = Integer.parseInt(year.group(1));
            return Optional.of(new DateRange(LocalDate.of(y, 1, 1), LocalDate.of(y, 12, 31)));
        }

        Matcher yearMonth = YEAR_MONTH.matcher(phrase);
        if (yearMonth.matches()) {
            int m = Integer.parseInt(yearMonth.group(2));
            if (m < 1 || m > 12) return Optional.empty();
            YearMonth month = YearMonth.of(Integer.parseInt(yearMonth.group(1)), m);
            return Optional.of(new DateRange(month.atDay(1), month.atEndOfMonth()));
        }

        return Optional.empty();
    }
}
