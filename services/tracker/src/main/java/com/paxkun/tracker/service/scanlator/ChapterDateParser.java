package com.paxkun.tracker.service.scanlator;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the publication dates scanlator sites print next to chapters.
 * <p>
 * Layers, in order: relative ("3 days ago", "an hour ago"), "today"/"yesterday", then a list of
 * absolute formats. Anything else resolves to the current time; this parser never throws.
 */
@Slf4j
public class ChapterDateParser {

    private static final Pattern RELATIVE = Pattern.compile(
            "\\b(\\d+|an?)\\s+(second|minute|hour|day|week|month|year)s?\\s+ago");
    private static final Pattern DATE_IN_TEXT = Pattern.compile(
            "(?:January|February|March|April|May|June|July|August|September|October|November|December)"
                    + "\\s+\\d{1,2}(?:st|nd|rd|th)?,?\\s+\\d{4}"
                    + "|\\b(?:\\d+|an?)\\s+(?:second|minute|hour|day|week|month|year)s?\\s+ago",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern ORDINAL_SUFFIX = Pattern.compile("\\b(\\d{1,2})(st|nd|rd|th)\\b");

    private static final List<DateTimeFormatter> ABSOLUTE_FORMATS = List.of(
            formatter("MMM d, yyyy"),
            formatter("MMMM d, yyyy"),
            formatter("MMMM d yyyy"),
            formatter("MMM d yyyy"),
            formatter("yyyy-MM-dd"),
            formatter("dd/MM/yyyy"),
            formatter("MM/dd/yyyy"));

    private final Clock clock;

    public ChapterDateParser(Clock clock) {
        this.clock = clock;
    }

    public LocalDateTime parse(String text) {
        return parse(text, LocalDateTime.now(clock));
    }

    public LocalDateTime parse(String text, LocalDateTime reference) {
        if (text == null || text.isBlank()) {
            return reference;
        }

        String normalized = text.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");

        Matcher relative = RELATIVE.matcher(normalized);
        if (relative.find()) {
            String amountText = relative.group(1);
            try {
                long amount = amountText.startsWith("a") ? 1 : Long.parseLong(amountText);
                return minus(reference, amount, relative.group(2));
            } catch (NumberFormatException | ArithmeticException | DateTimeException e) {
                log.debug("Relative date '{}' out of range, using current time", text);
                return reference;
            }
        }
        if (normalized.contains("yesterday")) {
            return reference.minusDays(1);
        }
        if (normalized.contains("today")) {
            return reference;
        }

        String absolute = ORDINAL_SUFFIX.matcher(normalized).replaceAll("$1");
        for (DateTimeFormatter format : ABSOLUTE_FORMATS) {
            try {
                return LocalDate.parse(absolute, format).atStartOfDay();
            } catch (DateTimeParseException ignored) {
                // next format
            }
        }

        log.debug("Could not parse date '{}', using current time", text);
        return reference;
    }

    /**
     * Finds the first date-looking fragment inside free text, for layouts that do not
     * put the date in its own element.
     *
     * @return the fragment, or an empty string
     */
    public String findDateText(String text) {
        if (text == null) {
            return "";
        }
        Matcher matcher = DATE_IN_TEXT.matcher(text);
        return matcher.find() ? matcher.group() : "";
    }

    private LocalDateTime minus(LocalDateTime reference, long amount, String unit) {
        return switch (unit) {
            case "second" -> reference.minusSeconds(amount);
            case "minute" -> reference.minusMinutes(amount);
            case "hour" -> reference.minusHours(amount);
            case "day" -> reference.minusDays(amount);
            case "week" -> reference.minusWeeks(amount);
            case "month" -> reference.minusDays(Math.multiplyExact(amount, 30));
            case "year" -> reference.minusDays(Math.multiplyExact(amount, 365));
            default -> reference;
        };
    }

    private static DateTimeFormatter formatter(String pattern) {
        return new DateTimeFormatterBuilder()
                .parseCaseInsensitive()
                .appendPattern(pattern)
                .toFormatter(Locale.ENGLISH);
    }
}
