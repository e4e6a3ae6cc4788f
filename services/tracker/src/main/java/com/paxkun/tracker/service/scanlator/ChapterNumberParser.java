package com.paxkun.tracker.service.scanlator;

import lombok.extern.slf4j.Slf4j;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns chapter labels such as "Chapter 42.5", "Ch.7" or "Capítulo 12" into a chapter number.
 */
@Slf4j
public final class ChapterNumberParser {

    public static final String UNKNOWN = "0";

    private static final Pattern PREFIX = Pattern.compile(
            "^(chapter|ch\\.?|episode|ep\\.?|cap[ií]tulo|cap\\.?)\\s*",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    private static final Pattern NUMBER = Pattern.compile("(\\d+(?:\\.\\d+)?)");

    private ChapterNumberParser() {
    }

    public static String parse(String rawText) {
        if (rawText == null || rawText.isBlank()) {
            log.warn("⚠️ Could not parse chapter number from empty text");
            return UNKNOWN;
        }

        String cleaned = PREFIX.matcher(rawText.trim()).replaceFirst("");
        Matcher matcher = NUMBER.matcher(cleaned);
        if (matcher.find()) {
            return matcher.group(1);
        }

        log.warn("⚠️ Could not parse chapter number from: {}", rawText.trim());
        return UNKNOWN;
    }
}
