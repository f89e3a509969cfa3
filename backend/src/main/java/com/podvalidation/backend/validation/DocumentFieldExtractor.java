package com.podvalidation.backend.validation;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads checklist fields out of OCR text.
 */
@Component
public class DocumentFieldExtractor {

    /**
     * Summary totals above this are treated as misreads.
     */
    public static final int MAX_PLAUSIBLE_CASES = 500;

    private static final List<Pattern> PO_PATTERNS = List.of(
            Pattern.compile("\\bpurchase\\s+order\\s*(?:number|no\\.?|#)?\\s*[:#]?\\s*([A-Z0-9\\-]*\\d[A-Z0-9\\-]*)",
                    Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bP\\.?\\s?O\\.?(?![a-z])\\s*(?:number|no\\.?|#)?\\s*[:#]?\\s*([A-Z0-9\\-]*\\d[A-Z0-9\\-]*)",
                    Pattern.CASE_INSENSITIVE));

    private static final List<Pattern> TOTAL_CASES_PATTERNS = List.of(
            Pattern.compile("\\btotal\\s+(?:cases|qty|quantity)\\s*[:#]?\\s*(\\d{1,6})\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bgrand\\s+total\\s*[:#]?\\s*(\\d{1,6})\\b", Pattern.CASE_INSENSITIVE));

    private static final List<Pattern> TIME_OUT_PATTERNS = List.of(
            Pattern.compile("\\btime[\\s\\-]?out\\s*[:\\-]?\\s*(\\d{1,2}:\\d{2}(?:\\s*[AP]M)?)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bdeparture\\s+time\\s*[:\\-]?\\s*(\\d{1,2}:\\d{2}(?:\\s*[AP]M)?)", Pattern.CASE_INSENSITIVE));

    public Optional<String> extractPoNumber(String text) {
        return firstMatch(text, PO_PATTERNS).map(value -> value.toUpperCase(Locale.ROOT));
    }

    /**
     * Total case count from a "Total Cases/Qty/Quantity" summary line, if one is readable and
     * plausible.
     */
    public Optional<Integer> extractTotalCases(String text) {
        if (text == null) {
            return Optional.empty();
        }
        for (Pattern pattern : TOTAL_CASES_PATTERNS) {
            Matcher matcher = pattern.matcher(text);
            while (matcher.find()) {
                int value = Integer.parseInt(matcher.group(1));
                if (value > 0 && value <= MAX_PLAUSIBLE_CASES) {
                    return Optional.of(value);
                }
            }
        }
        return Optional.empty();
    }

    public Optional<String> extractTimeOut(String text) {
        return firstMatch(text, TIME_OUT_PATTERNS).map(value -> value.toUpperCase(Locale.ROOT));
    }

    private Optional<String> firstMatch(String text, List<Pattern> patterns) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        for (Pattern pattern : patterns) {
            Matcher matcher = pattern.matcher(text);
            if (matcher.find()) {
                return Optional.of(matcher.group(1).trim());
            }
        }
        return Optional.empty();
    }
}
