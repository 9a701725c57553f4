package com.openforge.autopilot.intent;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Structured fields of an income-tax filing request.
 *
 * {@link #extract(String)} pulls whatever the user typed and falls back to the
 * documented defaults for everything else; it has no side effects.
 */
public record FilingDetails(
        String       panNumber,
        String       mobileNumber,
        String       assessmentYear,
        String       itrType,
        String       filingMode,
        List<Income>    additionalIncomes,
        List<Deduction> deductions
) {

    public static final String DEFAULT_PAN             = "ABCDE1234F";
    public static final String DEFAULT_MOBILE          = "9876543210";
    public static final String DEFAULT_ASSESSMENT_YEAR = "2023-24";
    public static final String DEFAULT_ITR_TYPE        = "ITR-2";
    public static final String DEFAULT_FILING_MODE     = "Online Filing";

    public static final List<Income> DEFAULT_INCOMES = List.of(
            new Income("Rental Income", 25_235),
            new Income("Interest Income", 3_252_530));

    public static final List<Deduction> DEFAULT_DEDUCTIONS = List.of(
            new Deduction("80D - Health Insurance Premium", "Health Insurance Premium", 25_000),
            new Deduction("80C - Tax Saving Investment", "Investment", 150_000));

    private static final Pattern PAN_PATTERN    = Pattern.compile("PAN[:\\s]*([A-Z]{5}[0-9]{4}[A-Z])");
    private static final Pattern MOBILE_PATTERN = Pattern.compile("(?:mobile|phone|number)[:\\s]*([0-9]{10})");
    private static final Pattern YEAR_PATTERN   = Pattern.compile("(?:assessment year|AY|year)[:\\s]*([0-9]{4}-[0-9]{2})");
    private static final Pattern ITR_PATTERN    = Pattern.compile("ITR[:\\s]*([1-4])");

    public record Income(String type, long amount) {}

    public record Deduction(String type, String description, long amount) {}

    public static FilingDetails extract(String text) {
        String source = text == null ? "" : text;
        return new FilingDetails(
                firstGroup(PAN_PATTERN, source.toUpperCase(Locale.ROOT), DEFAULT_PAN),
                firstGroup(MOBILE_PATTERN, source, DEFAULT_MOBILE),
                firstGroup(YEAR_PATTERN, source, DEFAULT_ASSESSMENT_YEAR),
                itrType(source),
                DEFAULT_FILING_MODE,
                DEFAULT_INCOMES,
                DEFAULT_DEDUCTIONS);
    }

    private static String itrType(String source) {
        Matcher m = ITR_PATTERN.matcher(source);
        return m.find() ? "ITR-" + m.group(1) : DEFAULT_ITR_TYPE;
    }

    private static String firstGroup(Pattern pattern, String source, String fallback) {
        Matcher m = pattern.matcher(source);
        return m.find() ? m.group(1) : fallback;
    }
}
