/* (C)2026 */
package com.ammann.pse.sampling;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Frame rate helpers for the values declared by media sources.
 */
public final class FrameRates {

    private static final Pattern RATIONAL = Pattern.compile("^\\s*(\\d+(?:\\.\\d+)?)\\s*/\\s*(\\d+(?:\\.\\d+)?)\\s*$");

    private FrameRates() {}

    /**
     * Parses a declared frame rate such as {@code "25/1"}, {@code "30000/1001"} or
     * {@code "29.97"}.
     *
     * @param frameRate declared rate, may be {@code null}
     * @return frames per second, or 0 if the value is missing, malformed or has a zero denominator
     */
    public static double parse(String frameRate) {
        if (frameRate == null || frameRate.isBlank()) {
            return 0.0;
        }

        Matcher matcher = RATIONAL.matcher(frameRate);
        if (matcher.matches()) {
            double numerator = Double.parseDouble(matcher.group(1));
            double denominator = Double.parseDouble(matcher.group(2));
            return denominator == 0.0 ? 0.0 : numerator / denominator;
        }

        try {
            double rate = Double.parseDouble(frameRate.trim());
            return Double.isFinite(rate) ? rate : 0.0;
        } catch (NumberFormatException e) {
            return 0.0;
        }
    }

    /**
     * Returns {@code frameRate} if it is a usable positive rate, otherwise {@code fallback}.
     */
    public static double orDefault(Double frameRate, double fallback) {
        if (frameRate == null || !Double.isFinite(frameRate) || frameRate <= 0.0) {
            return fallback;
        }
        return frameRate;
    }
}
