package com.resumeparse.common.util;

import java.util.regex.Pattern;

/**
 * Cleans extracted resume text before it is sent to the completion service.
 * OCR and PDF conversion leave broken lines, bullet glyphs and stray spacing behind.
 */
public final class TextNormalizer {
    private static final Pattern EXCESS_NEWLINES = Pattern.compile("\\n{3,}");
    private static final Pattern SPACE_RUNS = Pattern.compile("[ \\t]{2,}");
    private static final Pattern TRAILING_SPACES = Pattern.compile("[ \\t]+\\n");
    private static final Pattern LEADING_SPACES = Pattern.compile("\\n[ \\t]+");
    private static final Pattern HYPHENATED_BREAK = Pattern.compile("(\\p{L})-\\s*\\n\\s*(\\p{Ll})");
    private static final Pattern BULLETS = Pattern.compile("[\\u2022\\u25AA\\u25AB\\u25CF\\u25E6]");
    private static final Pattern SPACED_AT = Pattern.compile("\\s*@\\s*");
    
    private TextNormalizer() {}
    
    public static String normalize(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String result = text.replace("\r\n", "\n").replace('\r', '\n');
        result = BULLETS.matcher(result).replaceAll("");
        result = HYPHENATED_BREAK.matcher(result).replaceAll("$1$2");
        result = SPACE_RUNS.matcher(result).replaceAll(" ");
        result = TRAILING_SPACES.matcher(result).replaceAll("\n");
        result = LEADING_SPACES.matcher(result).replaceAll("\n");
        result = EXCESS_NEWLINES.matcher(result).replaceAll("\n\n");
        result = SPACED_AT.matcher(result).replaceAll("@");
        return result.trim();
    }
    
    public static String truncate(String text, int maxChars) {
        if (text == null) {
            return "";
        }
        if (maxChars <= 0 || text.length() <= maxChars) {
            return text;
        }
        return text.substring(0, maxChars) + "...";
    }
    
    /**
     * Collapses internal whitespace runs to a single space and trims.
     */
    public static String collapseWhitespace(String value) {
        if (value == null) {
            return "";
        }
        return value.replaceAll("\\s+", " ").trim();
    }
    
    public static int countDigits(String value) {
        if (value == null) {
            return 0;
        }
        int digits = 0;
        for (int i = 0; i < value.length(); i++) {
            if (Character.isDigit(value.charAt(i))) {
                digits++;
            }
        }
        return digits;
    }
}
