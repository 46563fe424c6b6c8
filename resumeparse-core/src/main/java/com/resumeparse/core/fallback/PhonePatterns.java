package com.resumeparse.core.fallback;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Phone shapes in the order they are tried. Earlier patterns are more specific.
 */
final class PhonePatterns {
    
    static final List<Pattern> ORDERED = List.of(
        // international, country code first
        Pattern.compile("\\+\\d{1,3}[\\s-]?\\(?\\d{1,4}\\)?(?:[\\s-]?\\d{2,4}){2,3}\\b"),
        // mobile and landline with a leading zero
        Pattern.compile("\\b04\\d{2}\\s?\\d{3}\\s?\\d{3}\\b"),
        Pattern.compile("\\b0\\d{3}\\s?\\d{3}\\s?\\d{3}\\b"),
        Pattern.compile("\\b06\\d\\s?\\d{3}\\s?\\d{4}\\b"),
        Pattern.compile("\\b\\d{3}-\\d{3}-\\d{4}\\b"),
        Pattern.compile("\\b\\d{3}\\.\\d{3}\\.\\d{4}\\b"),
        Pattern.compile("\\(\\d{2,4}\\)\\s?\\d{3,4}[\\s-]?\\d{4}\\b"),
        Pattern.compile("\\b0\\d{9}\\b"),
        Pattern.compile("\\b\\d{10}\\b")
    );
    
    private PhonePatterns() {}
}
