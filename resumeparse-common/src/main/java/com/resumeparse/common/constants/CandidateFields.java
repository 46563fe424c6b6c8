package com.resumeparse.common.constants;

import java.util.List;
import java.util.Locale;
import java.util.Map;

public final class CandidateFields {
    public static final String FIRST_NAME = "first_name";
    public static final String LAST_NAME = "last_name";
    public static final String EMAIL = "email";
    public static final String PHONE = "phone";
    public static final String CURRENT_TITLE = "current_title";
    public static final String CURRENT_ORG = "current_org";
    public static final String PREVIOUS_TITLE = "previous_title";
    public static final String PREVIOUS_ORG = "previous_org";
    
    public static final List<String> CANONICAL = List.of(
        FIRST_NAME, LAST_NAME, EMAIL, PHONE,
        CURRENT_TITLE, CURRENT_ORG, PREVIOUS_TITLE, PREVIOUS_ORG
    );
    
    // Keys models commonly emit instead of the canonical ones
    public static final Map<String, List<String>> ALIASES = Map.of(
        LAST_NAME, List.of("family_name", "surname"),
        PHONE, List.of("mobile", "phone_number"),
        CURRENT_TITLE, List.of("current_job_title", "job_title"),
        CURRENT_ORG, List.of("current_company", "company"),
        PREVIOUS_TITLE, List.of("previous_job_title"),
        PREVIOUS_ORG, List.of("previous_company")
    );
    
    private CandidateFields() {}
    
    public static List<String> aliasesOf(String field) {
        return ALIASES.getOrDefault(field, List.of());
    }
    
    /**
     * True for canonical keys and for any of their aliases.
     */
    public static boolean isKnown(String key) {
        if (key == null) {
            return false;
        }
        String lower = key.toLowerCase(Locale.ROOT);
        return CANONICAL.contains(lower) || ALIASES.values().stream().anyMatch(aliases -> aliases.contains(lower));
    }
}
