package com.resumeparse.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.resumeparse.common.constants.CandidateFields;
import lombok.Builder;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Canonical output unit. Every field is present and holds a trimmed string; missing
 * information is the empty string.
 */
@Value
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class CandidateRecord {
    String firstName;
    String lastName;
    String email;
    String phone;
    String currentTitle;
    String currentOrg;
    String previousTitle;
    String previousOrg;
    
    // unset and null builder values both become ""
    @Builder(toBuilder = true)
    private CandidateRecord(String firstName, String lastName, String email, String phone,
                            String currentTitle, String currentOrg, String previousTitle, String previousOrg) {
        this.firstName = orEmpty(firstName);
        this.lastName = orEmpty(lastName);
        this.email = orEmpty(email);
        this.phone = orEmpty(phone);
        this.currentTitle = orEmpty(currentTitle);
        this.currentOrg = orEmpty(currentOrg);
        this.previousTitle = orEmpty(previousTitle);
        this.previousOrg = orEmpty(previousOrg);
    }
    
    private static final CandidateRecord EMPTY = CandidateRecord.builder().build();
    
    private static String orEmpty(String value) {
        return value != null ? value : "";
    }
    
    public static CandidateRecord empty() {
        return EMPTY;
    }
    
    @JsonIgnore
    public boolean isEmpty() {
        return toFieldMap().values().stream().allMatch(String::isEmpty);
    }
    
    public boolean hasName() {
        return !firstName.isEmpty() || !lastName.isEmpty();
    }
    
    /**
     * Field values keyed by canonical field name, in canonical order.
     */
    public Map<String, String> toFieldMap() {
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put(CandidateFields.FIRST_NAME, firstName);
        fields.put(CandidateFields.LAST_NAME, lastName);
        fields.put(CandidateFields.EMAIL, email);
        fields.put(CandidateFields.PHONE, phone);
        fields.put(CandidateFields.CURRENT_TITLE, currentTitle);
        fields.put(CandidateFields.CURRENT_ORG, currentOrg);
        fields.put(CandidateFields.PREVIOUS_TITLE, previousTitle);
        fields.put(CandidateFields.PREVIOUS_ORG, previousOrg);
        return fields;
    }
}
