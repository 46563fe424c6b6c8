package com.resumeparse.core.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.resumeparse.common.constants.CandidateFields;
import com.resumeparse.core.model.CandidateRecord;
import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.Iterator;
import java.util.Locale;
import java.util.Map;

/**
 * Coerces one parsed JSON value into a {@link CandidateRecord}.
 * <p>
 * Canonical keys win over their aliases. Keys are matched case-insensitively and
 * unknown keys are dropped. Strings are trimmed, numbers and booleans are
 * stringified, and nested arrays or objects become the empty string. Never throws.
 */
@Slf4j
public class SchemaValidator {
    
    public CandidateRecord validate(JsonNode node) {
        if (node == null || !node.isObject()) {
            if (node != null && !node.isNull() && !node.isMissingNode()) {
                log.debug("[SCHEMA] Non-object value replaced by empty record | type={}", node.getNodeType());
            }
            return CandidateRecord.empty();
        }
        
        Map<String, JsonNode> byKey = lowerCaseKeys(node);
        if (log.isDebugEnabled()) {
            long unknown = byKey.keySet().stream().filter(key -> !CandidateFields.isKnown(key)).count();
            if (unknown > 0) {
                log.debug("[SCHEMA] Unknown keys dropped | count={}", unknown);
            }
        }
        return CandidateRecord.builder()
            .firstName(resolve(byKey, CandidateFields.FIRST_NAME))
            .lastName(resolve(byKey, CandidateFields.LAST_NAME))
            .email(resolve(byKey, CandidateFields.EMAIL))
            .phone(resolve(byKey, CandidateFields.PHONE))
            .currentTitle(resolve(byKey, CandidateFields.CURRENT_TITLE))
            .currentOrg(resolve(byKey, CandidateFields.CURRENT_ORG))
            .previousTitle(resolve(byKey, CandidateFields.PREVIOUS_TITLE))
            .previousOrg(resolve(byKey, CandidateFields.PREVIOUS_ORG))
            .build();
    }
    
    private Map<String, JsonNode> lowerCaseKeys(JsonNode node) {
        Map<String, JsonNode> byKey = new HashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            // first spelling wins when a reply repeats a key in different case
            byKey.putIfAbsent(field.getKey().trim().toLowerCase(Locale.ROOT), field.getValue());
        }
        return byKey;
    }
    
    private String resolve(Map<String, JsonNode> byKey, String field) {
        JsonNode value = byKey.get(field);
        if (isAbsent(value)) {
            for (String alias : CandidateFields.aliasesOf(field)) {
                JsonNode aliased = byKey.get(alias);
                if (!isAbsent(aliased)) {
                    value = aliased;
                    break;
                }
            }
        }
        return coerce(field, value);
    }
    
    private boolean isAbsent(JsonNode value) {
        return value == null || value.isNull() || value.isMissingNode();
    }
    
    private String coerce(String field, JsonNode value) {
        if (isAbsent(value)) {
            return "";
        }
        if (value.isContainerNode()) {
            log.debug("[SCHEMA] Structured value defaulted | field={} | type={}", field, value.getNodeType());
            return "";
        }
        return value.asText("").trim();
    }
}
