package com.resumeparse.core.normalize;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.resumeparse.core.model.CandidateRecord;
import com.resumeparse.core.schema.SchemaValidator;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Turns a raw completion reply into exactly {@code expectedCount} records.
 * <p>
 * Code fences are stripped first. If the remaining text is not valid JSON the
 * outermost bracketed span is tried instead. A single object counts as a list of one,
 * nested lists are reduced to their first element, and anything else is discarded.
 * The result is padded with empty records or truncated to the expected length.
 */
@Slf4j
public class ResponseNormalizer {
    
    private static final String JSON_FENCE = "```json";
    private static final String FENCE = "```";
    
    private final ObjectReader reader;
    private final SchemaValidator schemaValidator;
    
    public ResponseNormalizer(ObjectMapper objectMapper, SchemaValidator schemaValidator) {
        this.reader = objectMapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
        this.schemaValidator = schemaValidator;
    }
    
    public List<CandidateRecord> normalize(String rawReply, int expectedCount) {
        return normalizeReply(rawReply, expectedCount).getRecords();
    }
    
    public NormalizedReply normalizeReply(String rawReply, int expectedCount) {
        int count = Math.max(0, expectedCount);
        String body = stripFences(rawReply);
        JsonNode root = parse(body);
        
        boolean parsed = root != null && (root.isArray() || root.isObject());
        if (!parsed) {
            log.warn("[NORMALIZE] Reply held no usable JSON | expected={} | replyChars={}",
                count, rawReply == null ? 0 : rawReply.length());
        }
        
        List<JsonNode> items = parsed ? toItems(root) : Collections.emptyList();
        if (parsed && items.size() != count) {
            log.info("[NORMALIZE] Reply length adjusted | expected={} | received={}", count, items.size());
        }
        
        List<CandidateRecord> records = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            records.add(i < items.size() ? schemaValidator.validate(items.get(i)) : CandidateRecord.empty());
        }
        return new NormalizedReply(records, parsed);
    }
    
    static String stripFences(String rawReply) {
        if (rawReply == null) {
            return "";
        }
        String text = rawReply.trim();
        if (text.regionMatches(true, 0, JSON_FENCE, 0, JSON_FENCE.length())) {
            text = text.substring(JSON_FENCE.length());
        } else if (text.startsWith(FENCE)) {
            text = text.substring(FENCE.length());
        }
        if (text.endsWith(FENCE)) {
            text = text.substring(0, text.length() - FENCE.length());
        }
        return text.trim();
    }
    
    private JsonNode parse(String body) {
        if (body.isEmpty()) {
            return null;
        }
        JsonNode whole = tryRead(body);
        if (whole != null && whole.isContainerNode()) {
            return whole;
        }
        
        int objectStart = body.indexOf('{');
        int arrayStart = body.indexOf('[');
        // outermost span: whichever bracket opens first is tried first
        boolean arrayFirst = arrayStart >= 0 && (objectStart < 0 || arrayStart < objectStart);
        JsonNode span = arrayFirst
            ? trySpan(body, arrayStart, ']')
            : trySpan(body, objectStart, '}');
        if (span == null) {
            span = arrayFirst
                ? trySpan(body, objectStart, '}')
                : trySpan(body, arrayStart, ']');
        }
        return span != null ? span : whole;
    }
    
    private JsonNode trySpan(String body, int start, char closing) {
        if (start < 0) {
            return null;
        }
        int end = body.lastIndexOf(closing);
        if (end <= start) {
            return null;
        }
        JsonNode node = tryRead(body.substring(start, end + 1));
        return node != null && node.isContainerNode() ? node : null;
    }
    
    private JsonNode tryRead(String text) {
        try {
            JsonNode node = reader.readTree(text);
            return node == null || node.isMissingNode() ? null : node;
        } catch (JsonProcessingException e) {
            log.debug("[NORMALIZE] Candidate text is not JSON | reason={}", e.getOriginalMessage());
            return null;
        }
    }
    
    private List<JsonNode> toItems(JsonNode root) {
        if (root.isObject()) {
            return List.of(root);
        }
        List<JsonNode> items = new ArrayList<>(root.size());
        for (JsonNode item : root) {
            JsonNode current = item;
            while (current.isArray()) {
                current = current.size() > 0 ? current.get(0) : null;
                if (current == null) {
                    break;
                }
            }
            // scalars and empty lists keep their slot as an empty record
            items.add(current);
        }
        return items;
    }
}
