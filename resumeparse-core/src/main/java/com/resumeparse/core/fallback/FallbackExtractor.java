package com.resumeparse.core.fallback;

import com.resumeparse.common.util.TextNormalizer;
import com.resumeparse.core.model.CandidateRecord;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Deterministic recovery of contact, name and title fields from the raw resume text.
 * <p>
 * Only empty or structurally invalid values are replaced; a usable value from the
 * model is always kept. The same record and text always produce the same output.
 */
@Slf4j
public class FallbackExtractor {
    
    public static final int DEFAULT_PHONE_MIN_DIGITS = 8;
    public static final int DEFAULT_PHONE_WINDOW_CHARS = 150;
    public static final int DEFAULT_NAME_SCAN_LINES = 10;
    
    static final int MAX_TITLE_LENGTH = 100;
    
    private static final Pattern EMAIL = Pattern.compile("\\b[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}\\b");
    private static final Pattern PHONE_DISALLOWED = Pattern.compile("[^\\d\\-()+.\\s]");
    private static final List<String> BOILERPLATE = List.of(
        "resume", "curriculum", "vitae", "profile", "page", "contact"
    );
    private static final Pattern CV_WORD = Pattern.compile("(?i)\\bcv\\b");
    
    private final int phoneMinDigits;
    private final int phoneWindowChars;
    private final int nameScanLines;
    
    public FallbackExtractor() {
        this(DEFAULT_PHONE_MIN_DIGITS, DEFAULT_PHONE_WINDOW_CHARS, DEFAULT_NAME_SCAN_LINES);
    }
    
    public FallbackExtractor(int phoneMinDigits, int phoneWindowChars, int nameScanLines) {
        this.phoneMinDigits = Math.max(1, phoneMinDigits);
        this.phoneWindowChars = Math.max(0, phoneWindowChars);
        this.nameScanLines = Math.max(0, nameScanLines);
    }
    
    public CandidateRecord enrich(CandidateRecord record, String rawText) {
        CandidateRecord base = record != null ? record : CandidateRecord.empty();
        String text = rawText != null ? rawText : "";
        CandidateRecord.CandidateRecordBuilder builder = base.toBuilder();
        
        String email = resolveEmail(base.getEmail(), text);
        builder.email(email);
        builder.phone(resolvePhone(base.getPhone(), email, text));
        
        if (!base.hasName()) {
            guessName(text).ifPresent(name -> builder.firstName(name[0]).lastName(name[1]));
        }
        if (base.getCurrentTitle().isEmpty()) {
            guessJobTitle(text).ifPresent(builder::currentTitle);
        }
        return clean(builder.build());
    }
    
    /**
     * Collapses whitespace in every field and strips characters a phone number never holds.
     */
    public CandidateRecord clean(CandidateRecord record) {
        String phone = PHONE_DISALLOWED.matcher(record.getPhone()).replaceAll("");
        return CandidateRecord.builder()
            .firstName(TextNormalizer.collapseWhitespace(record.getFirstName()))
            .lastName(TextNormalizer.collapseWhitespace(record.getLastName()))
            .email(TextNormalizer.collapseWhitespace(record.getEmail()))
            .phone(TextNormalizer.collapseWhitespace(phone))
            .currentTitle(TextNormalizer.collapseWhitespace(record.getCurrentTitle()))
            .currentOrg(TextNormalizer.collapseWhitespace(record.getCurrentOrg()))
            .previousTitle(TextNormalizer.collapseWhitespace(record.getPreviousTitle()))
            .previousOrg(TextNormalizer.collapseWhitespace(record.getPreviousOrg()))
            .build();
    }
    
    String resolveEmail(String modelEmail, String text) {
        String current = modelEmail == null ? "" : modelEmail.trim();
        if (!current.isEmpty() && current.indexOf('@') > 0) {
            return current;
        }
        Matcher matcher = EMAIL.matcher(text);
        if (matcher.find()) {
            log.debug("[FALLBACK] Email recovered from text");
            return matcher.group();
        }
        return "";
    }
    
    String resolvePhone(String modelPhone, String email, String text) {
        String current = modelPhone == null ? "" : modelPhone.trim();
        
        String found = null;
        if (!email.isEmpty() && phoneWindowChars > 0) {
            int at = text.indexOf(email);
            if (at >= 0) {
                found = firstPhone(text.substring(at, Math.min(text.length(), at + phoneWindowChars)));
            }
        }
        if (found == null) {
            found = firstPhone(text);
        }
        
        if (found == null || TextNormalizer.countDigits(current) >= phoneMinDigits) {
            return current;
        }
        if (!current.isEmpty()) {
            log.debug("[FALLBACK] Short phone replaced | digits={}", TextNormalizer.countDigits(current));
        }
        return found;
    }
    
    private String firstPhone(String text) {
        for (Pattern pattern : PhonePatterns.ORDERED) {
            Matcher matcher = pattern.matcher(text);
            if (matcher.find()) {
                return matcher.group().trim();
            }
        }
        return null;
    }
    
    Optional<String[]> guessName(String text) {
        int scanned = 0;
        for (String rawLine : text.split("\\R")) {
            String line = rawLine.trim();
            if (line.isEmpty()) {
                continue;
            }
            if (scanned++ >= nameScanLines) {
                break;
            }
            if (isBoilerplate(line) || containsKnownTitle(line)) {
                continue;
            }
            
            String[] tokens = line.split("\\s+");
            if (tokens.length < 2 || tokens.length > 4) {
                continue;
            }
            List<String> parts = new ArrayList<>(tokens.length);
            boolean allNameLike = true;
            for (String token : tokens) {
                String part = token.replaceAll(",+$", "");
                if (!isNameToken(part)) {
                    allNameLike = false;
                    break;
                }
                parts.add(part);
            }
            if (allNameLike) {
                String first = parts.get(0);
                String last = String.join(" ", parts.subList(1, parts.size()));
                return Optional.of(new String[] {first, last});
            }
        }
        return Optional.empty();
    }
    
    private boolean isBoilerplate(String line) {
        String lower = line.toLowerCase(Locale.ROOT);
        for (String word : BOILERPLATE) {
            if (lower.contains(word)) {
                return true;
            }
        }
        return CV_WORD.matcher(line).find();
    }
    
    private boolean containsKnownTitle(String line) {
        return JobTitleLexicon.TITLE_PATTERNS.stream().anyMatch(title -> title.matcher(line).find());
    }
    
    private boolean isNameToken(String token) {
        String letters = token.replace(".", "").replace(",", "");
        if (letters.isEmpty() || !Character.isUpperCase(letters.charAt(0))) {
            return false;
        }
        for (int i = 0; i < letters.length(); i++) {
            char c = letters.charAt(i);
            if (!Character.isLetter(c) && c != '-' && c != '\'') {
                return false;
            }
        }
        return true;
    }
    
    Optional<String> guessJobTitle(String text) {
        for (Pattern pattern : JobTitleLexicon.LABELED) {
            Matcher matcher = pattern.matcher(text);
            while (matcher.find()) {
                String title = matcher.group(1).trim();
                if (!title.isEmpty() && title.length() < MAX_TITLE_LENGTH) {
                    return Optional.of(titleCase(title));
                }
            }
        }
        
        // offsets come from the original text so they stay valid for substring
        for (Pattern title : JobTitleLexicon.TITLE_PATTERNS) {
            Matcher matcher = title.matcher(text);
            if (!matcher.find()) {
                continue;
            }
            String segment = segmentAround(text, matcher.start(), matcher.end()).trim();
            return Optional.of(titleCase(segment.length() < MAX_TITLE_LENGTH ? segment : matcher.group()));
        }
        return Optional.empty();
    }
    
    // the sentence or line piece containing [start, end)
    private String segmentAround(String text, int start, int end) {
        int from = start;
        while (from > 0 && text.charAt(from - 1) != '.' && text.charAt(from - 1) != '\n') {
            from--;
        }
        int to = end;
        while (to < text.length() && text.charAt(to) != '.' && text.charAt(to) != '\n') {
            to++;
        }
        return text.substring(from, to);
    }
    
    static String titleCase(String value) {
        StringBuilder out = new StringBuilder(value.length());
        boolean startOfWord = true;
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (Character.isLetter(c)) {
                out.append(startOfWord ? Character.toUpperCase(c) : Character.toLowerCase(c));
                startOfWord = false;
            } else {
                out.append(c);
                startOfWord = true;
            }
        }
        return out.toString();
    }
}
