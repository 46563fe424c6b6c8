package com.resumeparse.core.fallback;

import java.util.List;
import java.util.regex.Pattern;

final class JobTitleLexicon {
    
    static final List<Pattern> LABELED = List.of(
        Pattern.compile("(?i)\\b(?:current\\s+position|job\\s+title|position|title|role)\\s*:\\s*([^.\\n]+)"),
        Pattern.compile("(?i)\\b(?:working|employed)\\s+as\\s+(?:an?\\s+)?([^.\\n,]+)")
    );
    
    // longer phrases ahead of the shorter ones they contain
    static final List<String> TITLES = List.of(
        "warehouse inventory team lead", "inventory team lead", "team leader",
        "operations manager", "warehouse manager", "general manager", "production manager",
        "logistics manager", "supply chain manager", "distribution manager",
        "customer service manager", "key account manager", "account manager", "sales manager",
        "office manager",
        "logistics coordinator", "warehouse coordinator", "inventory coordinator",
        "shipping coordinator", "receiving coordinator",
        "warehouse supervisor", "receiving supervisor", "supervisor",
        "warehouse team member", "warehouse associate", "forklift operator", "pick packer",
        "fabric processor", "cd packer",
        "customer service officer", "sales representative", "client servicing consultant",
        "business development consultant",
        "data scientist", "software engineer", "software developer", "web developer",
        "data analyst", "research programmer", "analyst programmer", "systems analyst",
        "business analyst", "research fellow",
        "waitress", "kitchen hand", "retail associate", "administration officer",
        "merchandising", "security officer"
    );
    
    static final List<Pattern> TITLE_PATTERNS = TITLES.stream()
        .map(title -> Pattern.compile(Pattern.quote(title), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE))
        .toList();
    
    private JobTitleLexicon() {}
}
