package com.resumeparse.llm.prompt;

import com.resumeparse.common.util.TextNormalizer;

import java.util.List;

public final class ResumeExtractionPrompts {
    
    public static final int DEFAULT_MAX_CHARS_PER_RESUME = 15_000;
    
    private static final String INSTRUCTIONS = """
            You are a strict JSON generator for resume parsing. Do not include any explanations or markdown. Output must be valid JSON only.
            
            INPUT_RESUMES (ordered):
            %s
            TASK
            For each resume, extract the following fields:
            - first_name
            - last_name
            - email
            - phone
            - current_title
            - current_org
            - previous_title
            - previous_org
            
            OUTPUT REQUIREMENTS
            1) Return a JSON array with length = %d, the number of input resumes.
            2) The i-th array item corresponds to Resume i (same order).
            3) Keys must be EXACTLY these (snake_case). No extra keys.
            4) All values must be strings. If unknown, use "".
            5) Do NOT wrap the JSON in code fences or add prose.
            
            DISAMBIGUATION RULES
            - Name splitting: if the full name has >= 2 tokens, first_name = first token, last_name = the rest (unchanged). If only one token, first_name = token, last_name = "".
            - Phone: return the first plausible phone number found (prefer the header/top of the first page). Keep original formatting.
            - Email: return the first valid email found.
            - Current vs previous roles: the job with the most recent end date (or ongoing markers like "Present", "Current", "Now") is current. The chronologically prior job is previous. If only one job exists, fill current_* and leave previous_* empty.
            
            OUTPUT JSON EXAMPLE (shape only; values are examples):
            [
              {
                "first_name": "Alicia",
                "last_name": "Tan Li Mei",
                "email": "alicia.tan@example.com",
                "phone": "+60123456789",
                "current_title": "Software Engineer",
                "current_org": "Grab",
                "previous_title": "Intern",
                "previous_org": "Petronas"
              }
            ]
            """;
    
    private ResumeExtractionPrompts() {}
    
    /**
     * Builds one prompt covering every resume in {@code resumeTexts}, numbered from 1 in input order.
     */
    public static String buildBatchPrompt(List<String> resumeTexts, int maxCharsPerResume) {
        StringBuilder block = new StringBuilder();
        for (int i = 0; i < resumeTexts.size(); i++) {
            String text = TextNormalizer.truncate(resumeTexts.get(i), maxCharsPerResume);
            block.append("Resume ").append(i + 1).append(":\n").append(text).append("\n\n");
        }
        return String.format(INSTRUCTIONS, block, resumeTexts.size());
    }
}
