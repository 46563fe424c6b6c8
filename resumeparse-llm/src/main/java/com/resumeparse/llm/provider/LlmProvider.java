package com.resumeparse.llm.provider;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * OpenAI-compatible chat completion endpoints the extractor can talk to.
 */
@Getter
@RequiredArgsConstructor
public enum LlmProvider {
    
    OPENROUTER(
        "OpenRouter",
        "https://openrouter.ai/api/v1/chat/completions",
        "deepseek/deepseek-chat-v3-0324"
    ),
    
    GROQ(
        "Groq",
        "https://api.groq.com/openai/v1/chat/completions",
        "llama-3.3-70b-versatile"
    ),
    
    CEREBRAS(
        "Cerebras",
        "https://api.cerebras.ai/v1/chat/completions",
        "llama3.1-70b"
    ),
    
    SAMBANOVA(
        "SambaNova",
        "https://api.sambanova.ai/v1/chat/completions",
        "Meta-Llama-3.1-70B-Instruct"
    );
    
    private final String displayName;
    private final String baseUrl;
    private final String defaultModel;
    
    public static LlmProvider fromString(String name) {
        for (LlmProvider provider : values()) {
            if (provider.name().equalsIgnoreCase(name) ||
                provider.getDisplayName().equalsIgnoreCase(name)) {
                return provider;
            }
        }
        throw new IllegalArgumentException("Unknown provider: " + name);
    }
}
