package com.resumeparse.llm.provider;

public interface CompletionClient {
    
    /**
     * Sends one prompt and returns {@code choices[0].message.content}, possibly empty.
     */
    String complete(String prompt) throws CompletionException;
    
    LlmProvider getProvider();
    
    String getModel();
    
    class CompletionException extends RuntimeException {
        private final int statusCode;
        private final LlmProvider provider;
        private final String responseBody;
        private final boolean malformed;
        
        public CompletionException(String message, LlmProvider provider, int statusCode, String responseBody) {
            this(message, provider, statusCode, responseBody, false, null);
        }
        
        public CompletionException(String message, LlmProvider provider, int statusCode, String responseBody, Throwable cause) {
            this(message, provider, statusCode, responseBody, false, cause);
        }
        
        private CompletionException(String message, LlmProvider provider, int statusCode, String responseBody,
                                    boolean malformed, Throwable cause) {
            super(message, cause);
            this.provider = provider;
            this.statusCode = statusCode;
            this.responseBody = responseBody;
            this.malformed = malformed;
        }
        
        public static CompletionException malformed(String message, LlmProvider provider, String responseBody, Throwable cause) {
            return new CompletionException(message, provider, 200, responseBody, true, cause);
        }
        
        public int getStatusCode() { return statusCode; }
        public LlmProvider getProvider() { return provider; }
        public String getResponseBody() { return responseBody; }
        public boolean isMalformed() { return malformed; }
        public boolean isRateLimited() { return statusCode == 429; }
    }
}
