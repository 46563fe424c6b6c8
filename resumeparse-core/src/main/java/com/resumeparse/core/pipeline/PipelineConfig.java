package com.resumeparse.core.pipeline;

import com.resumeparse.core.fallback.FallbackExtractor;
import com.resumeparse.llm.prompt.ResumeExtractionPrompts;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Immutable settings for one pipeline instance.
 */
@Value
@Builder(toBuilder = true)
public class PipelineConfig {
    @Builder.Default int maxAttempts = 3;
    @Builder.Default int batchSize = 5;
    @Builder.Default int maxWorkers = 4;
    @Builder.Default Duration chunkTimeout = Duration.ofSeconds(240);
    @Builder.Default Duration dispatchPause = Duration.ofMillis(250);
    @Builder.Default int maxCharsPerResume = ResumeExtractionPrompts.DEFAULT_MAX_CHARS_PER_RESUME;
    @Builder.Default int phoneMinDigits = FallbackExtractor.DEFAULT_PHONE_MIN_DIGITS;
    @Builder.Default int phoneWindowChars = FallbackExtractor.DEFAULT_PHONE_WINDOW_CHARS;
    @Builder.Default int nameScanLines = FallbackExtractor.DEFAULT_NAME_SCAN_LINES;
    
    public static PipelineConfig defaults() {
        return PipelineConfig.builder().build();
    }
}
