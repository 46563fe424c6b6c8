package com.resumeparse.core.config;

import com.resumeparse.core.pipeline.PipelineConfig;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Getter
@Setter
@ConfigurationProperties(prefix = "resumeparse.pipeline")
public class PipelineProperties {
    
    private int maxAttempts = 3;
    private int batchSize = 5;
    private int maxWorkers = 4;
    private int chunkTimeoutSeconds = 240;
    private long dispatchPauseMs = 250;
    private int maxCharsPerResume = 15_000;
    private Fallback fallback = new Fallback();
    
    @Getter
    @Setter
    public static class Fallback {
        // model phones with fewer digits are treated as invalid
        private int phoneMinDigits = 8;
        private int phoneWindowChars = 150;
        private int nameScanLines = 10;
    }
    
    public PipelineConfig toPipelineConfig() {
        return PipelineConfig.builder()
            .maxAttempts(maxAttempts)
            .batchSize(batchSize)
            .maxWorkers(maxWorkers)
            .chunkTimeout(Duration.ofSeconds(chunkTimeoutSeconds))
            .dispatchPause(Duration.ofMillis(Math.max(0, dispatchPauseMs)))
            .maxCharsPerResume(maxCharsPerResume)
            .phoneMinDigits(fallback.getPhoneMinDigits())
            .phoneWindowChars(fallback.getPhoneWindowChars())
            .nameScanLines(fallback.getNameScanLines())
            .build();
    }
}
