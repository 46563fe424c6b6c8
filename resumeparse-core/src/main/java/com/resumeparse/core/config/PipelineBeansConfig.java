package com.resumeparse.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.resumeparse.core.fallback.FallbackExtractor;
import com.resumeparse.core.normalize.ResponseNormalizer;
import com.resumeparse.core.pipeline.ExtractionPipeline;
import com.resumeparse.core.pipeline.PipelineConfig;
import com.resumeparse.core.schema.SchemaValidator;
import com.resumeparse.llm.orchestrator.RequestOrchestrator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
@EnableConfigurationProperties(PipelineProperties.class)
public class PipelineBeansConfig {
    
    @Bean
    public PipelineConfig pipelineConfig(PipelineProperties properties) {
        PipelineConfig config = properties.toPipelineConfig();
        log.info("[CONFIG] Pipeline configured | batchSize={} | maxWorkers={} | maxAttempts={} | chunkTimeoutSec={}",
            config.getBatchSize(), config.getMaxWorkers(), config.getMaxAttempts(), config.getChunkTimeout().toSeconds());
        return config;
    }
    
    @Bean
    public SchemaValidator schemaValidator() {
        return new SchemaValidator();
    }
    
    @Bean
    public ResponseNormalizer responseNormalizer(ObjectMapper objectMapper, SchemaValidator schemaValidator) {
        return new ResponseNormalizer(objectMapper, schemaValidator);
    }
    
    @Bean
    public FallbackExtractor fallbackExtractor(PipelineConfig config) {
        return new FallbackExtractor(config.getPhoneMinDigits(), config.getPhoneWindowChars(), config.getNameScanLines());
    }
    
    @Bean
    public ExtractionPipeline extractionPipeline(RequestOrchestrator requestOrchestrator,
                                                 ResponseNormalizer responseNormalizer,
                                                 FallbackExtractor fallbackExtractor,
                                                 PipelineConfig config) {
        return new ExtractionPipeline(requestOrchestrator, responseNormalizer, fallbackExtractor, config);
    }
}
