package com.resumeparse.api.controller;

import com.resumeparse.core.pipeline.ExtractionPipeline;
import com.resumeparse.core.pipeline.PipelineConfig;
import com.resumeparse.llm.orchestrator.RequestOrchestrator;
import com.resumeparse.llm.provider.CompletionClient;
import com.resumeparse.llm.provider.LlmProvider;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest({LlmStatsController.class, HealthController.class})
class LlmStatsControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private RequestOrchestrator requestOrchestrator;

    @MockBean
    private ExtractionPipeline extractionPipeline;

    @Test
    void reportsProviderAndCallCount() throws Exception {
        CompletionClient client = Mockito.mock(CompletionClient.class);
        when(client.getProvider()).thenReturn(LlmProvider.GROQ);
        when(client.getModel()).thenReturn("llama-test");
        when(requestOrchestrator.getClient()).thenReturn(client);
        when(requestOrchestrator.getCallCount()).thenReturn(7L);
        when(extractionPipeline.getConfig()).thenReturn(PipelineConfig.defaults());

        mockMvc.perform(get("/api/v1/llm/stats"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.provider").value("Groq"))
            .andExpect(jsonPath("$.model").value("llama-test"))
            .andExpect(jsonPath("$.totalCalls").value(7))
            .andExpect(jsonPath("$.batchSize").value(5));
    }

    @Test
    void healthEndpointsRespond() throws Exception {
        mockMvc.perform(get("/api/v1/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("UP"));
        mockMvc.perform(get("/api/v1/health/ping"))
            .andExpect(status().isOk())
            .andExpect(content().string("pong"));
    }
}
