package com.resumeparse.api.controller;

import com.resumeparse.core.io.RecordSink;
import com.resumeparse.core.io.TextSource;
import com.resumeparse.core.model.BatchEntry;
import com.resumeparse.core.model.BatchResult;
import com.resumeparse.core.model.CandidateRecord;
import com.resumeparse.core.model.ExtractedCandidate;
import com.resumeparse.core.model.Outcome;
import com.resumeparse.core.model.SourceDocument;
import com.resumeparse.core.pipeline.ExtractionPipeline;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ExtractionController.class)
class ExtractionControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ExtractionPipeline extractionPipeline;

    @Test
    void returnsOneCandidatePerDocumentInOrder() throws Exception {
        List<List<SourceDocument>> seen = new ArrayList<>();
        when(extractionPipeline.process(any(TextSource.class), any(RecordSink.class))).thenAnswer(invocation -> {
            TextSource source = invocation.getArgument(0);
            RecordSink sink = invocation.getArgument(1);
            seen.add(source.documents());
            CandidateRecord jane = CandidateRecord.builder().firstName("Jane").email("jane@acme.com").build();
            sink.accept(List.of(
                new ExtractedCandidate(0, "jane.pdf", jane, Outcome.OK),
                new ExtractedCandidate(1, "blank.txt", CandidateRecord.empty(), Outcome.EXTRACTION_FAILED)));
            return new BatchResult(List.of(
                new BatchEntry(0, jane, Outcome.OK),
                BatchEntry.failed(1)));
        });

        mockMvc.perform(post("/api/v1/extractions")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"documents\":[{\"filename\":\"jane.pdf\",\"text\":\"Jane\"},"
                    + "{\"filename\":\"blank.txt\",\"text\":\"\"}]}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.total").value(2))
            .andExpect(jsonPath("$.extracted").value(1))
            .andExpect(jsonPath("$.outcomes.extraction_failed").value(1))
            .andExpect(jsonPath("$.candidates[0].filename").value("jane.pdf"))
            .andExpect(jsonPath("$.candidates[0].outcome").value("ok"))
            .andExpect(jsonPath("$.candidates[0].record.first_name").value("Jane"))
            .andExpect(jsonPath("$.candidates[0].record.last_name").value(""))
            .andExpect(jsonPath("$.candidates[1].outcome").value("extraction_failed"));

        assertThat(seen).hasSize(1);
        assertThat(seen.get(0)).extracting(SourceDocument::getFilename).containsExactly("jane.pdf", "blank.txt");
    }

    @Test
    void rejectsEmptyDocumentList() throws Exception {
        mockMvc.perform(post("/api/v1/extractions")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"documents\":[]}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message").value("Validation failed"))
            .andExpect(jsonPath("$.status").value(400));

        verify(extractionPipeline, never()).process(any(), any());
    }

    @Test
    void rejectsMalformedJson() throws Exception {
        mockMvc.perform(post("/api/v1/extractions")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"documents\": ["))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message").value("Malformed request body"));
    }
}
