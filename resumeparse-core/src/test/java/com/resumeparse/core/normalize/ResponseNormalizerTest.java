package com.resumeparse.core.normalize;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.resumeparse.core.model.CandidateRecord;
import com.resumeparse.core.schema.SchemaValidator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ResponseNormalizerTest {
    private final ResponseNormalizer normalizer = new ResponseNormalizer(new ObjectMapper(), new SchemaValidator());

    @Test
    void refusalYieldsEmptyRecordsAndIsNotParsed() {
        NormalizedReply reply = normalizer.normalizeReply("Sorry, I cannot help", 3);

        assertThat(reply.isParsed()).isFalse();
        assertThat(reply.getRecords()).hasSize(3).allMatch(CandidateRecord::isEmpty);
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "",
        "null",
        "{\"first_name\":\"A\"}",
        "[{\"first_name\":\"A\"},{\"first_name\":\"B\"},{\"first_name\":\"C\"},{\"first_name\":\"D\"}]",
        "[[{\"first_name\":\"A\"}], []]",
        "Here you go: [1, 2] thanks",
        "42"
    })
    void alwaysReturnsExpectedCount(String reply) {
        assertThat(normalizer.normalize(reply, 2)).hasSize(2);
        assertThat(normalizer.normalize(reply, 0)).isEmpty();
    }

    @Test
    void fencedReplyMatchesUnfenced() {
        String json = "[{\"first_name\":\"Jane\",\"email\":\"jane@acme.com\"}]";

        List<CandidateRecord> plain = normalizer.normalize(json, 1);
        List<CandidateRecord> fenced = normalizer.normalize("```json\n" + json + "\n```", 1);
        List<CandidateRecord> bareFence = normalizer.normalize("```\n" + json + "\n```", 1);

        assertThat(fenced).isEqualTo(plain);
        assertThat(bareFence).isEqualTo(plain);
        assertThat(plain.get(0).getFirstName()).isEqualTo("Jane");
    }

    @Test
    void recoversArrayEmbeddedInProse() {
        NormalizedReply reply = normalizer.normalizeReply(
            "Sure! Here are the records:\n[{\"first_name\":\"Ann\"},{\"first_name\":\"Bob\"}]\nLet me know.", 2);

        assertThat(reply.isParsed()).isTrue();
        assertThat(reply.getRecords()).extracting(CandidateRecord::getFirstName).containsExactly("Ann", "Bob");
    }

    @Test
    void singleObjectIsOneElementList() {
        List<CandidateRecord> records = normalizer.normalize("{\"first_name\":\"Solo\"}", 2);

        assertThat(records.get(0).getFirstName()).isEqualTo("Solo");
        assertThat(records.get(1).isEmpty()).isTrue();
    }

    @Test
    void nestedListsReduceToFirstElement() {
        List<CandidateRecord> records = normalizer.normalize(
            "[[{\"first_name\":\"Inner\"},{\"first_name\":\"Ignored\"}], [], \"text\"]", 3);

        assertThat(records).extracting(CandidateRecord::getFirstName).containsExactly("Inner", "", "");
    }

    @Test
    void extraElementsAreTruncated() {
        List<CandidateRecord> records = normalizer.normalize(
            "[{\"first_name\":\"A\"},{\"first_name\":\"B\"},{\"first_name\":\"C\"}]", 2);

        assertThat(records).extracting(CandidateRecord::getFirstName).containsExactly("A", "B");
    }

    @Test
    void stripFencesIgnoresSurroundingWhitespace() {
        assertThat(ResponseNormalizer.stripFences("  ```JSON\n[]\n```  ")).isEqualTo("[]");
        assertThat(ResponseNormalizer.stripFences(null)).isEmpty();
    }
}
