package com.resumeparse.core.fallback;

import com.resumeparse.core.model.CandidateRecord;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class FallbackExtractorTest {
    private final FallbackExtractor extractor = new FallbackExtractor();

    @Test
    void recoversEmailAndPhoneNearIt() {
        CandidateRecord record = extractor.enrich(CandidateRecord.empty(),
            "Contact: jane@acme.com, 0412 345 678");

        assertThat(record.getEmail()).isEqualTo("jane@acme.com");
        assertThat(record.getPhone()).isEqualTo("0412 345 678");
    }

    @Test
    void validModelValuesAreKept() {
        CandidateRecord model = CandidateRecord.builder()
            .firstName("Jane")
            .lastName("Doe")
            .email("jane@work.com")
            .phone("+61 400 111 222")
            .currentTitle("Engineer")
            .build();

        CandidateRecord record = extractor.enrich(model,
            "John Smith\nother@mail.com 0499 999 999\nTitle: Data Scientist");

        assertThat(record).isEqualTo(model);
    }

    @Test
    void emailWithoutAtSignIsReplaced() {
        CandidateRecord model = CandidateRecord.builder().email("jane at acme").build();

        CandidateRecord record = extractor.enrich(model, "reach me: jane@acme.com");

        assertThat(record.getEmail()).isEqualTo("jane@acme.com");
    }

    @Test
    void shortModelPhoneIsReplaced() {
        CandidateRecord model = CandidateRecord.builder().phone("12345").build();

        CandidateRecord record = extractor.enrich(model, "Call 555-123-4567 anytime");

        assertThat(record.getPhone()).isEqualTo("555-123-4567");
    }

    @Test
    void phoneNearEmailPreferredOverEarlierNumber() {
        String text = "Ref 0298765432\n" + "x".repeat(200) + "\nbob@example.org (02) 9876 5432";

        CandidateRecord record = extractor.enrich(CandidateRecord.empty(), text);

        assertThat(record.getPhone()).isEqualTo("(02) 9876 5432");
    }

    @Test
    void internationalNumberBeatsLocalShapes() {
        CandidateRecord record = extractor.enrich(CandidateRecord.empty(), "Phone +44 20 7946 0958");

        assertThat(record.getPhone()).isEqualTo("+44 20 7946 0958");
    }

    @Test
    void nameFromLeadingLineSkippingBoilerplate() {
        CandidateRecord record = extractor.enrich(CandidateRecord.empty(),
            "Curriculum Vitae\n\nMary Anne Smith\nSydney, NSW");

        assertThat(record.getFirstName()).isEqualTo("Mary");
        assertThat(record.getLastName()).isEqualTo("Anne Smith");
    }

    @Test
    void nameNotGuessedWhenModelHasOne() {
        CandidateRecord model = CandidateRecord.builder().lastName("Doe").build();

        CandidateRecord record = extractor.enrich(model, "Mary Smith\nmary@x.com");

        assertThat(record.getFirstName()).isEmpty();
        assertThat(record.getLastName()).isEqualTo("Doe");
    }

    @Test
    void labeledTitleIsTitleCased() {
        CandidateRecord record = extractor.enrich(CandidateRecord.empty(), "Position: senior data analyst\nmore text");

        assertThat(record.getCurrentTitle()).isEqualTo("Senior Data Analyst");
    }

    @Test
    void lexiconTitleExpandsToItsLine() {
        CandidateRecord record = extractor.enrich(CandidateRecord.empty(),
            "2019 - 2023\nlead software engineer at Initech\nBuilt things.");

        assertThat(record.getCurrentTitle()).isEqualTo("Lead Software Engineer At Initech");
    }

    @Test
    void cleaningStripsPhoneNoiseAndCollapsesWhitespace() {
        CandidateRecord model = CandidateRecord.builder()
            .phone("Tel: +61  412 345 678")
            .currentOrg("  Acme \n  Corp ")
            .build();

        CandidateRecord record = extractor.clean(model);

        assertThat(record.getPhone()).isEqualTo("+61 412 345 678");
        assertThat(record.getCurrentOrg()).isEqualTo("Acme Corp");
    }

    @Test
    void sameInputSameOutput() {
        String text = "Alex Brown\nalex@brown.io\n+61 412 000 111\nWarehouse supervisor at Big W";

        assertThat(extractor.enrich(CandidateRecord.empty(), text))
            .isEqualTo(extractor.enrich(CandidateRecord.empty(), text));
    }

    @Test
    void nullInputsProduceEmptyRecord() {
        assertThat(extractor.enrich(null, null)).isEqualTo(CandidateRecord.empty());
    }

    @Test
    void lexiconTitleAfterNonAsciiTextKeepsItsOffsets() {
        CandidateRecord record = extractor.enrich(CandidateRecord.empty(),
            "Gülİz Şahİn\nsenior software engineer at Acme");

        assertThat(record.getFirstName()).isEqualTo("Gülİz");
        assertThat(record.getLastName()).isEqualTo("Şahİn");
        assertThat(record.getCurrentTitle()).isEqualTo("Senior Software Engineer At Acme");
    }

    @Test
    void dottedCapitalIOnTitleLineIsHandled() {
        CandidateRecord record = extractor.enrich(CandidateRecord.empty(), "İ software engineer");

        assertThat(record.getCurrentTitle()).isEqualTo("İ Software Engineer");
    }

    @Test
    void nullFieldsFromBuilderAreTreatedAsEmpty() {
        CandidateRecord model = CandidateRecord.builder()
            .firstName(null)
            .lastName(null)
            .currentTitle(null)
            .email(null)
            .build();

        CandidateRecord record = extractor.enrich(model, "Ann Lee\nann@lee.dev");

        assertThat(record.getFirstName()).isEqualTo("Ann");
        assertThat(record.getEmail()).isEqualTo("ann@lee.dev");
        assertThat(record.getCurrentTitle()).isEmpty();
    }
}
