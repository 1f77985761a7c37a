package com.longevitydigest.backend.ai;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.longevitydigest.backend.model.dto.FactCheckVerdict;
import com.longevitydigest.backend.model.dto.GeneratedContent;
import org.junit.jupiter.api.Test;

class AiResponseParserTest {

    private final AiResponseParser parser = new AiResponseParser();

    @Test
    void parseContent_shouldStripCodeFence() {
        String response = """
                ```json
                {"title": "Title", "summary": "Sum", "body": "Body",
                 "key_insights": ["a", "b", "c", "d"], "practical_applications": ["x"], "confidence_score": 0.9}
                ```""";

        GeneratedContent content = parser.parseContent(response);

        assertThat(content.getTitle()).isEqualTo("Title");
        assertThat(content.getBody()).isEqualTo("Body");
        assertThat(content.getKeyInsights()).containsExactly("a", "b", "c");
        assertThat(content.getPracticalApplications()).containsExactly("x");
        assertThat(content.getConfidenceScore()).isEqualTo(0.9);
    }

    @Test
    void parseContent_shouldFindObjectInsideProse() {
        String response = "Here is the content you asked for: {\"title\": \"T\", \"body\": \"B\"} Hope it helps {not json}";

        GeneratedContent content = parser.parseContent(response);

        assertThat(content.getTitle()).isEqualTo("T");
        assertThat(content.getConfidenceScore()).isEqualTo(0.5);
    }

    @Test
    void parseContent_shouldClampConfidence() {
        assertThat(parser.parseContent("{\"title\": \"T\", \"body\": \"B\", \"confidence_score\": 7}")
                .getConfidenceScore()).isEqualTo(1.0);
        assertThat(parser.parseContent("{\"title\": \"T\", \"body\": \"B\", \"confidence_score\": \"-2\"}")
                .getConfidenceScore()).isEqualTo(0.0);
    }

    @Test
    void parseContent_shouldRejectMissingBody() {
        assertThatThrownBy(() -> parser.parseContent("{\"title\": \"only a title\"}"))
                .isInstanceOf(MalformedResponseException.class);
    }

    @Test
    void parseContent_shouldRejectText_whenNoJsonPresent() {
        assertThatThrownBy(() -> parser.parseContent("I cannot help with that."))
                .isInstanceOf(MalformedResponseException.class)
                .isInstanceOf(GenerationException.class)
                .hasMessageContaining("not valid JSON");
    }

    @Test
    void parseRevision_shouldLeaveAbsentFieldsNull() {
        GeneratedContent revision = parser.parseRevision("{\"body\": \"Revised body\"}");

        assertThat(revision.getBody()).isEqualTo("Revised body");
        assertThat(revision.getTitle()).isNull();
        assertThat(revision.getConfidenceScore()).isNull();
        assertThat(revision.getKeyInsights()).isEmpty();
    }

    @Test
    void parseVerdict_shouldReadAllFields() {
        FactCheckVerdict verdict = parser.parseVerdict("""
                {"accuracy_score": 0.72, "issues": ["overstated effect"], "suggestions": ["soften claim"],
                 "safe_to_publish": false}""");

        assertThat(verdict.getAccuracyScore()).isEqualTo(0.72);
        assertThat(verdict.getIssues()).containsExactly("overstated effect");
        assertThat(verdict.getSuggestions()).containsExactly("soften claim");
        assertThat(verdict.isSafeToPublish()).isFalse();
    }

    @Test
    void parseVerdict_shouldAcceptStringBoolean() {
        assertThat(parser.parseVerdict("{\"accuracy_score\": 0.9, \"safe_to_publish\": \"true\"}").isSafeToPublish())
                .isTrue();
    }

    @Test
    void parseVerdict_shouldTreatMissingFlagAsUnsafe() {
        assertThat(parser.parseVerdict("{\"accuracy_score\": 0.9}").isSafeToPublish()).isFalse();
    }
}
