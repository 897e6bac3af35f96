package ai.foundrystack.backend.service.agent;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonResponseExtractorTest {

    private final JsonResponseExtractor extractor = new JsonResponseExtractor();

    @Test
    void shouldParsePlainObject() {
        Map<String, Object> result = extractor.extractObject("{\"funding_stage\": \"Seed\", \"rationale\": \"early\"}");

        assertThat(result).containsEntry("funding_stage", "Seed").containsEntry("rationale", "early");
    }

    @Test
    void shouldParseFencedBlockSurroundedByProse() {
        String raw = """
                Here is the analysis you asked for:
                ```json
                {
                  "marketAnalysis": {"segments": ["pet owners"]}
                }
                ```
                Let me know if you need more.""";

        Map<String, Object> result = extractor.extractObject(raw);

        assertThat(result).containsKey("marketAnalysis");
        @SuppressWarnings("unchecked")
        Map<String, Object> analysis = (Map<String, Object>) result.get("marketAnalysis");
        assertThat(analysis.get("segments")).isEqualTo(List.of("pet owners"));
    }

    @Test
    void shouldTolerateTrailingCommas() {
        Map<String, Object> result = extractor.extractObject("{\"allocation\": {\"engineering\": 60,},}");

        assertThat(result).containsKey("allocation");
    }

    @Test
    void shouldIgnoreBracesInsideStrings() {
        Map<String, Object> result = extractor.extractObject("Result: {\"code\": \"function f() { return 1; }\"} done");

        assertThat(result).containsEntry("code", "function f() { return 1; }");
    }

    @Test
    void shouldSkipUnparseableSpanAndUseNextObject() {
        Map<String, Object> result = extractor.extractObject("{not json} then {\"runway_months\": 18}");

        assertThat(result).containsEntry("runway_months", 18);
    }

    @Test
    void shouldKeepKeysInDocumentOrder() {
        Map<String, Object> result = extractor.extractObject("{\"b\": 1, \"a\": 2, \"c\": 3}");

        assertThat(result.keySet()).containsExactly("b", "a", "c");
    }

    @Test
    void shouldFallBackToWholeTextWhenFenceHasNoObject() {
        String raw = "```\nno object here\n```\n{\"key_risks\": []}";

        assertThat(extractor.extractObject(raw)).containsKey("key_risks");
    }

    @Test
    void shouldRejectTextWithoutObject() {
        assertThatThrownBy(() -> extractor.extractObject("I cannot help with that."))
                .isInstanceOf(JsonResponseExtractor.JsonExtractionException.class)
                .hasMessageContaining("No JSON object");
    }

    @Test
    void shouldRejectTopLevelArray() {
        assertThatThrownBy(() -> extractor.extractObject("[1, 2, 3]"))
                .isInstanceOf(JsonResponseExtractor.JsonExtractionException.class);
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"  \n "})
    void shouldRejectEmptyResponse(String raw) {
        assertThatThrownBy(() -> extractor.extractObject(raw))
                .isInstanceOf(JsonResponseExtractor.JsonExtractionException.class)
                .hasMessage("Response is empty");
    }
}
