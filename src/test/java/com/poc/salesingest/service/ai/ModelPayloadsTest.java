package com.poc.salesingest.service.ai;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ModelPayloadsTest {

    @Test
    void previewIsSerialisedInSplitOrientation() {
        String json = ModelPayloads.previewAsSplitJson(List.of(
                List.of("Bill", "Amount", "Note"),
                List.of("B1", "10")));

        assertThat(json).isEqualTo("{\"columns\":[\"col0\",\"col1\",\"col2\"],\"index\":[0,1],"
                + "\"data\":[[\"Bill\",\"Amount\",\"Note\"],[\"B1\",\"10\"]]}");
    }

    @Test
    void stripsJsonFence() {
        assertThat(ModelPayloads.stripFences("```json\n{\"a\":1}\n```")).isEqualTo("{\"a\":1}");
    }

    @Test
    void stripsBareFence() {
        assertThat(ModelPayloads.stripFences("  ```\n{\"a\":1}```  ")).isEqualTo("{\"a\":1}");
    }

    @Test
    void leavesUnfencedTextAlone() {
        assertThat(ModelPayloads.stripFences(" {\"a\":1} ")).isEqualTo("{\"a\":1}");
        assertThat(ModelPayloads.stripFences(null)).isEmpty();
    }
}
