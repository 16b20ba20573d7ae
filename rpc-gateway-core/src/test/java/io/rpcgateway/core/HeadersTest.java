package io.rpcgateway.core;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class HeadersTest {

    @Test
    void lookupIgnoresCase() {
        Map<String, List<String>> headers = Map.of("AUTHORIZATION", List.of("Basic abc"));

        assertThat(Headers.firstValue(headers, "authorization")).contains("Basic abc");
        assertThat(Headers.firstValue(headers, "Authorization")).contains("Basic abc");
    }

    @Test
    void missingHeaderIsEmptyNotError() {
        assertThat(Headers.firstValue(Map.of(), "Authorization")).isEmpty();
        assertThat(Headers.firstValue(null, "Authorization")).isEmpty();
    }

    @Test
    void skipsNullValues() {
        Map<String, List<String>> headers = new LinkedHashMap<>();
        headers.put("Content-Type", Arrays.asList(null, "application/json"));

        assertThat(Headers.firstValue(headers, "content-type")).contains("application/json");
    }
}
