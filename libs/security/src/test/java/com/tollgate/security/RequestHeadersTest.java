package com.tollgate.security;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("RequestHeaders")
class RequestHeadersTest {

    @Test
    @DisplayName("normalizes names to lower case once")
    void normalizesNames() {
        var headers = RequestHeaders.of(Map.of("X-Client-Token", "t", "Content-Type", "json"));

        assertThat(headers.asMap()).containsOnlyKeys("x-client-token", "content-type");
        assertThat(headers.get("X-CLIENT-TOKEN")).contains("t");
    }

    @Test
    @DisplayName("keeps the first non-blank value when names collide")
    void firstNonBlankWins() {
        Map<String, String> raw = new LinkedHashMap<>();
        raw.put("x-client-token", " ");
        raw.put("X-Client-Token", "second");
        raw.put("X-CLIENT-TOKEN", "third");

        assertThat(RequestHeaders.of(raw).get("x-client-token")).contains("second");
    }

    @Test
    @DisplayName("skips null names and values")
    void skipsNulls() {
        Map<String, String> raw = new HashMap<>();
        raw.put(null, "v");
        raw.put("a", null);
        raw.put("b", "v");

        assertThat(RequestHeaders.of(raw).asMap()).containsOnlyKeys("b");
    }

    @Test
    @DisplayName("treats null input as empty")
    void nullInput() {
        assertThat(RequestHeaders.of(null).isEmpty()).isTrue();
        assertThat(RequestHeaders.of(null).get("anything")).isEmpty();
    }

    @Test
    @DisplayName("is immutable")
    void immutable() {
        var headers = RequestHeaders.of(Map.of("a", "b"));
        assertThatThrownBy(() -> headers.asMap().put("c", "d"))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("toString lists names only")
    void toStringHidesValues() {
        var headers = RequestHeaders.of(Map.of("X-Client-Token", "super-secret"));
        assertThat(headers.toString()).contains("x-client-token").doesNotContain("super-secret");
    }
}
