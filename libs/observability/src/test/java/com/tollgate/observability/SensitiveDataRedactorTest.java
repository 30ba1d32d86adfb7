package com.tollgate.observability;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("SensitiveDataRedactor")
class SensitiveDataRedactorTest {

    private final SensitiveDataRedactor redactor = new SensitiveDataRedactor();

    @Test
    @DisplayName("masks credential headers in any casing")
    void masksCredentialHeaders() {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("X-Client-Token", "secret123");
        headers.put("authorization", "Bearer abc");
        headers.put("X-Api-Key", "k");
        headers.put("Cookie", "session=1");
        headers.put("Content-Type", "application/json");

        Map<String, Object> redacted = redactor.redact(headers);

        assertThat(redacted).containsExactly(
                Map.entry("X-Client-Token", SensitiveDataRedactor.REDACTED),
                Map.entry("authorization", SensitiveDataRedactor.REDACTED),
                Map.entry("X-Api-Key", SensitiveDataRedactor.REDACTED),
                Map.entry("Cookie", SensitiveDataRedactor.REDACTED),
                Map.entry("Content-Type", "application/json"));
        assertThat(redacted.values()).doesNotContain("secret123", "Bearer abc");
    }

    @Test
    @DisplayName("returns an empty map for null or empty input")
    void nullInput() {
        assertThat(redactor.redact(null)).isEmpty();
        assertThat(redactor.redact(Map.of())).isEmpty();
    }

    @Test
    @DisplayName("does not mutate the input")
    void doesNotMutate() {
        Map<String, String> headers = new LinkedHashMap<>(Map.of("x-client-token", "secret123"));
        redactor.redact(headers);
        assertThat(headers).containsEntry("x-client-token", "secret123");
    }

    @Test
    @DisplayName("supports custom fragments")
    void customFragments() {
        var custom = new SensitiveDataRedactor(Set.of("x-tenant-key"));

        assertThat(custom.isSensitive("X-Tenant-Key")).isTrue();
        assertThat(custom.isSensitive("X-Client-Token")).isFalse();
        assertThat(custom.isSensitive(null)).isFalse();
    }

    @Test
    @DisplayName("rejects an empty fragment set")
    void rejectsEmpty() {
        assertThatThrownBy(() -> new SensitiveDataRedactor(Set.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
