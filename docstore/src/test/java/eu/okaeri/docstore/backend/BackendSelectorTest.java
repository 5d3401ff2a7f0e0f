package eu.okaeri.docstore.backend;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class BackendSelectorTest {

    private static StorageBackend backend(String name) {
        StorageBackend backend = mock(StorageBackend.class);
        when(backend.getName()).thenReturn(name);
        return backend;
    }

    @Test
    void uses_primary_when_reachable() {
        StorageBackend primary = backend("mongo");
        StorageBackend fallback = backend("flat");

        StorageBackend selected = BackendSelector.builder()
            .primary(() -> primary)
            .fallback(() -> fallback)
            .build()
            .select();

        assertThat(selected).isSameAs(primary);
    }

    @Test
    void falls_back_when_primary_stays_unreachable() {
        StorageBackend fallback = backend("flat");
        AtomicInteger attempts = new AtomicInteger();

        StorageBackend selected = BackendSelector.builder()
            .primary(() -> {
                attempts.incrementAndGet();
                throw new IllegalStateException("connection refused");
            })
            .fallback(() -> fallback)
            .probeTimeout(Duration.ofMillis(50))
            .build()
            .select();

        assertThat(selected).isSameAs(fallback);
        assertThat(attempts.get()).isGreaterThanOrEqualTo(1);
    }

    @Test
    void uses_fallback_directly_without_primary() {
        StorageBackend fallback = backend("flat");

        StorageBackend selected = BackendSelector.of(() -> fallback).select();

        assertThat(selected).isSameAs(fallback);
    }

    @Test
    void fallback_is_required() {
        assertThatThrownBy(() -> BackendSelector.builder().primary(() -> backend("mongo")).build())
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("fallback is required");
    }
}
