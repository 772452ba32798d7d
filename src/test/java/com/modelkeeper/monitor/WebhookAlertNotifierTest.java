package com.modelkeeper.monitor;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.modelkeeper.pipeline.RollbackException;
import com.modelkeeper.pipeline.ValidationResult;

import okhttp3.OkHttpClient;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WebhookAlertNotifierTest {
    private final RollbackException failure = new RollbackException("20261019_120000", List.of(),
            ValidationResult.failed("Stage failed: lot_model"), new IOException("disk full"));

    @Test
    void shouldDescribeFailureInPayload() {
        WebhookAlertNotifier notifier = new WebhookAlertNotifier(new OkHttpClient(), "http://localhost/alerts",
                Clock.fixed(Instant.parse("2026-10-19T12:00:00Z"), ZoneOffset.UTC));

        Map<String, Object> payload = notifier.payload(failure);

        assertEquals(WebhookAlertNotifier.EVENT, payload.get("event"));
        assertEquals("20261019_120000", payload.get("backupVersion"));
        assertTrue(payload.get("message").toString().contains("disk full"));
        assertEquals("2026-10-19T12:00:00Z", payload.get("at"));
    }

    @Test
    void shouldNotThrowWhenWebhookUnreachable() {
        WebhookAlertNotifier notifier = new WebhookAlertNotifier(new OkHttpClient(), "http://127.0.0.1:1/alerts", Clock.systemUTC());

        assertDoesNotThrow(() -> notifier.rollbackFailed(failure));
    }
}
