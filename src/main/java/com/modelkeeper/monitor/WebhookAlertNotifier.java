package com.modelkeeper.monitor;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.modelkeeper.pipeline.RollbackException;

import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

/**
 * Posts a JSON alert to a webhook. Delivery problems are logged and never replace the original failure.
 */
public class WebhookAlertNotifier implements FatalAlertNotifier {
    private static final Logger log = LoggerFactory.getLogger(WebhookAlertNotifier.class);
    private static final MediaType JSON = MediaType.parse("application/json");
    static final String EVENT = "model-rollback-failed";

    private final OkHttpClient httpClient;
    private final ObjectMapper mapper;
    private final String webhookUrl;
    private final Clock clock;

    public WebhookAlertNotifier(String webhookUrl, Duration timeout) {
        this(new OkHttpClient.Builder().callTimeout(timeout).build(), webhookUrl, Clock.systemUTC());
    }

    public WebhookAlertNotifier(OkHttpClient httpClient, String webhookUrl, Clock clock) {
        this.httpClient = httpClient;
        this.mapper = new ObjectMapper();
        this.webhookUrl = webhookUrl;
        this.clock = clock;
    }

    @Override
    public void rollbackFailed(RollbackException failure) {
        try {
            String payload = mapper.writeValueAsString(payload(failure));
            Request request = new Request.Builder()
                    .url(webhookUrl)
                    .post(RequestBody.create(payload, JSON))
                    .build();
            try (Response response = httpClient.newCall(request).execute()) {
                if (!response.isSuccessful()) {
                    log.error("alert.delivery.rejected url={} status={}", webhookUrl, response.code());
                    return;
                }
                log.info("alert.delivered url={} backup={}", webhookUrl, failure.backupVersion());
            }
        } catch (IOException | IllegalArgumentException e) {
            log.error("alert.delivery.failed url={} reason={}", webhookUrl, e.getMessage());
        }
    }

    Map<String, Object> payload(RollbackException failure) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("event", EVENT);
        payload.put("backupVersion", failure.backupVersion());
        payload.put("message", failure.getMessage());
        payload.put("at", clock.instant().toString());
        return payload;
    }
}
