/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logshipper.output;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.intuitivedesigns.logshipper.core.SinkException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Posts each batch as a JSON array of {@code {"category", "message"}} objects.
 *
 * <p>Reply mapping: 2xx with an empty body or {@code OK} is {@link Result#OK};
 * a {@code TRY_LATER} body or HTTP 503 is {@link Result#TRY_LATER}; anything
 * else fails the call.</p>
 */
public final class HttpLogCollectorClient implements LogCollectorClient {

    private static final Logger log = LoggerFactory.getLogger(HttpLogCollectorClient.class);

    private static final String HEADER_CONTENT_TYPE = "Content-Type";
    private static final String MIME_JSON = "application/json";
    private static final int STATUS_UNAVAILABLE = 503;
    private static final int MAX_BODY_IN_ERROR = 200;

    private final HttpClient client;
    private final URI uri;
    private final Duration requestTimeout;
    private final ObjectMapper mapper;

    public HttpLogCollectorClient(URI uri, Duration timeout, ObjectMapper mapper) {
        this.uri = Objects.requireNonNull(uri, "uri");
        this.requestTimeout = Objects.requireNonNull(timeout, "timeout");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.client = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .version(HttpClient.Version.HTTP_1_1)
                .build();
    }

    @Override
    public Result log(List<LogEntry> entries) throws SinkException {
        final byte[] body;
        try {
            body = mapper.writeValueAsBytes(entries);
        } catch (JsonProcessingException e) {
            throw SinkException.send("Could not encode batch of " + entries.size() + " entries", e);
        }

        final HttpRequest request = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(requestTimeout)
                .header(HEADER_CONTENT_TYPE, MIME_JSON)
                .POST(HttpRequest.BodyPublishers.ofByteArray(body))
                .build();

        final HttpResponse<String> response;
        try {
            response = client.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw SinkException.send("Interrupted while posting to " + uri, e);
        } catch (IOException e) {
            throw SinkException.send("POST " + uri + " failed", e);
        }

        return interpret(response.statusCode(), response.body());
    }

    static Result interpret(int status, String body) throws SinkException {
        final String result = (body == null) ? "" : body.trim().toUpperCase(Locale.ROOT);

        if (status == STATUS_UNAVAILABLE || result.equals(Result.TRY_LATER.name())) {
            return Result.TRY_LATER;
        }
        if (status >= 200 && status < 300 && (result.isEmpty() || result.equals(Result.OK.name()))) {
            return Result.OK;
        }

        final String shown = (body == null) ? "" : body.substring(0, Math.min(body.length(), MAX_BODY_IN_ERROR));
        log.debug("Collector replied status={} body={}", status, shown);
        throw SinkException.send("Collector replied status=" + status + " body='" + shown + "'");
    }

    @Override
    public String toString() {
        return "HttpLogCollectorClient{" + uri + "}";
    }
}
