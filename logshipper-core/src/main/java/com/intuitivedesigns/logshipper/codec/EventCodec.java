/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logshipper.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.intuitivedesigns.logshipper.core.LogEvent;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * The native wire format: {@code <category>:<optional single space><JSON object>}.
 *
 * <p>Decoding is strict about the category ({@code [0-9A-Za-z_]+}, checked
 * before the payload is looked at) and about the payload (exactly one JSON
 * object, nothing after it). Trailing whitespace on the datagram, such as a
 * newline appended by the sender, is ignored. The codec never adds fields.</p>
 *
 * <p>Thread-safe: the underlying {@link ObjectMapper} is configured once.</p>
 */
public final class EventCodec implements DatagramDecoder {

    private static final TypeReference<LinkedHashMap<String, Object>> FIELDS_TYPE = new TypeReference<>() {};
    private static final byte SEPARATOR = ':';

    private final ObjectMapper mapper;

    public EventCodec() {
        this(new ObjectMapper());
    }

    public EventCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper").copy()
                .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    // ---- Decode ----

    @Override
    public LogEvent decode(byte[] data, int offset, int length) throws DecodeException {
        Objects.requireNonNull(data, "data");
        int end = offset + length;
        while (end > offset && isWhitespace(data[end - 1])) {
            end--;
        }

        final int colon = indexOf(data, offset, end, SEPARATOR);
        if (colon < 0) {
            throw DecodeException.invalidCategory("Missing ':' separator");
        }
        if (colon == offset) {
            throw DecodeException.invalidCategory("Empty category");
        }
        for (int i = offset; i < colon; i++) {
            if (!isCategoryByte(data[i])) {
                throw DecodeException.invalidCategory(
                        "Illegal character in category at index " + (i - offset));
            }
        }
        final String category = new String(data, offset, colon - offset, StandardCharsets.US_ASCII);

        int payloadStart = colon + 1;
        if (payloadStart < end && isWhitespace(data[payloadStart])) {
            payloadStart++;
        }

        final Map<String, Object> fields;
        try {
            fields = mapper.readValue(data, payloadStart, end - payloadStart, FIELDS_TYPE);
        } catch (IOException e) {
            throw DecodeException.invalidPayload("Payload is not a single JSON object: " + e.getMessage(), e);
        }
        if (fields == null) {
            throw DecodeException.invalidPayload("Payload is JSON null", null);
        }
        return new LogEvent(category, fields);
    }

    // ---- Encode ----

    /**
     * {@code category + ": " + json(fields)} as UTF-8.
     */
    public byte[] encode(LogEvent event) {
        return encodeToString(event).getBytes(StandardCharsets.UTF_8);
    }

    public String encodeToString(LogEvent event) {
        Objects.requireNonNull(event, "event");
        return event.category() + ": " + writeJson(event.fields());
    }

    /**
     * Serialize any JSON-compatible value (sinks use this for their documents).
     *
     * @throws IllegalArgumentException if the value holds something JSON cannot express
     */
    public String writeJson(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Value is not JSON-serializable: " + e.getOriginalMessage(), e);
        }
    }

    public byte[] writeJsonBytes(Object value) {
        try {
            return mapper.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Value is not JSON-serializable: " + e.getOriginalMessage(), e);
        }
    }

    // ---- Helpers ----

    private static int indexOf(byte[] data, int from, int to, byte b) {
        for (int i = from; i < to; i++) {
            if (data[i] == b) return i;
        }
        return -1;
    }

    private static boolean isCategoryByte(byte b) {
        return (b >= '0' && b <= '9')
                || (b >= 'A' && b <= 'Z')
                || (b >= 'a' && b <= 'z')
                || b == '_';
    }

    private static boolean isWhitespace(byte b) {
        return b == ' ' || b == '\n' || b == '\r' || b == '\t' || b == 0x0B || b == '\f';
    }
}
