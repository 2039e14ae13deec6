/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logshipper.codec;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.intuitivedesigns.logshipper.core.LogEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.MonthDay;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.temporal.TemporalAccessor;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Accepts BSD syslog (RFC 3164) lines and maps them onto the shipper's event shape.
 *
 * <pre>
 * &lt;PRI&gt;Mmm dd hh:mm:ss host tag[pid]: message [@cee: {json}]
 * </pre>
 *
 * <ul>
 * <li>category is {@code syslog} unless a CEE payload sets {@code category}</li>
 * <li>priority becomes {@code facility} plus {@code logLevel} (EMERGENCY ... DEBUG)</li>
 * <li>tag becomes {@code appname}; hostnames can be rewritten through a map</li>
 * <li>the syslog timestamp has no year or zone; both come from the configured clock</li>
 * </ul>
 *
 * Lines that do not match the format are shipped whole as {@code message}.
 */
public final class SyslogDecoder implements DatagramDecoder {

    private static final Logger log = LoggerFactory.getLogger(SyslogDecoder.class);

    public static final String CATEGORY = "syslog";

    static final List<String> FACILITIES = List.of(
            "kern", "user", "mail", "daemon", "auth", "syslog", "lpr", "news",
            "uucp", "cron", "authpriv", "ftp", "ntp", "audit", "alert", "at",
            "local0", "local1", "local2", "local3", "local4", "local5",
            "local6", "local7");

    static final List<String> LOG_LEVELS = List.of(
            "EMERGENCY", "ALERT", "CRITICAL", "ERROR", "WARNING", "NOTICE", "INFO", "DEBUG");

    private static final Pattern SYSLOG_LINE = Pattern.compile(
            "^<(?<priority>\\d+)>"
                    + "(?<timestamp>\\w\\w\\w [ 1-9]\\d \\d\\d:\\d\\d:\\d\\d) "
                    + "(?<hostname>\\w+) "
                    + "(?<tag>\\w+)(\\[(?<pid>\\d+)])?: ?"
                    + "(?<content>(?<message>.*?)( ?@cee: (?<cee>.*))?)$",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    // "Oct  7 09:05:01" and "Oct 17 09:05:01"; the day is space-padded
    private static final DateTimeFormatter SYSLOG_TIME = new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .appendPattern("MMM ppd HH:mm:ss")
            .toFormatter(Locale.ENGLISH);

    private static final TypeReference<LinkedHashMap<String, Object>> CEE_TYPE = new TypeReference<>() {};

    private final ObjectMapper mapper;
    private final Clock clock;
    private final ZoneId zone;
    private final Map<String, String> hostnames;

    public SyslogDecoder(Clock clock, ZoneId zone, Map<String, String> hostnames) {
        this.mapper = new ObjectMapper();
        this.clock = Objects.requireNonNull(clock, "clock");
        this.zone = Objects.requireNonNull(zone, "zone");
        this.hostnames = (hostnames == null) ? Map.of() : Map.copyOf(hostnames);
    }

    public static SyslogDecoder systemDefault(Map<String, String> hostnames) {
        return new SyslogDecoder(Clock.systemUTC(), ZoneId.systemDefault(), hostnames);
    }

    @Override
    public LogEvent decode(byte[] data, int offset, int length) throws DecodeException {
        final String line = stripTrailing(new String(data, offset, length, StandardCharsets.UTF_8));
        final Map<String, Object> fields = parse(line);

        Object category = fields.remove(LogEvent.CATEGORY_FIELD);
        if (category == null) {
            category = CATEGORY;
        }
        final String name = String.valueOf(category);
        if (!LogEvent.isValidCategory(name)) {
            throw DecodeException.invalidCategory("CEE category is not a valid category: '" + name + "'");
        }
        return new LogEvent(name, fields);
    }

    Map<String, Object> parse(String line) {
        final Map<String, Object> fields = new LinkedHashMap<>();
        final Matcher m = SYSLOG_LINE.matcher(line);
        if (!m.matches()) {
            fields.put("message", line);
            return fields;
        }

        final int priority = parsePriority(m.group("priority"));
        final int facility = priority / 8;
        if (priority >= 0 && facility < FACILITIES.size()) {
            fields.put("facility", FACILITIES.get(facility));
            fields.put("logLevel", LOG_LEVELS.get(priority % 8));
        }

        final Long epochSeconds = parseTimestamp(m.group("timestamp"));
        if (epochSeconds != null) {
            fields.put(LogEvent.TIMESTAMP_FIELD, epochSeconds);
        }

        final String hostname = m.group("hostname");
        fields.put("hostname", hostnames.getOrDefault(hostname, hostname));
        fields.put("appname", m.group("tag"));
        if (m.group("pid") != null) {
            fields.put("pid", m.group("pid"));
        }
        fields.put("message", m.group("message"));

        final String cee = m.group("cee");
        if (cee != null) {
            try {
                final Map<String, Object> extra = mapper.readValue(cee, CEE_TYPE);
                if (extra != null) fields.putAll(extra);
            } catch (IOException e) {
                log.debug("Ignoring malformed @cee payload: {}", e.getMessage());
                fields.put("message", m.group("content"));
            }
        }
        return fields;
    }

    private Long parseTimestamp(String raw) {
        try {
            final TemporalAccessor parsed = SYSLOG_TIME.parse(raw);
            final int year = LocalDate.now(clock.withZone(zone)).getYear();
            final LocalDate date = MonthDay.from(parsed).atYear(year);
            return date.atTime(LocalTime.from(parsed)).atZone(zone).toEpochSecond();
        } catch (DateTimeException e) {
            log.debug("Unparseable syslog timestamp '{}': {}", raw, e.getMessage());
            return null;
        }
    }

    private static int parsePriority(String raw) {
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    private static String stripTrailing(String s) {
        int end = s.length();
        while (end > 0 && (s.charAt(end - 1) == '\n' || s.charAt(end - 1) == '\r' || s.charAt(end - 1) == '\0')) {
            end--;
        }
        return s.substring(0, end);
    }
}
