package com.example.scheduler;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.chrono.IsoChronology;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.TemporalAccessor;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns a caller-supplied {@code runAt} into an absolute instant strictly after now.
 *
 * Accepted forms:
 * - {@code HH:mm}: the next occurrence of that wall-clock time in the clock's zone. Today if it
 *   is still ahead, otherwise the same time tomorrow.
 * - ISO-8601: instant ({@code 2030-01-01T10:00:00Z}), offset or zoned date-time, local
 *   date-time (read in the clock's zone) or plain date (midnight UTC). A space may stand in
 *   for the {@code T}, offsets may omit the colon and letters are case-insensitive.
 * - RFC 1123, as in HTTP headers ({@code Sat, 01 Jun 2030 12:00:00 GMT}).
 */
public class TimeResolver {
    private static final Pattern HH_MM = Pattern.compile("^(\\d{2}):(\\d{2})$");

    private static final Pattern SPACE_SEPARATED = Pattern.compile("^(\\d{4}-\\d{2}-\\d{2}) +(\\d{2}:.*)$");

    // date, optionally followed by a time, an offset (+02:00, +0200 or Z) and a bracketed region id
    private static final DateTimeFormatter DATE_TIME = new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .optionalStart()
            .appendLiteral('T')
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .optionalStart()
            .appendOffset("+HH:MM:ss", "Z")
            .optionalEnd()
            .optionalStart()
            .appendOffset("+HHMM", "Z")
            .optionalEnd()
            .optionalStart()
            .appendLiteral('[')
            .parseCaseSensitive()
            .appendZoneRegionId()
            .appendLiteral(']')
            .optionalEnd()
            .optionalEnd()
            .toFormatter()
            .withResolverStyle(ResolverStyle.STRICT)
            .withChronology(IsoChronology.INSTANCE);

    private final Clock clock;

    public TimeResolver(Clock clock) {
        this.clock = clock;
    }

    public ZoneId zone() {
        return clock.getZone();
    }

    public Instant resolve(String runAt) {
        Instant now = clock.instant();
        String raw = runAt == null ? "" : runAt.trim();

        Instant resolved;
        Matcher m = HH_MM.matcher(raw);
        if (m.matches()) {
            resolved = nextWallClockTime(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)), now);
        } else if (raw.isEmpty()) {
            throw new ScheduleValidationException(ErrorCode.INVALID_RUN_AT,
                    "runAt must be either HH:mm or an ISO8601 date string");
        } else {
            resolved = parseDateTime(raw);
        }

        if (!resolved.isAfter(now)) {
            throw new ScheduleValidationException(ErrorCode.PAST_RUN_AT, "runAt must be in the future");
        }
        return resolved;
    }

    private Instant nextWallClockTime(int hours, int minutes, Instant now) {
        if (hours > 23 || minutes > 59) {
            throw new ScheduleValidationException(ErrorCode.INVALID_RUN_AT, "runAt must be a valid HH:mm time string");
        }
        ZoneId zone = clock.getZone();
        LocalDate today = LocalDate.ofInstant(now, zone);
        ZonedDateTime candidate = today.atTime(hours, minutes).atZone(zone);
        if (!candidate.toInstant().isAfter(now)) {
            candidate = today.plusDays(1).atTime(hours, minutes).atZone(zone);
        }
        return candidate.toInstant();
    }

    private Instant parseDateTime(String raw) {
        String normalized = SPACE_SEPARATED.matcher(raw).replaceFirst("$1T$2");
        TemporalAccessor parsed;
        try {
            parsed = DATE_TIME.parseBest(normalized, ZonedDateTime::from, LocalDateTime::from, LocalDate::from);
        } catch (DateTimeParseException e) {
            parsed = parseRfc1123(raw);
        }
        if (parsed instanceof ZonedDateTime) {
            return ((ZonedDateTime) parsed).toInstant();
        }
        if (parsed instanceof LocalDateTime) {
            return ((LocalDateTime) parsed).atZone(clock.getZone()).toInstant();
        }
        return ((LocalDate) parsed).atStartOfDay(ZoneOffset.UTC).toInstant();
    }

    // e.g. Sat, 01 Jun 2030 12:00:00 GMT
    private static ZonedDateTime parseRfc1123(String raw) {
        try {
            return ZonedDateTime.parse(raw, DateTimeFormatter.RFC_1123_DATE_TIME);
        } catch (DateTimeParseException e) {
            throw new ScheduleValidationException(ErrorCode.INVALID_RUN_AT,
                    "runAt must be either HH:mm or an ISO8601 date string");
        }
    }
}
