package com.eainde.workout.workout;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Works out when a workout was completed from the message timestamp and the
 * relative-time phrases in the message, in the user's timezone.
 *
 * <p>The result is an ISO-8601 date-time with the user's offset, so its date part is
 * the user's local calendar date.</p>
 */
@Slf4j
@Component
public class CompletionTimeResolver {

    private static final Pattern AGO = Pattern.compile("\\b(\\d{1,3})\\s*(minutes?|mins?|hours?|hrs?)\\s+ago\\b");
    private static final Pattern YESTERDAY = Pattern.compile("\\byesterday\\b");
    private static final Pattern LAST_NIGHT = Pattern.compile("\\blast\\s+night\\b");
    private static final Pattern THIS_MORNING = Pattern.compile("\\bthis\\s+morning\\b");
    private static final Pattern THIS_AFTERNOON = Pattern.compile("\\bthis\\s+afternoon\\b");
    private static final Pattern THIS_EVENING = Pattern.compile("\\b(this\\s+evening|tonight)\\b");

    private final Clock clock;
    private final ZoneId defaultZone;

    public CompletionTimeResolver(Clock clock,
                                  @Value("${workout-logger.default-timezone:America/Los_Angeles}") String defaultTimezone) {
        this.clock = clock;
        this.defaultZone = ZoneId.of(defaultTimezone);
    }

    public OffsetDateTime resolve(String userMessage, String messageTimestamp, String userTimezone) {
        ZoneId zone = zone(userTimezone);
        ZonedDateTime base = baseTime(messageTimestamp, zone);
        String text = userMessage == null ? "" : userMessage.toLowerCase(Locale.ROOT);

        ZonedDateTime resolved = applyRelativePhrase(text, base);
        if (resolved.isAfter(base)) {
            // a time-of-day phrase later than the message itself means the message was sent early
            resolved = base;
        }
        log.debug("Resolved completion time {} from timestamp {} ({})", resolved, messageTimestamp, zone);
        return resolved.toOffsetDateTime();
    }

    private static ZonedDateTime applyRelativePhrase(String text, ZonedDateTime base) {
        Matcher ago = AGO.matcher(text);
        if (ago.find()) {
            long amount = Long.parseLong(ago.group(1));
            ChronoUnit unit = ago.group(2).startsWith("h") ? ChronoUnit.HOURS : ChronoUnit.MINUTES;
            return base.minus(amount, unit);
        }
        if (LAST_NIGHT.matcher(text).find()) {
            return atTime(base.minusDays(1), 20);
        }
        if (YESTERDAY.matcher(text).find()) {
            return base.minusDays(1);
        }
        if (THIS_MORNING.matcher(text).find()) {
            return atTime(base, 8);
        }
        if (THIS_AFTERNOON.matcher(text).find()) {
            return atTime(base, 14);
        }
        if (THIS_EVENING.matcher(text).find()) {
            return atTime(base, 19);
        }
        return base;
    }

    private static ZonedDateTime atTime(ZonedDateTime day, int hour) {
        return day.with(LocalTime.of(hour, 0)).truncatedTo(ChronoUnit.MINUTES);
    }

    private ZonedDateTime baseTime(String messageTimestamp, ZoneId zone) {
        if (messageTimestamp != null && !messageTimestamp.isBlank()) {
            try {
                return OffsetDateTime.parse(messageTimestamp).atZoneSameInstant(zone);
            } catch (DateTimeParseException e) {
                try {
                    return Instant.parse(messageTimestamp).atZone(zone);
                } catch (DateTimeParseException ignored) {
                    log.warn("Unparseable message timestamp '{}', using current time", messageTimestamp);
                }
            }
        }
        return ZonedDateTime.now(clock.withZone(zone));
    }

    private ZoneId zone(String userTimezone) {
        if (userTimezone == null || userTimezone.isBlank()) {
            return defaultZone;
        }
        try {
            return ZoneId.of(userTimezone);
        } catch (DateTimeException e) {
            log.warn("Unknown timezone '{}', using {}", userTimezone, defaultZone);
            return defaultZone;
        }
    }
}
