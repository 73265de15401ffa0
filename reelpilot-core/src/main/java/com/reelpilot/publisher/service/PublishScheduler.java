package com.reelpilot.publisher.service;

import com.reelpilot.publisher.config.PublisherProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Picks publish times. Weekday slots drive the primary stream, a rotating slot list spreads the
 * shorts cut from one long video over the following days. Every result is strictly after "now";
 * a broken zone or slot table yields tomorrow 12:00 UTC instead of an exception.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PublishScheduler {

    public enum ContentType {
        SHORT,
        LONG
    }

    static final ZoneId FALLBACK_ZONE = ZoneOffset.UTC;
    static final LocalTime FALLBACK_TIME = LocalTime.NOON;

    static final Map<DayOfWeek, LocalTime> DEFAULT_SHORT_SLOTS;
    static final Map<DayOfWeek, LocalTime> DEFAULT_LONG_SLOTS;
    static final List<String> DEFAULT_ROTATION_SLOTS = List.of("18:30", "12:30", "22:00", "19:00", "13:00");

    static {
        Map<DayOfWeek, LocalTime> shorts = new EnumMap<>(DayOfWeek.class);
        shorts.put(DayOfWeek.MONDAY, LocalTime.of(20, 30));
        shorts.put(DayOfWeek.TUESDAY, LocalTime.of(21, 0));
        shorts.put(DayOfWeek.WEDNESDAY, LocalTime.of(21, 0));
        shorts.put(DayOfWeek.THURSDAY, LocalTime.of(21, 0));
        shorts.put(DayOfWeek.FRIDAY, LocalTime.of(20, 0));
        shorts.put(DayOfWeek.SATURDAY, LocalTime.of(19, 0));
        shorts.put(DayOfWeek.SUNDAY, LocalTime.of(18, 30));
        DEFAULT_SHORT_SLOTS = Collections.unmodifiableMap(shorts);

        Map<DayOfWeek, LocalTime> longs = new EnumMap<>(DayOfWeek.class);
        longs.put(DayOfWeek.MONDAY, LocalTime.of(20, 30));
        longs.put(DayOfWeek.TUESDAY, LocalTime.of(20, 30));
        longs.put(DayOfWeek.WEDNESDAY, LocalTime.of(21, 0));
        longs.put(DayOfWeek.THURSDAY, LocalTime.of(20, 30));
        longs.put(DayOfWeek.FRIDAY, LocalTime.of(19, 30));
        longs.put(DayOfWeek.SATURDAY, LocalTime.of(20, 30));
        longs.put(DayOfWeek.SUNDAY, LocalTime.of(20, 0));
        DEFAULT_LONG_SLOTS = Collections.unmodifiableMap(longs);
    }

    private final PublisherProperties properties;
    private final Clock clock;
    private final Random scheduleRandom;

    public Instant nextSlot(ContentType contentType) {
        PublisherProperties.Schedule schedule = properties.getSchedule();
        boolean isLong = contentType == ContentType.LONG;
        return nextSlot(clock.instant(), schedule.getTimezone(), contentType,
                isLong ? schedule.getLongSlots() : schedule.getShortSlots(),
                schedule.getBufferHours(),
                isLong ? schedule.getLongJitterMinutes() : schedule.getShortJitterMinutes());
    }

    public Instant nextRotationSlot(int index, Instant basePublishTime) {
        PublisherProperties.Schedule schedule = properties.getSchedule();
        return nextRotationSlot(clock.instant(), schedule.getTimezone(), index, basePublishTime,
                schedule.getRotationSlots(), schedule.getRotationJitterMinutes());
    }

    /**
     * Next publish instant for the weekday slot of {@code now} in {@code timezone}. When
     * {@code now} is within {@code bufferHours} of today's slot, or past it, the same local time
     * tomorrow is used. Jitter is drawn uniformly from {@code [-jitterRangeMinutes, +jitterRangeMinutes]}.
     *
     * @param slotTable weekday to {@code HH:mm}; weekdays missing from it use the built-in table
     */
    public Instant nextSlot(Instant now, String timezone, ContentType contentType,
                            Map<DayOfWeek, String> slotTable, int bufferHours, int jitterRangeMinutes) {
        try {
            ZoneId zone = ZoneId.of(timezone);
            ZonedDateTime localNow = now.atZone(zone);
            DayOfWeek weekday = localNow.getDayOfWeek();
            LocalTime slot = resolveSlot(weekday, contentType, slotTable);

            ZonedDateTime candidate = ZonedDateTime.of(localNow.toLocalDate(), slot, zone);
            if (!now.isBefore(candidate.toInstant().minus(Duration.ofHours(bufferHours)))) {
                candidate = candidate.plusDays(1);
            }
            Instant publishAt = candidate.toInstant().plus(jitter(jitterRangeMinutes));
            Instant result = ensureAfter(publishAt, now);
            log.info("Scheduled {} for {} ({} slot {} in {})", contentType, result, weekday, slot, zone);
            return result;
        } catch (RuntimeException e) {
            log.error("Failed to compute {} slot for zone {}, using fallback", contentType, timezone, e);
            return fallback(now);
        }
    }

    /**
     * Publish instant for the {@code index}-th short of a long video: the rotating slot for that
     * position on day {@code index + 1} after the long video's publish date.
     */
    public Instant nextRotationSlot(Instant now, String timezone, int index, Instant basePublishTime,
                                    List<String> rotationSlots, int jitterRangeMinutes) {
        try {
            ZoneId zone = ZoneId.of(timezone);
            List<String> slots = rotationSlots == null || rotationSlots.isEmpty() ? DEFAULT_ROTATION_SLOTS : rotationSlots;
            LocalTime slot = LocalTime.parse(slots.get(Math.floorMod(index, slots.size())));
            LocalDate publishDate = basePublishTime.atZone(zone).toLocalDate().plusDays(index + 1L);

            Instant publishAt = ZonedDateTime.of(publishDate, slot, zone).toInstant().plus(jitter(jitterRangeMinutes));
            Instant result = ensureAfter(publishAt, now);
            log.info("Scheduled short {} for {} (slot {} in {})", index, result, slot, zone);
            return result;
        } catch (RuntimeException e) {
            log.error("Failed to compute rotation slot {} for zone {}, using fallback", index, timezone, e);
            Instant base = basePublishTime != null ? basePublishTime : now;
            return ensureAfter(base.plus(Duration.ofDays(index + 1L)).plus(Duration.ofHours(12)), now);
        }
    }

    LocalTime resolveSlot(DayOfWeek weekday, ContentType contentType, Map<DayOfWeek, String> slotTable) {
        if (slotTable != null && slotTable.get(weekday) != null) {
            return LocalTime.parse(slotTable.get(weekday).trim());
        }
        Map<DayOfWeek, LocalTime> defaults = contentType == ContentType.LONG ? DEFAULT_LONG_SLOTS : DEFAULT_SHORT_SLOTS;
        return defaults.get(weekday);
    }

    static Instant fallback(Instant now) {
        return now.atZone(FALLBACK_ZONE).toLocalDate().plusDays(1).atTime(FALLBACK_TIME).atZone(FALLBACK_ZONE).toInstant();
    }

    private Duration jitter(int rangeMinutes) {
        if (rangeMinutes <= 0) {
            return Duration.ZERO;
        }
        return Duration.ofMinutes(scheduleRandom.nextInt(2 * rangeMinutes + 1) - rangeMinutes);
    }

    private static Instant ensureAfter(Instant candidate, Instant now) {
        Instant result = candidate;
        while (!result.isAfter(now)) {
            result = result.plus(Duration.ofDays(1));
        }
        if (!result.equals(candidate)) {
            log.warn("Computed publish time {} was not after {}, rolled forward to {}", candidate, now, result);
        }
        return result;
    }
}
