package com.autoviral.worker.service.schedule;

import com.autoviral.worker.dto.SeriesDto;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

/**
 * 게시 일정 → 다음 게시 시각 (UTC)
 *
 * 기준일 = max(startDate, now) 를 대상 타임존으로 옮긴 날짜. 하루씩 진행하며 그 날의 게시 시각(현지 벽시계)을
 * 후보로 만들고, now 이전 후보는 건너뛴다. weekly + customDays 가 있으면 해당 요일만 채택, 나머지는 매일.
 * 최대 365일까지만 탐색한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RecurrenceService {

    static final int MAX_DAYS = 365;
    private static final LocalTime DEFAULT_PUBLISH_TIME = LocalTime.of(9, 0);

    private final Clock clock;

    public List<Instant> nextPublishSlots(SeriesDto.Schedule schedule, int count) {
        SeriesDto.Schedule s = schedule != null ? schedule : new SeriesDto.Schedule();
        if (count <= 0) {
            return Collections.emptyList();
        }

        ZoneId zone = resolveZone(s.getTimezone());
        LocalTime publishTime = parsePublishTime(s.getPublishTime());
        Set<Integer> weekdays = weekdayFilter(s);

        Instant now = clock.instant();
        Instant anchor = now;
        Instant startDate = parseStartDate(s.getStartDate());
        if (startDate != null && startDate.isAfter(now)) {
            anchor = startDate;
        }
        LocalDate firstDay = anchor.atZone(zone).toLocalDate();

        List<Instant> slots = new ArrayList<>(count);
        for (int dayOffset = 0; dayOffset < MAX_DAYS && slots.size() < count; dayOffset++) {
            LocalDate day = firstDay.plusDays(dayOffset);
            // 존재하지 않는 현지 시각(DST 시작)은 ZonedDateTime.of 가 뒤로 밀어준다
            ZonedDateTime candidate = ZonedDateTime.of(day, publishTime, zone);
            if (candidate.toInstant().isBefore(now)) {
                continue;
            }
            if (weekdays != null && !weekdays.contains(candidate.getDayOfWeek().getValue() - 1)) {
                continue;
            }
            slots.add(candidate.toInstant());
        }

        if (slots.size() < count) {
            log.debug("[Recurrence] Horizon exhausted: requested {}, found {}", count, slots.size());
        }
        return slots;
    }

    public List<LocalDateTime> nextPublishSlotsUtc(SeriesDto.Schedule schedule, int count) {
        List<LocalDateTime> result = new ArrayList<>(count);
        for (Instant slot : nextPublishSlots(schedule, count)) {
            result.add(LocalDateTime.ofInstant(slot, ZoneOffset.UTC));
        }
        return result;
    }

    /**
     * weekly 이면서 요일 목록이 비어 있지 않을 때만 필터 (그 외 null = 매일)
     */
    private static Set<Integer> weekdayFilter(SeriesDto.Schedule s) {
        if (!"weekly".equals(s.getFrequency()) || s.getCustomDays() == null || s.getCustomDays().isEmpty()) {
            return null;
        }
        return new HashSet<>(s.getCustomDays());
    }

    static ZoneId resolveZone(String timezone) {
        if (timezone == null || timezone.isBlank()) {
            return ZoneOffset.UTC;
        }
        try {
            return ZoneId.of(timezone.trim());
        } catch (DateTimeException e) {
            log.warn("[Recurrence] Unknown timezone '{}', falling back to UTC", timezone);
            return ZoneOffset.UTC;
        }
    }

    static LocalTime parsePublishTime(String publishTime) {
        if (publishTime == null || publishTime.isBlank()) {
            return DEFAULT_PUBLISH_TIME;
        }
        String[] parts = publishTime.trim().split(":");
        try {
            int hour = Integer.parseInt(parts[0]);
            int minute = parts.length > 1 ? Integer.parseInt(parts[1]) : 0;
            return LocalTime.of(hour, minute);
        } catch (NumberFormatException | DateTimeException e) {
            log.warn("[Recurrence] Invalid publishTime '{}', using 09:00", publishTime);
            return DEFAULT_PUBLISH_TIME;
        }
    }

    /**
     * ISO 일시/날짜 문자열. 오프셋이 없으면 UTC 로 본다. 해석 불가하면 null.
     */
    static Instant parseStartDate(String startDate) {
        if (startDate == null || startDate.isBlank()) {
            return null;
        }
        String value = startDate.trim();
        List<Function<String, Instant>> parsers = List.of(
                v -> OffsetDateTime.parse(v).toInstant(),
                v -> LocalDateTime.parse(v).toInstant(ZoneOffset.UTC),
                v -> LocalDate.parse(v).atStartOfDay(ZoneOffset.UTC).toInstant());
        for (Function<String, Instant> parser : parsers) {
            Instant parsed = tryParse(parser, value);
            if (parsed != null) {
                return parsed;
            }
        }
        log.warn("[Recurrence] Unparseable startDate '{}', ignoring", startDate);
        return null;
    }

    private static Instant tryParse(Function<String, Instant> parser, String value) {
        try {
            return parser.apply(value);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
