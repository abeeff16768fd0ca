package com.autoviral.worker.service.schedule;

import com.autoviral.worker.dto.SeriesDto;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RecurrenceService Tests")
class RecurrenceServiceTest {

    // 2024-03-08 (금) 12:00 UTC
    private static final Instant NOW = Instant.parse("2024-03-08T12:00:00Z");

    private RecurrenceService service;

    @BeforeEach
    void setUp() {
        service = new RecurrenceService(Clock.fixed(NOW, ZoneOffset.UTC));
    }

    // ==================== Daily ====================

    @Test
    @DisplayName("Daily slots keep the local wall clock across a DST change")
    void testDaily_DstTransition() {
        SeriesDto.Schedule schedule = SeriesDto.Schedule.builder()
                .frequency("daily")
                .publishTime("09:00")
                .timezone("America/New_York")
                .build();

        List<Instant> slots = service.nextPublishSlots(schedule, 3);

        assertEquals(List.of(
                Instant.parse("2024-03-08T14:00:00Z"),
                Instant.parse("2024-03-09T14:00:00Z"),
                Instant.parse("2024-03-10T13:00:00Z")), slots);
    }

    @Test
    @DisplayName("Today's slot is skipped once its time has passed")
    void testDaily_SkipsPastSlot() {
        SeriesDto.Schedule schedule = SeriesDto.Schedule.builder()
                .frequency("daily")
                .publishTime("09:30")
                .timezone("UTC")
                .build();

        List<Instant> slots = service.nextPublishSlots(schedule, 2);

        assertEquals(Instant.parse("2024-03-09T09:30:00Z"), slots.get(0));
        assertEquals(Instant.parse("2024-03-10T09:30:00Z"), slots.get(1));
    }

    @Test
    @DisplayName("Weekly without custom days behaves like daily")
    void testWeekly_EmptyDaysEqualsDaily() {
        SeriesDto.Schedule daily = SeriesDto.Schedule.builder()
                .frequency("daily").publishTime("18:00").timezone("Asia/Seoul").build();
        SeriesDto.Schedule weekly = SeriesDto.Schedule.builder()
                .frequency("weekly").publishTime("18:00").timezone("Asia/Seoul")
                .customDays(Collections.emptyList()).build();

        assertEquals(service.nextPublishSlots(daily, 5), service.nextPublishSlots(weekly, 5));
    }

    // ==================== Weekly ====================

    @Test
    @DisplayName("Weekly custom days only produce matching weekdays")
    void testWeekly_CustomDays() {
        SeriesDto.Schedule schedule = SeriesDto.Schedule.builder()
                .frequency("weekly")
                .publishTime("09:00")
                .timezone("America/New_York")
                .customDays(List.of(0, 2)) // 월, 수
                .build();

        List<Instant> slots = service.nextPublishSlots(schedule, 3);

        assertEquals(List.of(
                Instant.parse("2024-03-11T13:00:00Z"),
                Instant.parse("2024-03-13T13:00:00Z"),
                Instant.parse("2024-03-18T13:00:00Z")), slots);
    }

    // ==================== Fallbacks ====================

    @Test
    @DisplayName("Unknown timezone falls back to UTC")
    void testInvalidTimezone_FallsBackToUtc() {
        SeriesDto.Schedule schedule = SeriesDto.Schedule.builder()
                .frequency("daily").publishTime("09:00").timezone("Mars/Olympus").build();

        List<Instant> slots = service.nextPublishSlots(schedule, 1);

        assertEquals(Instant.parse("2024-03-09T09:00:00Z"), slots.get(0));
    }

    @Test
    @DisplayName("Future start date moves the first slot forward")
    void testStartDate_InFuture() {
        SeriesDto.Schedule schedule = SeriesDto.Schedule.builder()
                .frequency("daily").publishTime("09:00").timezone("UTC").startDate("2024-04-01").build();

        List<Instant> slots = service.nextPublishSlots(schedule, 2);

        assertEquals(Instant.parse("2024-04-01T09:00:00Z"), slots.get(0));
        assertEquals(Instant.parse("2024-04-02T09:00:00Z"), slots.get(1));
    }

    @Test
    @DisplayName("Past start date is ignored")
    void testStartDate_InPast() {
        SeriesDto.Schedule schedule = SeriesDto.Schedule.builder()
                .frequency("daily").publishTime("15:00").timezone("UTC")
                .startDate("2024-01-01T00:00:00Z").build();

        assertEquals(Instant.parse("2024-03-08T15:00:00Z"), service.nextPublishSlots(schedule, 1).get(0));
    }

    @Test
    @DisplayName("Null schedule uses daily 09:00 UTC and count limits the result")
    void testNullScheduleAndCount() {
        assertTrue(service.nextPublishSlots(null, 0).isEmpty());

        List<Instant> slots = service.nextPublishSlots(null, 7);
        assertEquals(7, slots.size());
        assertEquals(Instant.parse("2024-03-09T09:00:00Z"), slots.get(0));
        assertEquals(Instant.parse("2024-03-15T09:00:00Z"), slots.get(6));
    }

    @Test
    @DisplayName("UTC variant returns naive UTC date-times")
    void testNextPublishSlotsUtc() {
        SeriesDto.Schedule schedule = SeriesDto.Schedule.builder()
                .frequency("daily").publishTime("09:00").timezone("Asia/Seoul").build();

        List<LocalDateTime> slots = service.nextPublishSlotsUtc(schedule, 1);

        // 서울 09:00 = UTC 00:00, 3/8 09:00 KST 는 이미 지났으므로 3/9
        assertEquals(LocalDateTime.of(2024, 3, 9, 0, 0), slots.get(0));
    }

    @Test
    @DisplayName("Publish time parsing accepts seconds and rejects garbage")
    void testParsePublishTime() {
        assertEquals(LocalTime.of(7, 5), RecurrenceService.parsePublishTime("07:05:00"));
        assertEquals(LocalTime.of(9, 0), RecurrenceService.parsePublishTime("abc"));
        assertEquals(LocalTime.of(9, 0), RecurrenceService.parsePublishTime("25:00"));
        assertEquals(LocalTime.of(9, 0), RecurrenceService.parsePublishTime(null));
    }
}
