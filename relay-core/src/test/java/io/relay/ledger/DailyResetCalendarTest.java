package io.relay.ledger;

import io.relay.RelayConfigException;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class DailyResetCalendarTest {

  @Test
  void dayChangesExactlyAtResetHour() {
    DailyResetCalendar calendar = new DailyResetCalendar(23, ZoneOffset.UTC);

    assertEquals(LocalDate.of(2024, 6, 9), calendar.businessDate(Instant.parse("2024-06-10T22:59:59Z")));
    assertEquals(LocalDate.of(2024, 6, 10), calendar.businessDate(Instant.parse("2024-06-10T23:00:00Z")));
    assertEquals(LocalDate.of(2024, 6, 10), calendar.businessDate(Instant.parse("2024-06-11T22:00:00Z")));
  }

  @Test
  void midnightResetMatchesCalendarDates() {
    DailyResetCalendar calendar = new DailyResetCalendar(0, ZoneOffset.UTC);

    assertEquals(LocalDate.of(2024, 6, 10), calendar.businessDate(Instant.parse("2024-06-10T00:00:00Z")));
    assertEquals(LocalDate.of(2024, 6, 10), calendar.businessDate(Instant.parse("2024-06-10T23:59:59Z")));
  }

  @Test
  void usesConfiguredZone() {
    DailyResetCalendar calendar = new DailyResetCalendar(0, ZoneId.of("Europe/Warsaw"));

    // 22:30 UTC is 00:30 in Warsaw during summer time
    assertEquals(LocalDate.of(2024, 6, 11), calendar.businessDate(Instant.parse("2024-06-10T22:30:00Z")));
  }

  @Test
  void ofRejectsBadConfiguration() {
    assertThrows(RelayConfigException.class, () -> DailyResetCalendar.of(24, "UTC"));
    assertThrows(RelayConfigException.class, () -> DailyResetCalendar.of(-1, "UTC"));
    assertThrows(RelayConfigException.class, () -> DailyResetCalendar.of(23, "Mars/Olympus"));
    assertThrows(RelayConfigException.class, () -> DailyResetCalendar.of(23, " "));
    assertEquals(ZoneId.of("Europe/Warsaw"), DailyResetCalendar.of(5, "Europe/Warsaw").zone());
  }
}
