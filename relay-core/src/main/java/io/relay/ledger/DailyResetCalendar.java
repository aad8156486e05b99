package io.relay.ledger;

import io.relay.RelayConfigException;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Objects;

/**
 * Maps instants to business dates.
 *
 * <p>A business day starts at {@code resetHour}:00 local time in {@code zone}. The business
 * date of an instant is the local date of {@code instant - resetHour hours}, so with
 * {@code resetHour = 23} in UTC, 22:59 still counts towards the day that began at 23:00
 * yesterday and 23:01 starts a new one. With {@code resetHour = 0} business dates are plain
 * calendar dates.
 */
public final class DailyResetCalendar {
  private final int resetHour;
  private final ZoneId zone;

  public DailyResetCalendar(int resetHour, ZoneId zone) {
    if (resetHour < 0 || resetHour > 23) {
      throw new IllegalArgumentException("resetHour must be in [0, 23], got: " + resetHour);
    }
    this.resetHour = resetHour;
    this.zone = Objects.requireNonNull(zone, "zone");
  }

  /**
   * Builds a calendar from configuration values.
   *
   * @throws RelayConfigException if the hour is out of range or the zone id is unknown
   */
  public static DailyResetCalendar of(int resetHour, String zoneId) {
    if (resetHour < 0 || resetHour > 23) {
      throw new RelayConfigException("reset hour must be in [0, 23], got: " + resetHour);
    }
    if (zoneId == null || zoneId.isBlank()) {
      throw new RelayConfigException("timezone must be set");
    }
    try {
      return new DailyResetCalendar(resetHour, ZoneId.of(zoneId));
    } catch (DateTimeException e) {
      throw new RelayConfigException("Unknown timezone: " + zoneId, e);
    }
  }

  public LocalDate businessDate(Instant instant) {
    Objects.requireNonNull(instant, "instant");
    return instant.atZone(zone).minusHours(resetHour).toLocalDate();
  }

  public int resetHour() {
    return resetHour;
  }

  public ZoneId zone() {
    return zone;
  }

  @Override
  public String toString() {
    return "DailyResetCalendar{resetHour=" + resetHour + ", zone=" + zone + '}';
  }
}
