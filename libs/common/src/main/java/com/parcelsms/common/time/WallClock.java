/*
 * Where: Common time abstraction
 * What: Supplies "now" and projects instants into the business civil time zone
 * Why: Storage and comparison stay absolute while day/week logic follows local wall-clock time
 */
package com.parcelsms.common.time;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Objects;

/**
 * Injectable time source bound to a single civil time zone.
 *
 * <p>The {@link Clock} decides what "now" is; tests and backfills pass a fixed or adjustable
 * clock instead of mutating any global state.
 */
public final class WallClock {

  private final Clock clock;
  private final ZoneId zone;

  public WallClock(Clock clock, ZoneId zone) {
    this.clock = Objects.requireNonNull(clock, "clock");
    this.zone = Objects.requireNonNull(zone, "zone");
  }

  public Instant now() {
    return clock.instant();
  }

  public CivilTime nowCivil() {
    return fromInstant(now());
  }

  public ZoneId zone() {
    return zone;
  }

  public CivilTime fromInstant(Instant instant) {
    return new CivilTime(Objects.requireNonNull(instant, "instant"), zone);
  }

  /**
   * Parses an ISO-8601 instant ({@code 2025-10-10T10:00:00Z}) or offset date-time
   * ({@code 2025-10-10T12:00:00+02:00}).
   *
   * @throws WallClockParseException when the value is null, blank or not ISO-8601
   */
  public CivilTime parse(String value) {
    if (value == null || value.isBlank()) {
      throw new WallClockParseException("instant value is blank", null);
    }
    try {
      // ISO_OFFSET_DATE_TIME also accepts the "Z" designator
      return fromInstant(OffsetDateTime.parse(value).toInstant());
    } catch (DateTimeException ex) {
      throw new WallClockParseException("unparseable instant value=" + value, ex);
    }
  }

  /**
   * Resolves a civil date and time in the business zone.
   *
   * <p>A time inside a spring-forward gap is shifted forward by the length of the gap. A time
   * inside a fall-back overlap resolves to the earlier of the two instants; use {@link
   * CivilTime#withLaterOffset()} for the second occurrence.
   */
  public CivilTime atLocal(LocalDate date, LocalTime time) {
    final ZonedDateTime zoned = ZonedDateTime.ofLocal(LocalDateTime.of(date, time), zone, null);
    return fromInstant(zoned.toInstant());
  }
}
