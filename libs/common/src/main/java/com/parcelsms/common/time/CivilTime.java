/*
 * Where: Common time abstraction
 * What: An absolute instant together with its projection into the civil time zone
 * Why: Day and ISO-week boundaries must be computed on the local calendar, not on UTC
 */
package com.parcelsms.common.time;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.IsoFields;
import java.time.temporal.TemporalAdjusters;
import java.util.Locale;
import java.util.Objects;

/**
 * Immutable civil view of an instant.
 *
 * <p>Ordering and equality use the absolute instant only. Calendar fields are derived on every
 * call and never used as the basis for comparison.
 */
public final class CivilTime implements Comparable<CivilTime> {

  private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("HH:mm");
  private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ISO_LOCAL_DATE;
  private static final Duration END_OF_PERIOD_PRECISION = Duration.ofMillis(1);

  private final Instant instant;
  private final ZoneId zone;

  CivilTime(Instant instant, ZoneId zone) {
    this.instant = instant;
    this.zone = zone;
  }

  public Instant instant() {
    return instant;
  }

  public ZoneId zone() {
    return zone;
  }

  public ZonedDateTime zoned() {
    return instant.atZone(zone);
  }

  public LocalDate date() {
    return zoned().toLocalDate();
  }

  public LocalTime timeOfDay() {
    return zoned().toLocalTime();
  }

  public DayOfWeek weekday() {
    return zoned().getDayOfWeek();
  }

  /** Lower-case English weekday, e.g. {@code "saturday"}. */
  public String weekdayName() {
    return weekday().name().toLowerCase(Locale.ROOT);
  }

  public int isoWeek() {
    return date().get(IsoFields.WEEK_OF_WEEK_BASED_YEAR);
  }

  public int isoWeekYear() {
    return date().get(IsoFields.WEEK_BASED_YEAR);
  }

  public String formatTime() {
    return zoned().format(TIME_FORMAT);
  }

  public String formatDate() {
    return zoned().format(DATE_FORMAT);
  }

  public String format(DateTimeFormatter formatter) {
    return zoned().format(formatter);
  }

  public CivilTime startOfDay() {
    return of(date().atStartOfDay(zone));
  }

  /** Last millisecond of the civil day (23:59:59.999 local). */
  public CivilTime endOfDay() {
    return of(date().plusDays(1).atStartOfDay(zone)).minus(END_OF_PERIOD_PRECISION);
  }

  /** Monday 00:00 local of the ISO week containing this instant. */
  public CivilTime startOfIsoWeek() {
    final LocalDate monday = date().with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
    return of(monday.atStartOfDay(zone));
  }

  /** Sunday 23:59:59.999 local of the ISO week containing this instant. */
  public CivilTime endOfIsoWeek() {
    final LocalDate nextMonday = date().with(TemporalAdjusters.next(DayOfWeek.MONDAY));
    return of(nextMonday.atStartOfDay(zone)).minus(END_OF_PERIOD_PRECISION);
  }

  /** Same civil date at the given local time, resolved like {@link WallClock#atLocal}. */
  public CivilTime atTime(LocalTime time) {
    return of(ZonedDateTime.ofLocal(date().atTime(time), zone, null));
  }

  /** The other occurrence of this wall-clock time when it falls in a fall-back overlap. */
  public CivilTime withLaterOffset() {
    return of(zoned().withLaterOffsetAtOverlap());
  }

  public CivilTime withEarlierOffset() {
    return of(zoned().withEarlierOffsetAtOverlap());
  }

  public CivilTime plus(Duration duration) {
    return new CivilTime(instant.plus(duration), zone);
  }

  public CivilTime minus(Duration duration) {
    return new CivilTime(instant.minus(duration), zone);
  }

  public boolean isBefore(CivilTime other) {
    return instant.isBefore(other.instant);
  }

  public boolean isAfter(CivilTime other) {
    return instant.isAfter(other.instant);
  }

  /** Inclusive on both ends. */
  public boolean isBetween(CivilTime start, CivilTime end) {
    return !instant.isBefore(start.instant) && !instant.isAfter(end.instant);
  }

  @Override
  public int compareTo(CivilTime other) {
    return instant.compareTo(other.instant);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof CivilTime other)) {
      return false;
    }
    return instant.equals(other.instant);
  }

  @Override
  public int hashCode() {
    return Objects.hash(instant);
  }

  @Override
  public String toString() {
    return zoned().toOffsetDateTime().toString();
  }

  private CivilTime of(ZonedDateTime zoned) {
    return new CivilTime(zoned.toInstant(), zone);
  }
}
