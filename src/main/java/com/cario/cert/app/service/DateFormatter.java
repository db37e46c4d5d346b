package com.cario.cert.app.service;

import static java.time.temporal.ChronoField.DAY_OF_MONTH;
import static java.time.temporal.ChronoField.HOUR_OF_DAY;
import static java.time.temporal.ChronoField.MINUTE_OF_HOUR;
import static java.time.temporal.ChronoField.MONTH_OF_YEAR;
import static java.time.temporal.ChronoField.NANO_OF_SECOND;
import static java.time.temporal.ChronoField.SECOND_OF_MINUTE;
import static java.time.temporal.ChronoField.YEAR;

import java.text.ParsePosition;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.ResolverStyle;
import java.time.temporal.TemporalAccessor;
import java.util.List;

/**
 * Formats ISO 8601 dates for display on the certificate as {@code MM/DD/YYYY}.
 *
 * <p>The date may be extended ({@code 2024-03-05}), basic ({@code 20240305}) or a week date
 * ({@code 2024-W10-2}). It may be followed by any single separator character and a time of reduced
 * precision ({@code 10}, {@code 10:15}, {@code 101530.5}) with an optional offset. Anything else is
 * returned as given, so already formatted or free-text dates reach the document untouched instead
 * of failing the request.
 */
public class DateFormatter {

  private static final DateTimeFormatter US_DATE = DateTimeFormatter.ofPattern("MM/dd/yyyy");

  private static final DateTimeFormatter BASIC_DATE =
      new DateTimeFormatterBuilder()
          .appendValue(YEAR, 4)
          .appendValue(MONTH_OF_YEAR, 2)
          .appendValue(DAY_OF_MONTH, 2)
          .toFormatter()
          .withResolverStyle(ResolverStyle.STRICT);

  private static final List<DateTimeFormatter> DATES =
      List.of(DateTimeFormatter.ISO_LOCAL_DATE, BASIC_DATE, DateTimeFormatter.ISO_WEEK_DATE);

  private static final List<DateTimeFormatter> TIMES =
      List.of(time(":", "+HH:MM:ss"), time("", "+HHMMss"));

  public String toUsDate(String value) {
    if (value == null) {
      return "";
    }
    String trimmed = value.trim();
    for (DateTimeFormatter date : DATES) {
      try {
        ParsePosition position = new ParsePosition(0);
        TemporalAccessor parsed = date.parse(trimmed, position);
        if (isTimeSuffix(trimmed, position.getIndex())) {
          return US_DATE.format(LocalDate.from(parsed));
        }
      } catch (DateTimeException e) {
        // try the next shape; the input is returned unchanged if none matches
      }
    }
    return value;
  }

  /** True when the date ends the text, or is followed by one separator and a valid time. */
  private static boolean isTimeSuffix(String text, int dateEnd) {
    if (dateEnd == text.length()) {
      return true;
    }
    if (dateEnd + 1 >= text.length()) {
      return false;
    }
    String time = text.substring(dateEnd + 1);
    for (DateTimeFormatter formatter : TIMES) {
      try {
        formatter.parse(time);
        return true;
      } catch (DateTimeException e) {
        // next layout
      }
    }
    return false;
  }

  private static DateTimeFormatter time(String separator, String offsetPattern) {
    return new DateTimeFormatterBuilder()
        .appendValue(HOUR_OF_DAY, 2)
        .optionalStart()
        .appendLiteral(separator)
        .appendValue(MINUTE_OF_HOUR, 2)
        .optionalStart()
        .appendLiteral(separator)
        .appendValue(SECOND_OF_MINUTE, 2)
        .optionalStart()
        .appendFraction(NANO_OF_SECOND, 1, 9, true)
        .optionalEnd()
        .optionalEnd()
        .optionalEnd()
        .optionalStart()
        .appendOffset(offsetPattern, "Z")
        .optionalEnd()
        .toFormatter();
  }
}
