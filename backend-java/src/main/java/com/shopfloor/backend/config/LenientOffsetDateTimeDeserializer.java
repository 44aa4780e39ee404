package com.shopfloor.backend.config;

import java.io.IOException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.util.List;
import java.util.function.Function;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;

/**
 * Inspection dates arrive from forms in several shapes. Values without an offset are taken as UTC.
 *
 * <ul>
 *   <li>2026-03-02T14:05:00+01:00</li>
 *   <li>2026-03-02T13:05:00Z / 2026-03-02T13:05:00.123Z</li>
 *   <li>2026-03-02T13:05:00 / 2026-03-02 13:05:00</li>
 *   <li>2026-03-02 (start of day)</li>
 * </ul>
 */
public final class LenientOffsetDateTimeDeserializer extends JsonDeserializer<OffsetDateTime> {
  private static final DateTimeFormatter LOCAL_FLEX = new DateTimeFormatterBuilder()
      .appendPattern("yyyy-MM-dd")
      .optionalStart().appendLiteral('T').optionalEnd()
      .optionalStart().appendLiteral(' ').optionalEnd()
      .appendPattern("HH:mm:ss")
      .optionalStart().appendFraction(ChronoField.NANO_OF_SECOND, 1, 9, true).optionalEnd()
      .toFormatter();

  private static final List<Function<String, OffsetDateTime>> PARSERS = List.of(
      OffsetDateTime::parse,
      s -> Instant.parse(s).atOffset(ZoneOffset.UTC),
      s -> LocalDateTime.parse(s, LOCAL_FLEX).atOffset(ZoneOffset.UTC),
      s -> LocalDate.parse(s).atStartOfDay().atOffset(ZoneOffset.UTC)
  );

  @Override
  public OffsetDateTime deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
    String raw = p.getValueAsString();
    String s = raw == null ? "" : raw.trim();
    if (s.isEmpty()) {
      return null;
    }
    OffsetDateTime parsed = parse(s);
    if (parsed != null) {
      return parsed;
    }
    return (OffsetDateTime) ctxt.handleWeirdStringValue(
        OffsetDateTime.class,
        s,
        "expected an ISO-8601 date or date-time"
    );
  }

  static OffsetDateTime parse(String s) {
    for (Function<String, OffsetDateTime> parser : PARSERS) {
      try {
        return parser.apply(s);
      } catch (DateTimeParseException e) {
        // next shape
      }
    }
    return null;
  }
}
