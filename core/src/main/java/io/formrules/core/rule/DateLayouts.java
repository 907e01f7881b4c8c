package io.formrules.core.rule;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;
import java.time.temporal.TemporalQueries;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Date parsing shared by the date rules. Every parsed date becomes an {@link OffsetDateTime}:
 * midnight when the layout has no time, UTC when it has neither offset nor zone. Layouts are
 * resolved strictly, so {@code 2023-02-30} is rejected instead of being clamped.
 *
 * <p>Thread-safe: formatters are immutable and cached per layout.
 */
public final class DateLayouts {

    /** Layout used by {@code date} without parameter and for sibling fields not yet coerced. */
    public static final String DEFAULT_DATE_LAYOUT = "uuuu-MM-dd";

    /** Layout of literal comparison parameters: {@code 2023-06-01T10:30:00}, time part optional. */
    public static final DateTimeFormatter LITERAL_DATE_TIME = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .optionalStart()
            .appendLiteral('T')
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .optionalEnd()
            .toFormatter()
            .withResolverStyle(ResolverStyle.STRICT);

    private static final Map<String, DateTimeFormatter> FORMATTERS = new ConcurrentHashMap<>();

    private DateLayouts() {}

    /**
     * Returns the formatter for a {@code java.time} pattern such as {@code dd/MM/uuuu}.
     *
     * @throws IllegalArgumentException if the pattern is invalid
     */
    public static DateTimeFormatter formatter(String layout) {
        return FORMATTERS.computeIfAbsent(
                layout, pattern -> DateTimeFormatter.ofPattern(pattern).withResolverStyle(ResolverStyle.STRICT));
    }

    /**
     * Parses {@code value} with the given layout. Only strings can be parsed.
     *
     * @return the parsed date, or empty if the value is not a string or does not match the layout
     */
    public static Optional<OffsetDateTime> parse(Object value, String layout) {
        if (!(value instanceof String text)) {
            return Optional.empty();
        }
        try {
            return Optional.of(toDateTime(formatter(layout).parse(text)));
        } catch (DateTimeException | IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    /** Parses a literal comparison parameter with {@link #LITERAL_DATE_TIME}. */
    public static Optional<OffsetDateTime> parseLiteral(String literal) {
        try {
            return Optional.of(toDateTime(LITERAL_DATE_TIME.parse(literal)));
        } catch (DateTimeException e) {
            return Optional.empty();
        }
    }

    private static OffsetDateTime toDateTime(TemporalAccessor parsed) {
        LocalDate date = parsed.query(TemporalQueries.localDate());
        if (date == null) {
            // Layouts without a full date ("uuuu-MM", "HH:mm") or using year-of-era ("yyyy")
            int year = parsed.isSupported(ChronoField.YEAR)
                    ? parsed.get(ChronoField.YEAR)
                    : fieldOrDefault(parsed, ChronoField.YEAR_OF_ERA, 0);
            date = LocalDate.of(
                    year,
                    fieldOrDefault(parsed, ChronoField.MONTH_OF_YEAR, 1),
                    fieldOrDefault(parsed, ChronoField.DAY_OF_MONTH, 1));
        }
        LocalTime time = parsed.query(TemporalQueries.localTime());
        LocalDateTime dateTime = LocalDateTime.of(date, time != null ? time : LocalTime.MIDNIGHT);

        ZoneId zone = parsed.query(TemporalQueries.zone());
        if (zone == null) {
            return dateTime.atOffset(ZoneOffset.UTC);
        }
        return dateTime.atZone(zone).toOffsetDateTime();
    }

    private static int fieldOrDefault(TemporalAccessor parsed, ChronoField field, int defaultValue) {
        return parsed.isSupported(field) ? parsed.get(field) : defaultValue;
    }
}
