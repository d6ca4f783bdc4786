/*
 * The MIT License
 *
 * Copyright (c) 2024 The Broad Institute
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package argot.cmdline.conversion;

import argot.cmdline.CommandLineParseException;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.FormatStyle;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;

/**
 * Converts {@code java.time} values. The ISO-8601 form is always accepted. Local dates and times additionally
 * accept the short and medium localized forms of the given locale.
 */
public final class DateTimeConverter<T> implements ArgumentConverter<T> {
    public static final DateTimeConverter<LocalDate> LOCAL_DATE = new DateTimeConverter<>(LocalDate.class, LocalDate::parse,
            style -> DateTimeFormatter.ofLocalizedDate(style), LocalDate::from);
    public static final DateTimeConverter<LocalTime> LOCAL_TIME = new DateTimeConverter<>(LocalTime.class, LocalTime::parse,
            style -> DateTimeFormatter.ofLocalizedTime(style), LocalTime::from);
    public static final DateTimeConverter<LocalDateTime> LOCAL_DATE_TIME = new DateTimeConverter<>(LocalDateTime.class,
            LocalDateTime::parse, style -> DateTimeFormatter.ofLocalizedDateTime(style), LocalDateTime::from);
    public static final DateTimeConverter<OffsetDateTime> OFFSET_DATE_TIME = new DateTimeConverter<>(OffsetDateTime.class,
            OffsetDateTime::parse, null, null);
    public static final DateTimeConverter<ZonedDateTime> ZONED_DATE_TIME = new DateTimeConverter<>(ZonedDateTime.class,
            ZonedDateTime::parse, null, null);
    public static final DateTimeConverter<Instant> INSTANT = new DateTimeConverter<>(Instant.class, Instant::parse, null, null);
    public static final DateTimeConverter<Duration> DURATION = new DateTimeConverter<>(Duration.class, Duration::parse, null, null);

    private static final FormatStyle[] LOCALIZED_STYLES = {FormatStyle.SHORT, FormatStyle.MEDIUM};

    private final Class<T> type;
    private final Function<String, T> isoParser;
    private final Function<FormatStyle, DateTimeFormatter> localizedFormatter;
    private final Function<TemporalAccessor, T> fromTemporal;

    private DateTimeConverter(final Class<T> type,
                              final Function<String, T> isoParser,
                              final Function<FormatStyle, DateTimeFormatter> localizedFormatter,
                              final Function<TemporalAccessor, T> fromTemporal) {
        this.type = type;
        this.isoParser = isoParser;
        this.localizedFormatter = localizedFormatter;
        this.fromTemporal = fromTemporal;
    }

    public Class<T> getType() {
        return type;
    }

    @Override
    public T convert(final String value, final Locale locale) {
        final String trimmed = value.trim();
        final List<DateTimeParseException> failures = new ArrayList<>();
        try {
            return isoParser.apply(trimmed);
        } catch (final DateTimeParseException e) {
            failures.add(e);
        }

        if (localizedFormatter != null) {
            for (final FormatStyle style : LOCALIZED_STYLES) {
                try {
                    return localizedFormatter.apply(style).withLocale(locale).parse(trimmed, fromTemporal::apply);
                } catch (final DateTimeParseException e) {
                    failures.add(e);
                }
            }
        }

        throw new CommandLineParseException("'" + value + "' is not a valid " + type.getSimpleName() + ".", failures.get(0));
    }
}
