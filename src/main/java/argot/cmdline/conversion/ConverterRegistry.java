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

import java.io.File;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Finds the default converter for a type: a built-in converter if there is one, otherwise a
 * {@link ParseMethodConverter}, otherwise a {@link ConstructorConverter}. The outcome of the reflective lookup is
 * cached per type.
 */
public final class ConverterRegistry {
    private static final Map<Class<?>, ArgumentConverter<?>> BUILT_IN_CONVERTERS;
    private static final Map<Class<?>, Class<?>> PRIMITIVE_WRAPPERS;
    private static final ConcurrentMap<Class<?>, Optional<ArgumentConverter<?>>> RESOLVED = new ConcurrentHashMap<>();

    static {
        final Map<Class<?>, Class<?>> wrappers = new HashMap<>();
        wrappers.put(boolean.class, Boolean.class);
        wrappers.put(char.class, Character.class);
        wrappers.put(byte.class, Byte.class);
        wrappers.put(short.class, Short.class);
        wrappers.put(int.class, Integer.class);
        wrappers.put(long.class, Long.class);
        wrappers.put(float.class, Float.class);
        wrappers.put(double.class, Double.class);
        PRIMITIVE_WRAPPERS = Collections.unmodifiableMap(wrappers);

        final Map<Class<?>, ArgumentConverter<?>> builtIn = new HashMap<>();
        builtIn.put(String.class, StringConverter.INSTANCE);
        builtIn.put(Boolean.class, BooleanConverter.INSTANCE);
        builtIn.put(Character.class, CharacterConverter.INSTANCE);
        builtIn.put(Byte.class, NumberConverter.BYTE);
        builtIn.put(Short.class, NumberConverter.SHORT);
        builtIn.put(Integer.class, NumberConverter.INTEGER);
        builtIn.put(Long.class, NumberConverter.LONG);
        builtIn.put(BigInteger.class, NumberConverter.BIG_INTEGER);
        builtIn.put(Float.class, NumberConverter.FLOAT);
        builtIn.put(Double.class, NumberConverter.DOUBLE);
        builtIn.put(BigDecimal.class, NumberConverter.BIG_DECIMAL);
        builtIn.put(LocalDate.class, DateTimeConverter.LOCAL_DATE);
        builtIn.put(LocalTime.class, DateTimeConverter.LOCAL_TIME);
        builtIn.put(LocalDateTime.class, DateTimeConverter.LOCAL_DATE_TIME);
        builtIn.put(OffsetDateTime.class, DateTimeConverter.OFFSET_DATE_TIME);
        builtIn.put(ZonedDateTime.class, DateTimeConverter.ZONED_DATE_TIME);
        builtIn.put(Instant.class, DateTimeConverter.INSTANT);
        builtIn.put(Duration.class, DateTimeConverter.DURATION);
        builtIn.put(Path.class, PathConverter.INSTANCE);
        builtIn.put(File.class, (value, locale) -> new File(value));
        builtIn.put(URI.class, ConstructorConverter.find(URI.class));
        BUILT_IN_CONVERTERS = Collections.unmodifiableMap(builtIn);
    }

    private ConverterRegistry() {
    }

    /** @return the wrapper class for a primitive type, or the type itself. */
    public static Class<?> wrap(final Class<?> type) {
        final Class<?> wrapper = PRIMITIVE_WRAPPERS.get(type);
        return wrapper == null ? type : wrapper;
    }

    /**
     * @return the default converter for the type, or null if values of the type cannot be converted from a string.
     */
    @SuppressWarnings("unchecked")
    public static <T> ArgumentConverter<T> getDefaultConverter(final Class<T> type) {
        final Class<?> wrapped = wrap(type);
        final ArgumentConverter<?> builtIn = BUILT_IN_CONVERTERS.get(wrapped);
        if (builtIn != null) {
            return (ArgumentConverter<T>) builtIn;
        }
        return (ArgumentConverter<T>) RESOLVED.computeIfAbsent(wrapped, ConverterRegistry::resolve).orElse(null);
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private static Optional<ArgumentConverter<?>> resolve(final Class<?> type) {
        if (type.isEnum()) {
            return Optional.of(new EnumConverter(type));
        }
        if (type.isArray() || type.isPrimitive() || type == Object.class) {
            return Optional.empty();
        }
        final ArgumentConverter<?> parseMethod = ParseMethodConverter.find(type);
        if (parseMethod != null) {
            return Optional.of(parseMethod);
        }
        return Optional.ofNullable(ConstructorConverter.find(type));
    }
}
