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

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Converts an enum constant by name. Names are matched case-insensitively unless requested otherwise; numeric values
 * are not accepted.
 */
public class EnumConverter<E extends Enum<E>> implements ArgumentConverter<E> {
    private final Class<E> enumType;
    private final boolean caseSensitive;

    public EnumConverter(final Class<E> enumType) {
        this(enumType, false);
    }

    public EnumConverter(final Class<E> enumType, final boolean caseSensitive) {
        this.enumType = enumType;
        this.caseSensitive = caseSensitive;
    }

    @Override
    public E convert(final String value, final Locale locale) {
        final String trimmed = value.trim();
        for (final E constant : enumType.getEnumConstants()) {
            if (caseSensitive ? constant.name().equals(trimmed) : constant.name().equalsIgnoreCase(trimmed)) {
                return constant;
            }
        }
        throw new CommandLineParseException("'" + value + "' is not a valid value for " + enumType.getSimpleName() +
                ". Possible values: {" + possibleValues(enumType) + "}");
    }

    static String possibleValues(final Class<? extends Enum<?>> enumType) {
        return Arrays.stream(enumType.getEnumConstants()).map(Enum::name).collect(Collectors.joining(", "));
    }
}
