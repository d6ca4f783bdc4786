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

import java.math.BigDecimal;
import java.math.BigInteger;
import java.text.DecimalFormatSymbols;
import java.util.Locale;
import java.util.function.Function;

/**
 * Converts numbers written with the decimal separator, grouping separator and minus sign of the given locale.
 */
public final class NumberConverter<T extends Number> implements ArgumentConverter<T> {
    public static final NumberConverter<Byte> BYTE = new NumberConverter<>(Byte.class, Byte::valueOf);
    public static final NumberConverter<Short> SHORT = new NumberConverter<>(Short.class, Short::valueOf);
    public static final NumberConverter<Integer> INTEGER = new NumberConverter<>(Integer.class, Integer::valueOf);
    public static final NumberConverter<Long> LONG = new NumberConverter<>(Long.class, Long::valueOf);
    public static final NumberConverter<BigInteger> BIG_INTEGER = new NumberConverter<>(BigInteger.class, BigInteger::new);
    public static final NumberConverter<Float> FLOAT = new NumberConverter<>(Float.class, Float::valueOf);
    public static final NumberConverter<Double> DOUBLE = new NumberConverter<>(Double.class, Double::valueOf);
    public static final NumberConverter<BigDecimal> BIG_DECIMAL = new NumberConverter<>(BigDecimal.class, BigDecimal::new);

    private final Class<T> type;
    private final Function<String, T> parser;

    private NumberConverter(final Class<T> type, final Function<String, T> parser) {
        this.type = type;
        this.parser = parser;
    }

    public Class<T> getType() {
        return type;
    }

    @Override
    public T convert(final String value, final Locale locale) {
        final String normalized = normalize(value, locale);
        if (normalized == null) {
            throw new CommandLineParseException("'" + value + "' is not a valid " + type.getSimpleName() +
                    ": digit grouping separators are only allowed between groups of three digits.");
        }
        if (normalized.isEmpty()) {
            throw new CommandLineParseException("An empty value is not a valid " + type.getSimpleName() + ".");
        }
        try {
            return parser.apply(normalized);
        } catch (final NumberFormatException e) {
            throw new CommandLineParseException("'" + value + "' is not a valid " + type.getSimpleName() + ".", e);
        }
    }

    /**
     * Rewrites a locale-formatted number in the form the {@code valueOf} methods accept: grouping separators are
     * dropped, and the locale's decimal separator and minus sign become {@code .} and {@code -}. Grouping separators
     * may only appear in the integer part, between groups of three digits.
     *
     * @return the rewritten number, or null if a grouping separator is misplaced
     */
    static String normalize(final String value, final Locale locale) {
        final DecimalFormatSymbols symbols = DecimalFormatSymbols.getInstance(locale);
        final char grouping = symbols.getGroupingSeparator();
        final char decimal = symbols.getDecimalSeparator();
        final char minus = symbols.getMinusSign();
        final String trimmed = value.trim();
        final StringBuilder sb = new StringBuilder(trimmed.length());

        int i = 0;
        if (i < trimmed.length() && (trimmed.charAt(i) == minus || trimmed.charAt(i) == '-' || trimmed.charAt(i) == '+')) {
            sb.append(trimmed.charAt(i) == '+' ? '+' : '-');
            ++i;
        }

        // integer part: the first group has one to three digits, every later group exactly three
        int digitsInGroup = 0;
        boolean grouped = false;
        for (; i < trimmed.length(); ++i) {
            final char ch = trimmed.charAt(i);
            if (ch == grouping) {
                if (digitsInGroup == 0 || digitsInGroup > 3 || (grouped && digitsInGroup != 3)) {
                    return null;
                }
                grouped = true;
                digitsInGroup = 0;
            } else if (Character.isDigit(ch)) {
                sb.append(ch);
                ++digitsInGroup;
            } else {
                break;
            }
        }
        if (grouped && digitsInGroup != 3) {
            return null;
        }

        for (; i < trimmed.length(); ++i) {
            final char ch = trimmed.charAt(i);
            if (ch == grouping) {
                return null;
            }
            if (ch == decimal) {
                sb.append('.');
            } else if (ch == minus) {
                sb.append('-');
            } else {
                sb.append(ch);
            }
        }
        return sb.toString();
    }
}
