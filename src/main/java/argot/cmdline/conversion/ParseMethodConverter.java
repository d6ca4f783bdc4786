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

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.Locale;

/**
 * Converts using a public static factory method declared by the target type. The methods looked for, in order, are
 * {@code parse(String, Locale)}, {@code parse(CharSequence, Locale)}, {@code parse(String)},
 * {@code parse(CharSequence)}, {@code valueOf(String)} and {@code fromString(String)}.
 */
public final class ParseMethodConverter<T> implements ArgumentConverter<T> {
    private static final Object[][] CANDIDATES = {
            {"parse", new Class<?>[]{String.class, Locale.class}},
            {"parse", new Class<?>[]{CharSequence.class, Locale.class}},
            {"parse", new Class<?>[]{String.class}},
            {"parse", new Class<?>[]{CharSequence.class}},
            {"valueOf", new Class<?>[]{String.class}},
            {"fromString", new Class<?>[]{String.class}},
    };

    private final Class<T> type;
    private final Method method;

    private ParseMethodConverter(final Class<T> type, final Method method) {
        this.type = type;
        this.method = method;
    }

    /** @return a converter for the type, or null if it declares none of the recognized methods. */
    public static <T> ParseMethodConverter<T> find(final Class<T> type) {
        for (final Object[] candidate : CANDIDATES) {
            final Method method;
            try {
                method = type.getMethod((String) candidate[0], (Class<?>[]) candidate[1]);
            } catch (final NoSuchMethodException e) {
                continue;
            }
            if (Modifier.isStatic(method.getModifiers()) && type.isAssignableFrom(method.getReturnType())) {
                return new ParseMethodConverter<>(type, method);
            }
        }
        return null;
    }

    Method getMethod() {
        return method;
    }

    @Override
    public T convert(final String value, final Locale locale) {
        final Object[] args = method.getParameterCount() == 2 ? new Object[]{value, locale} : new Object[]{value};
        try {
            return type.cast(method.invoke(null, args));
        } catch (final InvocationTargetException e) {
            throw new CommandLineParseException("Problem constructing " + type.getSimpleName() + " from the string '" +
                    value + "': " + e.getCause().getMessage(), e.getCause());
        } catch (final IllegalAccessException e) {
            throw new CommandLineParseException("Cannot call " + method + ".", e);
        }
    }
}
