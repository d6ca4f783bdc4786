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

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Modifier;
import java.util.Locale;

/**
 * Converts by calling a public constructor of the target type that takes a single String.
 */
public final class ConstructorConverter<T> implements ArgumentConverter<T> {
    private final Class<T> type;
    private final Constructor<T> ctor;

    private ConstructorConverter(final Class<T> type, final Constructor<T> ctor) {
        this.type = type;
        this.ctor = ctor;
    }

    /** @return a converter for the type, or null if the type is abstract or has no public String constructor. */
    public static <T> ConstructorConverter<T> find(final Class<T> type) {
        if (type.isInterface() || Modifier.isAbstract(type.getModifiers())) {
            return null;
        }
        try {
            return new ConstructorConverter<>(type, type.getConstructor(String.class));
        } catch (final NoSuchMethodException e) {
            return null;
        }
    }

    @Override
    public T convert(final String value, final Locale locale) {
        try {
            return ctor.newInstance(value);
        } catch (final InvocationTargetException e) {
            throw new CommandLineParseException("Problem constructing " + type.getSimpleName() + " from the string '" +
                    value + "': " + e.getCause().getMessage(), e.getCause());
        } catch (final InstantiationException | IllegalAccessException e) {
            throw new CommandLineParseException("Cannot construct " + type.getSimpleName() + ".", e);
        }
    }
}
