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

import java.util.Locale;

/**
 * Converts the raw string of a command line argument to the argument's type.
 *
 * Implementations must be deterministic for a given value and locale, and must not depend on any other state.
 *
 * @param <T> the type produced by this converter
 */
@FunctionalInterface
public interface ArgumentConverter<T> {

    /**
     * Converts a raw value.
     *
     * @param value the raw value; never null
     * @param locale the locale used for locale-sensitive formats such as decimal separators and dates
     * @return the converted value
     * @throws argot.cmdline.CommandLineParseException if the value cannot be converted
     */
    T convert(String value, Locale locale);
}
