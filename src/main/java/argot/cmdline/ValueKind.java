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
package argot.cmdline;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Duration;
import java.time.temporal.TemporalAccessor;

/**
 * Coarse classification of an argument's value type, used by usage output and diagnostics.
 */
public enum ValueKind {
    STRING,
    INTEGER,
    FLOAT,
    BOOLEAN,
    DATE_TIME,
    ENUM,
    /** Converted by a parse method, a String constructor or a custom converter. */
    CUSTOM,
    COLLECTION,
    DICTIONARY;

    /** Classifies a scalar element type. */
    public static ValueKind forElementType(final Class<?> type) {
        if (type == String.class || type == Character.class) {
            return STRING;
        }
        if (type == Byte.class || type == Short.class || type == Integer.class || type == Long.class || type == BigInteger.class) {
            return INTEGER;
        }
        if (type == Float.class || type == Double.class || type == BigDecimal.class) {
            return FLOAT;
        }
        if (type == Boolean.class) {
            return BOOLEAN;
        }
        if (TemporalAccessor.class.isAssignableFrom(type) || type == Duration.class) {
            return DATE_TIME;
        }
        if (type.isEnum()) {
            return ENUM;
        }
        return CUSTOM;
    }
}
