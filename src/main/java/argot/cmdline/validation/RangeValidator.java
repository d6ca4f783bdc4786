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
package argot.cmdline.validation;

import argot.cmdline.ArgumentDescriptor;
import argot.cmdline.CommandLineParserDefinitionException;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Applies to numeric arguments. A null value passes; use {@link ValidateNotNull} to reject it.
 */
public class RangeValidator implements ArgumentValidator {
    private final double min;
    private final double max;

    public RangeValidator(final ValidateRange annotation) {
        if (annotation.min() > annotation.max()) {
            throw new CommandLineParserDefinitionException("Range minimum " + annotation.min() + " is greater than maximum " + annotation.max());
        }
        this.min = annotation.min();
        this.max = annotation.max();
    }

    @Override
    public ValidationMode getMode() {
        return ValidationMode.AFTER_CONVERSION;
    }

    @Override
    public boolean isValid(final ArgumentDescriptor argument, final Object value, final ValidationContext context) {
        if (value == null) {
            return true;
        }
        if (!(value instanceof Number)) {
            return false;
        }
        final Number number = (Number) value;
        if (number instanceof Double || number instanceof Float) {
            final double d = number.doubleValue();
            if (Double.isNaN(d)) {
                return false;
            }
            if (Double.isInfinite(d)) {
                return d >= min && d <= max;
            }
        }
        final BigDecimal exact = toBigDecimal(number);
        return (Double.isInfinite(min) || exact.compareTo(new BigDecimal(min)) >= 0)
                && (Double.isInfinite(max) || exact.compareTo(new BigDecimal(max)) <= 0);
    }

    /** Converts without rounding, so that large longs and big numbers compare exactly against the bounds. */
    private static BigDecimal toBigDecimal(final Number number) {
        if (number instanceof BigDecimal) {
            return (BigDecimal) number;
        }
        if (number instanceof BigInteger) {
            return new BigDecimal((BigInteger) number);
        }
        if (number instanceof Double || number instanceof Float) {
            return new BigDecimal(number.doubleValue());
        }
        return BigDecimal.valueOf(number.longValue());
    }

    @Override
    public String getErrorMessage(final ArgumentDescriptor argument, final Object value) {
        return "The value for argument '" + argument.getName() + "' " + describe() + ".";
    }

    @Override
    public String getUsageHelp() {
        final String description = describe();
        return Character.toUpperCase(description.charAt(0)) + description.substring(1) + ".";
    }

    private String describe() {
        if (Double.isInfinite(min)) {
            return "must be at most " + format(max);
        }
        if (Double.isInfinite(max)) {
            return "must be at least " + format(min);
        }
        return "must be between " + format(min) + " and " + format(max);
    }

    private static String format(final double d) {
        if (d == Math.rint(d) && Math.abs(d) < 1e15) {
            return Long.toString((long) d);
        }
        return Double.toString(d);
    }
}
