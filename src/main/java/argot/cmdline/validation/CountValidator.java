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

import java.util.Collection;
import java.util.Map;

public class CountValidator implements ArgumentValidator {
    private final int min;
    private final int max;

    public CountValidator(final ValidateCount annotation) {
        if (annotation.min() < 0 || annotation.min() > annotation.max()) {
            throw new CommandLineParserDefinitionException("Invalid count range " + annotation.min() + ".." + annotation.max());
        }
        this.min = annotation.min();
        this.max = annotation.max();
    }

    @Override
    public ValidationMode getMode() {
        return ValidationMode.AFTER_PARSING;
    }

    @Override
    public boolean isValid(final ArgumentDescriptor argument, final Object value, final ValidationContext context) {
        final int count = count(value);
        return count >= min && count <= max;
    }

    static int count(final Object value) {
        if (value == null) {
            return 0;
        }
        if (value instanceof Collection) {
            return ((Collection<?>) value).size();
        }
        if (value instanceof Map) {
            return ((Map<?, ?>) value).size();
        }
        return 1;
    }

    @Override
    public String getErrorMessage(final ArgumentDescriptor argument, final Object value) {
        return "Argument '" + argument.getName() + "' " + describe() + "; it was given " + count(value) + ".";
    }

    @Override
    public String getUsageHelp() {
        final String description = describe();
        return Character.toUpperCase(description.charAt(0)) + description.substring(1) + ".";
    }

    private String describe() {
        if (min == 0) {
            return max == Integer.MAX_VALUE ? "may be specified 0 or more times" : "must be specified no more than " + max + " times";
        }
        if (max == Integer.MAX_VALUE) {
            return "must be specified at least " + min + " times";
        }
        return "may be specified between " + min + " and " + max + " times";
    }
}
