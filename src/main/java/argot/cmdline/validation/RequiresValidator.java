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
import argot.cmdline.ErrorCategory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

public class RequiresValidator implements ArgumentValidator, DependencyValidator {
    private final List<String> argumentNames;

    public RequiresValidator(final Requires annotation) {
        this.argumentNames = Collections.unmodifiableList(Arrays.asList(annotation.value()));
    }

    @Override
    public ValidationMode getMode() {
        return ValidationMode.AFTER_PARSING;
    }

    @Override
    public ErrorCategory getErrorCategory() {
        return ErrorCategory.DEPENDENCY_FAILED;
    }

    @Override
    public List<String> getArgumentNames() {
        return argumentNames;
    }

    @Override
    public boolean isValid(final ArgumentDescriptor argument, final Object value, final ValidationContext context) {
        if (!context.hasValue(argument.getName())) {
            return true;
        }
        for (final String name : argumentNames) {
            if (!context.hasValue(name)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String getErrorMessage(final ArgumentDescriptor argument, final Object value) {
        return "Argument '" + argument.getName() + "' must be used together with " + quote(argumentNames) + ".";
    }

    @Override
    public String getUsageHelp() {
        return "Must be used together with " + quote(argumentNames) + ".";
    }

    static String quote(final List<String> names) {
        final List<String> quoted = new ArrayList<>(names.size());
        for (final String name : names) {
            quoted.add("'" + name + "'");
        }
        return String.join(", ", quoted);
    }
}
