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

import argot.cmdline.CommandLineParserDefinitionException;
import argot.cmdline.ErrorCategory;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

public class RequiresAnyValidator implements ClassValidator, DependencyValidator {
    private final List<String> argumentNames;

    public RequiresAnyValidator(final RequiresAny annotation) {
        if (annotation.value().length == 0) {
            throw new CommandLineParserDefinitionException("@RequiresAny needs at least one argument name");
        }
        this.argumentNames = Collections.unmodifiableList(Arrays.asList(annotation.value()));
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
    public boolean isValid(final ValidationContext context) {
        for (final String name : argumentNames) {
            if (context.hasValue(name)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String getErrorMessage() {
        return "At least one of the arguments " + RequiresValidator.quote(argumentNames) + " must be supplied.";
    }

    @Override
    public String getUsageHelp() {
        return "You must use at least one of " + RequiresValidator.quote(argumentNames) + ".";
    }
}
