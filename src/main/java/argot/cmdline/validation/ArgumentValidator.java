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

/**
 * Checks the value of a single argument. Validators are attached to an argument with an annotation that is itself
 * annotated with {@link ArgumentValidation}.
 *
 * Validators must not have side effects. They may look at other arguments only through the
 * {@link ValidationContext} they are given.
 */
public interface ArgumentValidator {

    ValidationMode getMode();

    /** Category reported when validation fails. */
    default ErrorCategory getErrorCategory() {
        return ErrorCategory.VALIDATION_FAILED;
    }

    /**
     * @param argument the argument being validated
     * @param value for {@link ValidationMode#BEFORE_CONVERSION} the raw string; for
     *              {@link ValidationMode#AFTER_CONVERSION} one converted value; for
     *              {@link ValidationMode#AFTER_PARSING} the argument's whole value, or null if it has none
     * @param context access to the state of the other arguments
     */
    boolean isValid(ArgumentDescriptor argument, Object value, ValidationContext context);

    String getErrorMessage(ArgumentDescriptor argument, Object value);

    /** @return a sentence describing the constraint for usage output, or null to show nothing. */
    default String getUsageHelp() {
        return null;
    }
}
