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

public class NotEmptyValidator implements ArgumentValidator {

    @Override
    public ValidationMode getMode() {
        return ValidationMode.BEFORE_CONVERSION;
    }

    @Override
    public boolean isValid(final ArgumentDescriptor argument, final Object value, final ValidationContext context) {
        return value != null && !value.toString().isEmpty();
    }

    @Override
    public String getErrorMessage(final ArgumentDescriptor argument, final Object value) {
        return "The value for argument '" + argument.getName() + "' may not be empty.";
    }

    @Override
    public String getUsageHelp() {
        return "Must not be empty.";
    }
}
