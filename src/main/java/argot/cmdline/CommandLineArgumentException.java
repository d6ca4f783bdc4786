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

import argot.ArgotException;

/**
 * Thrown when the command line supplied by the user cannot be parsed. Carries the {@link ErrorCategory} and, where
 * the problem is tied to one argument, that argument's name.
 */
public class CommandLineArgumentException extends ArgotException {
    private final ErrorCategory category;
    private final String argumentName;

    public CommandLineArgumentException(final ErrorCategory category, final String argumentName, final String message) {
        super(message);
        this.category = category;
        this.argumentName = argumentName;
    }

    public CommandLineArgumentException(final ErrorCategory category, final String argumentName, final String message,
                                        final Throwable cause) {
        super(message, cause);
        this.category = category;
        this.argumentName = argumentName;
    }

    public ErrorCategory getCategory() {
        return category;
    }

    /** @return the name of the argument the error applies to, or null if it does not apply to a single argument. */
    public String getArgumentName() {
        return argumentName;
    }
}
