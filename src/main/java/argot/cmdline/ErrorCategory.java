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

/**
 * The kind of problem reported by a {@link CommandLineArgumentException}.
 */
public enum ErrorCategory {
    UNSPECIFIED,
    /** A named token does not match any argument name, alias or unambiguous prefix. */
    UNKNOWN_ARGUMENT,
    /** The command name does not match any registered command. */
    UNKNOWN_COMMAND,
    /** A named argument that is not a switch was given without a value. */
    MISSING_NAMED_ARGUMENT_VALUE,
    DUPLICATE_ARGUMENT,
    /** More positional values were supplied than there are positional arguments. */
    TOO_MANY_ARGUMENTS,
    MISSING_REQUIRED_ARGUMENT,
    ARGUMENT_VALUE_CONVERSION,
    VALIDATION_FAILED,
    /** A requires/prohibits/requires-any rule between arguments was violated. */
    DEPENDENCY_FAILED,
    /** A group of combined short names contained an argument that is not a switch. */
    COMBINED_SHORT_NAME_NON_SWITCH,
    /** A dictionary argument received the same key twice. */
    INVALID_DICTIONARY_VALUE,
    /** A converter produced null for an argument that does not accept null. */
    NULL_ARGUMENT_VALUE,
    /** The constructor of the argument class threw. */
    CREATE_ARGUMENTS_TYPE_ERROR,
    /** A parsed value could not be assigned to its field. */
    APPLY_VALUE_ERROR
}
