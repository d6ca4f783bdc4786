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

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Parse options declared on the argument class. Any value explicitly set on the {@link ParseOptions} passed to the
 * parser takes precedence; when this annotation is present its values take precedence over
 * {@link CommandLineDefaults}.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
@Documented
public @interface ParseOptionsDefaults {
    ParsingMode mode() default ParsingMode.DEFAULT;

    boolean caseSensitive() default false;

    /** Empty means the platform default prefixes. */
    String[] argumentNamePrefixes() default {};

    String longArgumentNamePrefix() default ParseOptions.DEFAULT_LONG_ARGUMENT_NAME_PREFIX;

    char[] nameValueSeparators() default {':', '='};

    boolean allowWhiteSpaceValueSeparator() default true;

    ErrorMode duplicateArguments() default ErrorMode.ERROR;

    NameTransform nameTransform() default NameTransform.NONE;

    boolean autoHelpArgument() default true;

    boolean autoVersionArgument() default true;

    boolean autoPrefixAliases() default true;

    PrefixTerminationMode prefixTermination() default PrefixTerminationMode.NONE;

    boolean negativeNumbersAsValues() default true;
}
