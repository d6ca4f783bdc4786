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
 * Used to annotate which fields of an argument class are command line arguments. Constructor parameters of the
 * command line constructor are always positional, required arguments; the annotation may be used on them to
 * override the name or add documentation.
 *
 * A field of array, {@link java.util.Collection} or {@link java.util.Map} type is a multi-value argument. A
 * {@code boolean} or {@link Boolean} field is a switch, which does not need an explicit value.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.FIELD, ElementType.PARAMETER})
@Documented
public @interface Argument {
    /** Sentinel for {@link #defaultValue()} meaning there is no default value. */
    String NO_DEFAULT_VALUE = "\u0000";

    /**
     * The name of the argument. If not specified, the field or parameter name is used, transformed by
     * {@link ParseOptions#getNameTransform()}.
     */
    String name() default "";

    /**
     * Short name, only used in {@link ParsingMode#LONG_SHORT} mode. In default mode a short name acts as an
     * alias. Setting it implies {@link #isShort()}.
     */
    char shortName() default '\0';

    /** If true, and no {@link #shortName()} is given, the first character of the name is the short name. */
    boolean isShort() default false;

    /** If false, the argument has only a short name. Only valid in {@link ParsingMode#LONG_SHORT} mode. */
    boolean isLong() default true;

    /**
     * Relative position of a positional argument. Positions need not be consecutive; only their order matters.
     * Negative means the argument can only be given by name.
     */
    int position() default -1;

    boolean required() default false;

    /**
     * Default value, converted with the argument's converter using {@link java.util.Locale#ROOT}. If not set, the
     * field keeps its initial value when the argument is not supplied.
     */
    String defaultValue() default NO_DEFAULT_VALUE;

    String doc() default "";

    /** Short description of the value, used in usage output, e.g. {@code <number>}. */
    String valueDescription() default "";

    /** Whether matching this argument stops parsing. */
    CancelMode cancelParsing() default CancelMode.NONE;

    /** Hidden arguments are accepted but left out of usage output. */
    boolean hidden() default false;
}
