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
import argot.util.PropertyUtils;

import java.util.Locale;
import java.util.Properties;

/**
 * Embodies defaults for global values that affect how command lines are parsed. Defaults are encoded in the class
 * and are also overridable using system properties, or entries in an {@code argot/argotCmdLine.properties} file on
 * the classpath. System properties take precedence.
 *
 * These only apply to options that are set neither on {@link ParseOptions} nor by a {@link ParseOptionsDefaults}
 * annotation.
 */
public class CommandLineDefaults {
    private static final String PROPERTY_PREFIX = "argot.cmdline.";
    static final String PROPERTIES_FILE = "argot/argotCmdLine.properties";

    private static final Properties FILE_PROPERTIES = PropertyUtils.loadPropertiesFile(PROPERTIES_FILE, CommandLineDefaults.class);

    /** Parsing mode. */
    public static final ParsingMode PARSING_MODE;

    /** Whether argument names are matched case sensitively. */
    public static final boolean CASE_SENSITIVE;

    /** What to do when a single-value argument is supplied twice. */
    public static final ErrorMode DUPLICATE_ARGUMENTS;

    /** Whether an unambiguous prefix of a long argument name is accepted. */
    public static final boolean AUTO_PREFIX_ALIASES;

    /** Transformation applied to member names that have no explicit argument name. */
    public static final NameTransform NAME_TRANSFORM;

    /** Maximum line length of usage output. */
    public static final int USAGE_LINE_WIDTH;

    static {
        PARSING_MODE = getEnumProperty("parsing_mode", ParsingMode.class, ParsingMode.DEFAULT);
        CASE_SENSITIVE = getBooleanProperty("case_sensitive", false);
        DUPLICATE_ARGUMENTS = getEnumProperty("duplicate_arguments", ErrorMode.class, ErrorMode.ERROR);
        AUTO_PREFIX_ALIASES = getBooleanProperty("auto_prefix_aliases", true);
        NAME_TRANSFORM = getEnumProperty("name_transform", NameTransform.class, NameTransform.NONE);
        USAGE_LINE_WIDTH = getIntProperty("usage_line_width", 100);
    }

    /** Gets a string property, prefixed with "argot.cmdline." using the default if the property does not exist. */
    private static String getStringProperty(final String name, final String def) {
        return PropertyUtils.getProperty(PROPERTY_PREFIX + name, FILE_PROPERTIES, def);
    }

    /** Gets a boolean property, prefixed with "argot.cmdline." using the default if the property does not exist. */
    private static boolean getBooleanProperty(final String name, final boolean def) {
        final String value = getStringProperty(name, Boolean.toString(def));
        return Boolean.parseBoolean(value.trim());
    }

    /** Gets an int property, prefixed with "argot.cmdline." using the default if the property does not exist. */
    private static int getIntProperty(final String name, final int def) {
        final String value = getStringProperty(name, Integer.toString(def));
        try {
            return Integer.parseInt(value.trim());
        } catch (final NumberFormatException e) {
            throw new ArgotException("Invalid integer value for property " + PROPERTY_PREFIX + name + ": " + value, e);
        }
    }

    /** Gets an enum property, prefixed with "argot.cmdline." using the default if the property does not exist. */
    private static <E extends Enum<E>> E getEnumProperty(final String name, final Class<E> enumClass, final E def) {
        final String value = getStringProperty(name, def.name());
        try {
            return Enum.valueOf(enumClass, value.trim().toUpperCase(Locale.ROOT));
        } catch (final IllegalArgumentException e) {
            throw new ArgotException("Invalid value for property " + PROPERTY_PREFIX + name + ": " + value, e);
        }
    }
}
