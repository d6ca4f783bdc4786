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

import argot.cmdline.conversion.ArgumentConverter;

import java.io.PrintStream;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Options that control how command lines are parsed. Every option is optional; an option that is not set falls back
 * to the {@link ParseOptionsDefaults} annotation of the argument class, if present, and then to
 * {@link CommandLineDefaults} or a fixed default.
 *
 * A ParseOptions is not thread safe while it is being configured. The parser works on its own resolved copy, so one
 * instance may be reused for several parsers.
 */
public class ParseOptions {
    public static final String DEFAULT_LONG_ARGUMENT_NAME_PREFIX = "--";

    private ParsingMode mode;
    private Boolean caseSensitive;
    private List<String> argumentNamePrefixes;
    private String longArgumentNamePrefix;
    private char[] nameValueSeparators;
    private Boolean allowWhiteSpaceValueSeparator;
    private ErrorMode duplicateArguments;
    private Locale locale;
    private NameTransform nameTransform;
    private Boolean autoHelpArgument;
    private Boolean autoVersionArgument;
    private Boolean autoPrefixAliases;
    private PrefixTerminationMode prefixTermination;
    private Boolean negativeNumbersAsValues;
    private MessageProvider messageProvider;
    private PrintStream out;
    private PrintStream error;
    private Integer usageLineWidth;
    private String programName;
    private final Map<Class<?>, ArgumentConverter<?>> converters = new LinkedHashMap<>();

    public ParseOptions() {
    }

    protected ParseOptions(final ParseOptions other) {
        this.mode = other.mode;
        this.caseSensitive = other.caseSensitive;
        this.argumentNamePrefixes = other.argumentNamePrefixes;
        this.longArgumentNamePrefix = other.longArgumentNamePrefix;
        this.nameValueSeparators = other.nameValueSeparators;
        this.allowWhiteSpaceValueSeparator = other.allowWhiteSpaceValueSeparator;
        this.duplicateArguments = other.duplicateArguments;
        this.locale = other.locale;
        this.nameTransform = other.nameTransform;
        this.autoHelpArgument = other.autoHelpArgument;
        this.autoVersionArgument = other.autoVersionArgument;
        this.autoPrefixAliases = other.autoPrefixAliases;
        this.prefixTermination = other.prefixTermination;
        this.negativeNumbersAsValues = other.negativeNumbersAsValues;
        this.messageProvider = other.messageProvider;
        this.out = other.out;
        this.error = other.error;
        this.usageLineWidth = other.usageLineWidth;
        this.programName = other.programName;
        this.converters.putAll(other.converters);
    }

    /** @return a copy of these options. Subclasses override this to keep their own settings. */
    protected ParseOptions copy() {
        return new ParseOptions(this);
    }

    /**
     * Returns a copy of these options in which every option not set explicitly is filled in from the
     * {@link ParseOptionsDefaults} annotation of the given type, if it has one.
     */
    public ParseOptions forType(final Class<?> type) {
        final ParseOptions resolved = copy();
        final ParseOptionsDefaults defaults = type.getAnnotation(ParseOptionsDefaults.class);
        if (defaults == null) {
            return resolved;
        }
        if (resolved.mode == null) resolved.mode = defaults.mode();
        if (resolved.caseSensitive == null) resolved.caseSensitive = defaults.caseSensitive();
        if (resolved.argumentNamePrefixes == null && defaults.argumentNamePrefixes().length > 0) {
            resolved.argumentNamePrefixes = Collections.unmodifiableList(Arrays.asList(defaults.argumentNamePrefixes().clone()));
        }
        if (resolved.longArgumentNamePrefix == null) resolved.longArgumentNamePrefix = defaults.longArgumentNamePrefix();
        if (resolved.nameValueSeparators == null) resolved.nameValueSeparators = defaults.nameValueSeparators().clone();
        if (resolved.allowWhiteSpaceValueSeparator == null) {
            resolved.allowWhiteSpaceValueSeparator = defaults.allowWhiteSpaceValueSeparator();
        }
        if (resolved.duplicateArguments == null) resolved.duplicateArguments = defaults.duplicateArguments();
        if (resolved.nameTransform == null) resolved.nameTransform = defaults.nameTransform();
        if (resolved.autoHelpArgument == null) resolved.autoHelpArgument = defaults.autoHelpArgument();
        if (resolved.autoVersionArgument == null) resolved.autoVersionArgument = defaults.autoVersionArgument();
        if (resolved.autoPrefixAliases == null) resolved.autoPrefixAliases = defaults.autoPrefixAliases();
        if (resolved.prefixTermination == null) resolved.prefixTermination = defaults.prefixTermination();
        if (resolved.negativeNumbersAsValues == null) resolved.negativeNumbersAsValues = defaults.negativeNumbersAsValues();
        return resolved;
    }

    /** @return {@code -} and {@code /} on Windows, otherwise only {@code -}. */
    public static List<String> getDefaultArgumentNamePrefixes() {
        final String os = System.getProperty("os.name", "");
        if (os.startsWith("Windows")) {
            return Collections.unmodifiableList(Arrays.asList("-", "/"));
        }
        return Collections.singletonList("-");
    }

    public ParsingMode getMode() {
        return mode != null ? mode : CommandLineDefaults.PARSING_MODE;
    }

    public ParseOptions setMode(final ParsingMode mode) {
        this.mode = mode;
        return this;
    }

    public boolean isCaseSensitive() {
        return caseSensitive != null ? caseSensitive : CommandLineDefaults.CASE_SENSITIVE;
    }

    public ParseOptions setCaseSensitive(final boolean caseSensitive) {
        this.caseSensitive = caseSensitive;
        return this;
    }

    /** Prefixes of argument names in default mode, and of short names in long/short mode. */
    public List<String> getArgumentNamePrefixes() {
        return argumentNamePrefixes != null ? argumentNamePrefixes : getDefaultArgumentNamePrefixes();
    }

    public ParseOptions setArgumentNamePrefixes(final String... prefixes) {
        if (prefixes.length == 0) {
            throw new IllegalArgumentException("At least one argument name prefix is required");
        }
        for (final String prefix : prefixes) {
            if (prefix == null || prefix.isEmpty()) {
                throw new IllegalArgumentException("Argument name prefixes may not be empty");
            }
        }
        this.argumentNamePrefixes = Collections.unmodifiableList(Arrays.asList(prefixes.clone()));
        return this;
    }

    /** Prefix of long names in long/short mode. Also the prefix termination token in both modes. */
    public String getLongArgumentNamePrefix() {
        return longArgumentNamePrefix != null ? longArgumentNamePrefix : DEFAULT_LONG_ARGUMENT_NAME_PREFIX;
    }

    public ParseOptions setLongArgumentNamePrefix(final String prefix) {
        if (prefix == null || prefix.isEmpty()) {
            throw new IllegalArgumentException("The long argument name prefix may not be empty");
        }
        this.longArgumentNamePrefix = prefix;
        return this;
    }

    public char[] getNameValueSeparators() {
        return nameValueSeparators != null ? nameValueSeparators.clone() : new char[]{':', '='};
    }

    public ParseOptions setNameValueSeparators(final char... separators) {
        if (separators.length == 0) {
            throw new IllegalArgumentException("At least one name/value separator is required");
        }
        this.nameValueSeparators = separators.clone();
        return this;
    }

    /** Whether {@code -name value} is accepted in addition to {@code -name:value}. */
    public boolean isAllowWhiteSpaceValueSeparator() {
        return allowWhiteSpaceValueSeparator != null ? allowWhiteSpaceValueSeparator : true;
    }

    public ParseOptions setAllowWhiteSpaceValueSeparator(final boolean allow) {
        this.allowWhiteSpaceValueSeparator = allow;
        return this;
    }

    public ErrorMode getDuplicateArguments() {
        return duplicateArguments != null ? duplicateArguments : CommandLineDefaults.DUPLICATE_ARGUMENTS;
    }

    public ParseOptions setDuplicateArguments(final ErrorMode duplicateArguments) {
        this.duplicateArguments = duplicateArguments;
        return this;
    }

    /** Shorthand for {@link ErrorMode#ALLOW} or {@link ErrorMode#ERROR}. */
    public ParseOptions setAllowDuplicateArguments(final boolean allow) {
        return setDuplicateArguments(allow ? ErrorMode.ALLOW : ErrorMode.ERROR);
    }

    public boolean isAllowDuplicateArguments() {
        return getDuplicateArguments() != ErrorMode.ERROR;
    }

    /** Locale used to convert values. Defaults to {@link Locale#ROOT} so that parsing does not depend on the host. */
    public Locale getLocale() {
        return locale != null ? locale : Locale.ROOT;
    }

    public ParseOptions setLocale(final Locale locale) {
        this.locale = locale;
        return this;
    }

    public NameTransform getNameTransform() {
        return nameTransform != null ? nameTransform : CommandLineDefaults.NAME_TRANSFORM;
    }

    public ParseOptions setNameTransform(final NameTransform nameTransform) {
        this.nameTransform = nameTransform;
        return this;
    }

    public boolean isAutoHelpArgument() {
        return autoHelpArgument != null ? autoHelpArgument : true;
    }

    public ParseOptions setAutoHelpArgument(final boolean autoHelpArgument) {
        this.autoHelpArgument = autoHelpArgument;
        return this;
    }

    public boolean isAutoVersionArgument() {
        return autoVersionArgument != null ? autoVersionArgument : true;
    }

    public ParseOptions setAutoVersionArgument(final boolean autoVersionArgument) {
        this.autoVersionArgument = autoVersionArgument;
        return this;
    }

    /** Whether an unambiguous prefix of a long name or alias may be used in place of the full name. */
    public boolean isAutoPrefixAliases() {
        return autoPrefixAliases != null ? autoPrefixAliases : CommandLineDefaults.AUTO_PREFIX_ALIASES;
    }

    public ParseOptions setAutoPrefixAliases(final boolean autoPrefixAliases) {
        this.autoPrefixAliases = autoPrefixAliases;
        return this;
    }

    public PrefixTerminationMode getPrefixTermination() {
        return prefixTermination != null ? prefixTermination : PrefixTerminationMode.NONE;
    }

    public ParseOptions setPrefixTermination(final PrefixTerminationMode prefixTermination) {
        this.prefixTermination = prefixTermination;
        return this;
    }

    /**
     * If true, a token such as {@code -5} is always a value. If false, it is an argument name when an argument of
     * that name exists, and a value otherwise.
     */
    public boolean isNegativeNumbersAsValues() {
        return negativeNumbersAsValues != null ? negativeNumbersAsValues : true;
    }

    public ParseOptions setNegativeNumbersAsValues(final boolean negativeNumbersAsValues) {
        this.negativeNumbersAsValues = negativeNumbersAsValues;
        return this;
    }

    public MessageProvider getMessageProvider() {
        return messageProvider != null ? messageProvider : MessageProvider.DEFAULT;
    }

    public ParseOptions setMessageProvider(final MessageProvider messageProvider) {
        this.messageProvider = messageProvider;
        return this;
    }

    /** Stream for usage and version output. */
    public PrintStream getOut() {
        return out != null ? out : System.out;
    }

    public ParseOptions setOut(final PrintStream out) {
        this.out = out;
        return this;
    }

    /** Stream for error messages. */
    public PrintStream getError() {
        return error != null ? error : System.err;
    }

    public ParseOptions setError(final PrintStream error) {
        this.error = error;
        return this;
    }

    public int getUsageLineWidth() {
        return usageLineWidth != null ? usageLineWidth : CommandLineDefaults.USAGE_LINE_WIDTH;
    }

    public ParseOptions setUsageLineWidth(final int usageLineWidth) {
        this.usageLineWidth = usageLineWidth;
        return this;
    }

    /** Name shown in usage and version output. Null means the simple name of the argument class. */
    public String getProgramName() {
        return programName;
    }

    public ParseOptions setProgramName(final String programName) {
        this.programName = programName;
        return this;
    }

    /** Registers a converter used for every argument of the given type that has no converter of its own. */
    public <T> ParseOptions registerConverter(final Class<T> type, final ArgumentConverter<? extends T> converter) {
        converters.put(type, converter);
        return this;
    }

    public Map<Class<?>, ArgumentConverter<?>> getConverters() {
        return Collections.unmodifiableMap(converters);
    }
}
