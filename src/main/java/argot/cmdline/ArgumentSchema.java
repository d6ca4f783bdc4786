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
import argot.cmdline.validation.ClassValidator;
import htsjdk.samtools.util.Log;

import java.lang.reflect.Constructor;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * The arguments of an argument class, discovered by reflection. A schema is immutable and may be shared between
 * threads; schemas are cached per class and per the options that affect discovery.
 *
 * Arguments are ordered as: constructor parameters, positional fields by position, the remaining fields in
 * declaration order (superclass fields first), and finally the automatic arguments.
 */
public final class ArgumentSchema {
    private static final Log log = Log.getInstance(ArgumentSchema.class);
    private static final ConcurrentMap<SchemaKey, ArgumentSchema> CACHE = new ConcurrentHashMap<>();

    private final Class<?> type;
    private final ParsingMode mode;
    private final boolean caseSensitive;
    private final Constructor<?> constructor;
    private final List<ArgumentDescriptor> arguments;
    private final List<ArgumentDescriptor> positionalArguments;
    private final NavigableMap<String, ArgumentDescriptor> longNames;
    private final NavigableMap<String, ArgumentDescriptor> shortNames;
    private final List<ClassValidator> classValidators;
    private final String description;

    ArgumentSchema(final Class<?> type,
                   final ParsingMode mode,
                   final boolean caseSensitive,
                   final Constructor<?> constructor,
                   final List<ArgumentDescriptor> arguments,
                   final NavigableMap<String, ArgumentDescriptor> longNames,
                   final NavigableMap<String, ArgumentDescriptor> shortNames,
                   final List<ClassValidator> classValidators,
                   final String description) {
        this.type = type;
        this.mode = mode;
        this.caseSensitive = caseSensitive;
        this.constructor = constructor;
        this.arguments = Collections.unmodifiableList(new ArrayList<>(arguments));
        final List<ArgumentDescriptor> positional = new ArrayList<>();
        for (final ArgumentDescriptor argument : arguments) {
            if (argument.isPositional()) {
                positional.add(argument);
            }
        }
        this.positionalArguments = Collections.unmodifiableList(positional);
        this.longNames = Collections.unmodifiableNavigableMap(longNames);
        this.shortNames = Collections.unmodifiableNavigableMap(shortNames);
        this.classValidators = Collections.unmodifiableList(new ArrayList<>(classValidators));
        this.description = description;
    }

    /**
     * Returns the schema of an argument class, building it on first use.
     *
     * @throws CommandLineParserDefinitionException if the class does not define a valid set of arguments
     */
    public static ArgumentSchema of(final Class<?> type, final ParseOptions options) {
        final SchemaKey key = new SchemaKey(type, options);
        final ArgumentSchema cached = CACHE.get(key);
        if (cached != null) {
            return cached;
        }
        final ArgumentSchema schema = new ArgumentSchemaBuilder(type, options).build();
        final ArgumentSchema existing = CACHE.putIfAbsent(key, schema);
        if (existing != null) {
            return existing;
        }
        log.debug("Built argument schema for ", type.getName(), " with ", schema.arguments.size(), " arguments");
        return schema;
    }

    public Class<?> getType() {
        return type;
    }

    public ParsingMode getMode() {
        return mode;
    }

    public boolean isCaseSensitive() {
        return caseSensitive;
    }

    /** @return the comparator used to match argument names. */
    public Comparator<String> getNameComparator() {
        return nameComparator(caseSensitive);
    }

    static Comparator<String> nameComparator(final boolean caseSensitive) {
        return caseSensitive ? Comparator.<String>naturalOrder() : String.CASE_INSENSITIVE_ORDER;
    }

    Constructor<?> getConstructor() {
        return constructor;
    }

    public List<ArgumentDescriptor> getArguments() {
        return arguments;
    }

    public List<ArgumentDescriptor> getPositionalArguments() {
        return positionalArguments;
    }

    public List<ClassValidator> getClassValidators() {
        return classValidators;
    }

    /** @return the class description from {@link Description}, or an empty string. */
    public String getDescription() {
        return description;
    }

    /**
     * Finds an argument by its name or any alias. A single character that is not a long name is also looked up as a
     * short name.
     *
     * @return the argument, or null
     */
    public ArgumentDescriptor getArgument(final String name) {
        final ArgumentDescriptor argument = longNames.get(name);
        if (argument == null && name.length() == 1) {
            return shortNames.get(name);
        }
        return argument;
    }

    /** @return the argument with this long name or alias, or null. */
    public ArgumentDescriptor getLongArgument(final String name) {
        return longNames.get(name);
    }

    /** @return the argument with this short name or short alias, or null. Always null in default mode. */
    public ArgumentDescriptor getShortArgument(final char name) {
        return shortNames.get(String.valueOf(name));
    }

    /**
     * @return the distinct arguments that have a long name or alias starting with the prefix, in name order
     */
    public List<ArgumentDescriptor> findLongArgumentsByPrefix(final String prefix) {
        if (prefix.isEmpty()) {
            return Collections.emptyList();
        }
        final Set<ArgumentDescriptor> matches = new LinkedHashSet<>();
        for (final Map.Entry<String, ArgumentDescriptor> entry : longNames.tailMap(prefix, true).entrySet()) {
            if (!startsWith(entry.getKey(), prefix)) {
                break;
            }
            matches.add(entry.getValue());
        }
        return new ArrayList<>(matches);
    }

    private boolean startsWith(final String name, final String prefix) {
        return name.regionMatches(!caseSensitive, 0, prefix, 0, prefix.length());
    }

    /** The options that change the outcome of discovery. */
    private static final class SchemaKey {
        private final Class<?> type;
        private final ParsingMode mode;
        private final boolean caseSensitive;
        private final NameTransform nameTransform;
        private final String separators;
        private final boolean autoHelp;
        private final boolean autoVersion;
        private final Map<Class<?>, ArgumentConverter<?>> converters;

        SchemaKey(final Class<?> type, final ParseOptions options) {
            this.type = type;
            this.mode = options.getMode();
            this.caseSensitive = options.isCaseSensitive();
            this.nameTransform = options.getNameTransform();
            this.separators = new String(options.getNameValueSeparators());
            this.autoHelp = options.isAutoHelpArgument();
            this.autoVersion = options.isAutoVersionArgument();
            this.converters = new LinkedHashMap<>(options.getConverters());
        }

        @Override
        public boolean equals(final Object o) {
            if (this == o) return true;
            if (!(o instanceof SchemaKey)) return false;
            final SchemaKey other = (SchemaKey) o;
            return type == other.type && mode == other.mode && caseSensitive == other.caseSensitive &&
                    nameTransform == other.nameTransform && separators.equals(other.separators) &&
                    autoHelp == other.autoHelp && autoVersion == other.autoVersion &&
                    converters.equals(other.converters);
        }

        @Override
        public int hashCode() {
            return Objects.hash(type, mode, caseSensitive, nameTransform, separators, autoHelp, autoVersion, converters);
        }
    }
}
