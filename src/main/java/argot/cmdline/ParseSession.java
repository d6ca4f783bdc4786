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
import argot.cmdline.validation.ArgumentValidator;
import argot.cmdline.validation.ClassValidator;
import argot.cmdline.validation.ValidationContext;
import argot.cmdline.validation.ValidationMode;
import htsjdk.samtools.util.Log;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * One parse of one command line against a schema. A session is used once and is not thread safe; the schema it
 * reads is shared.
 */
final class ParseSession<T> implements ArgumentTokenizer.Binder, ValidationContext {
    private static final Log log = Log.getInstance(ParseSession.class);

    enum State {
        INITIAL,
        TOKENIZING,
        END_OF_STREAM_CHECKS,
        AFTER_PARSING_VALIDATION,
        COMPLETE,
        FAILED,
        CANCELLED
    }

    private final ArgumentSchema schema;
    private final ParseOptions options;
    private final Class<T> type;
    private final MessageProvider messages;
    private final Locale locale;
    private final Map<ArgumentDescriptor, ArgumentState> states = new LinkedHashMap<>();
    private State state = State.INITIAL;

    ParseSession(final ArgumentSchema schema, final ParseOptions options, final Class<T> type) {
        this.schema = schema;
        this.options = options;
        this.type = type;
        this.messages = options.getMessageProvider();
        this.locale = options.getLocale();
        for (final ArgumentDescriptor argument : schema.getArguments()) {
            states.put(argument, new ArgumentState(argument));
        }
    }

    State getState() {
        return state;
    }

    ParseResult<T> run(final String[] args, final int index) {
        if (state != State.INITIAL) {
            throw new IllegalStateException("A parse session can only be run once");
        }
        if (index < 0 || index > args.length) {
            throw new IndexOutOfBoundsException("Start index " + index + " is outside the " + args.length + " arguments");
        }
        try {
            state = State.TOKENIZING;
            final ArgumentTokenizer.Outcome outcome = new ArgumentTokenizer(schema, options).tokenize(args, index, this);
            final List<String> remaining = Collections.unmodifiableList(
                    new ArrayList<>(Arrays.asList(args).subList(outcome.getNextIndex(), args.length)));
            final ArgumentDescriptor cancelledBy = outcome.getCancelledBy();
            final String cancelledName = cancelledBy == null ? null : cancelledBy.getName();

            if (outcome.getCancelMode() == CancelMode.ABORT) {
                state = State.CANCELLED;
                final boolean helpRequested = cancelledBy == null || cancelledBy.getKind() != ArgumentKind.AUTOMATIC_VERSION;
                return ParseResult.canceled(cancelledBy, remaining, helpRequested, suppliedNames());
            }
            if (outcome.getCancelMode() == CancelMode.SUCCESS) {
                // Required arguments and after-parsing validation are skipped when parsing stops early.
                final T instance = createInstance();
                state = State.CANCELLED;
                return ParseResult.success(instance, cancelledName, remaining, suppliedNames());
            }

            state = State.END_OF_STREAM_CHECKS;
            checkRequiredArguments();

            state = State.AFTER_PARSING_VALIDATION;
            runAfterParsingValidators();

            final T instance = createInstance();
            state = State.COMPLETE;
            return ParseResult.success(instance, null, Collections.<String>emptyList(), suppliedNames());
        } catch (final CommandLineArgumentException e) {
            state = State.FAILED;
            return ParseResult.error(e);
        }
    }

    @Override
    public boolean hasValue(final ArgumentDescriptor argument) {
        return states.get(argument).hasValue();
    }

    @Override
    public CancelMode bind(final ArgumentDescriptor argument, final String usedName, final String rawValue) {
        final ArgumentState argumentState = states.get(argument);
        if (argumentState.hasValue() && !argument.isMultiValue()) {
            switch (options.getDuplicateArguments()) {
                case ERROR:
                    throw new CommandLineArgumentException(ErrorCategory.DUPLICATE_ARGUMENT, argument.getName(),
                            messages.duplicateArgument(argument.getName()));
                case WARNING:
                    log.warn(messages.duplicateArgumentWarning(argument.getName()));
                    break;
                case ALLOW:
                    break;
                default:
                    throw new IllegalStateException("Unexpected duplicate argument mode " + options.getDuplicateArguments());
            }
        }

        if (argument.isMultiValue()) {
            final String separator = argument.getMultiValueSeparator();
            final String[] pieces = separator == null ? new String[]{rawValue} : rawValue.split(Pattern.quote(separator), -1);
            for (final String piece : pieces) {
                final Object value = convertAndValidate(argument, piece);
                if (argument.isDictionary()) {
                    final Map.Entry<?, ?> entry = (Map.Entry<?, ?>) value;
                    if (argumentState.containsKey(entry.getKey()) && !argument.isAllowDuplicateDictionaryKeys()) {
                        throw new CommandLineArgumentException(ErrorCategory.INVALID_DICTIONARY_VALUE, argument.getName(),
                                messages.duplicateDictionaryKey(argument.getName(), entry.getKey()));
                    }
                    argumentState.putEntry(entry);
                } else {
                    argumentState.addValue(value);
                }
            }
            argumentState.markSupplied(usedName, rawValue);
            return argument.getCancelMode();
        }

        final Object value = convertAndValidate(argument, rawValue);
        argumentState.setValue(value);
        argumentState.markSupplied(usedName, rawValue);
        if (argument.isSwitch() && !Boolean.TRUE.equals(value)) {
            // -help:false does not cancel
            return CancelMode.NONE;
        }
        return argument.getCancelMode();
    }

    private Object convertAndValidate(final ArgumentDescriptor argument, final String raw) {
        runValidators(argument, ValidationMode.BEFORE_CONVERSION, raw);
        final Object value;
        try {
            final ArgumentConverter<?> converter = argument.getConverter();
            value = converter.convert(raw, locale);
        } catch (final CommandLineParseException e) {
            throw new CommandLineArgumentException(ErrorCategory.ARGUMENT_VALUE_CONVERSION, argument.getName(),
                    messages.argumentValueConversion(argument.getName(), raw, argument.getElementType().getSimpleName(), e.getMessage()), e);
        }
        if (value == null && (argument.getArgumentType().isPrimitive() || argument.isMultiValue())) {
            throw new CommandLineArgumentException(ErrorCategory.NULL_ARGUMENT_VALUE, argument.getName(),
                    messages.nullArgumentValue(argument.getName()));
        }
        runValidators(argument, ValidationMode.AFTER_CONVERSION, value);
        return value;
    }

    private void runValidators(final ArgumentDescriptor argument, final ValidationMode mode, final Object value) {
        for (final ArgumentValidator validator : argument.getValidators()) {
            if (validator.getMode() == mode && !validator.isValid(argument, value, this)) {
                throw new CommandLineArgumentException(validator.getErrorCategory(), argument.getName(),
                        validator.getErrorMessage(argument, value));
            }
        }
    }

    private void checkRequiredArguments() {
        final List<String> missing = new ArrayList<>();
        for (final ArgumentState argumentState : states.values()) {
            if (argumentState.getArgument().isRequired() && !argumentState.hasValue()) {
                missing.add(argumentState.getArgument().getName());
            }
        }
        if (!missing.isEmpty()) {
            throw new CommandLineArgumentException(ErrorCategory.MISSING_REQUIRED_ARGUMENT, missing.get(0),
                    messages.missingRequiredArguments(missing));
        }
    }

    private void runAfterParsingValidators() {
        for (final ArgumentState argumentState : states.values()) {
            runValidators(argumentState.getArgument(), ValidationMode.AFTER_PARSING, argumentState.getValue());
        }
        for (final ClassValidator validator : schema.getClassValidators()) {
            if (!validator.isValid(this)) {
                throw new CommandLineArgumentException(validator.getErrorCategory(), null, validator.getErrorMessage());
            }
        }
    }

    private T createInstance() {
        final Constructor<?> constructor = schema.getConstructor();
        final Class<?>[] parameterTypes = constructor.getParameterTypes();
        final Object[] parameters = new Object[parameterTypes.length];
        for (int i = 0; i < parameters.length; ++i) {
            parameters[i] = zeroValue(parameterTypes[i]);
        }
        for (final ArgumentState argumentState : states.values()) {
            final ArgumentDescriptor argument = argumentState.getArgument();
            if (argument.getKind() == ArgumentKind.CONSTRUCTOR_PARAMETER && argumentState.hasValue()) {
                parameters[argument.getParameterIndex()] = argumentState.toTargetValue();
            }
        }

        final T instance;
        try {
            instance = type.cast(constructor.newInstance(parameters));
        } catch (final InvocationTargetException e) {
            final Throwable cause = e.getCause();
            throw new CommandLineArgumentException(ErrorCategory.CREATE_ARGUMENTS_TYPE_ERROR, null,
                    messages.createArgumentsTypeError(type.getSimpleName(), String.valueOf(cause.getMessage())), cause);
        } catch (final InstantiationException | IllegalAccessException | IllegalArgumentException e) {
            throw new CommandLineArgumentException(ErrorCategory.CREATE_ARGUMENTS_TYPE_ERROR, null,
                    messages.createArgumentsTypeError(type.getSimpleName(), String.valueOf(e.getMessage())), e);
        }

        for (final ArgumentState argumentState : states.values()) {
            final ArgumentDescriptor argument = argumentState.getArgument();
            if (argument.getKind() != ArgumentKind.FIELD) {
                continue;
            }
            final Object value;
            if (argumentState.hasValue()) {
                value = argumentState.toTargetValue();
            } else if (argument.hasDefaultValue()) {
                value = argumentState.defaultToTargetValue();
            } else {
                continue;
            }
            try {
                argument.getField().set(instance, value);
            } catch (final IllegalAccessException | IllegalArgumentException e) {
                throw new CommandLineArgumentException(ErrorCategory.APPLY_VALUE_ERROR, argument.getName(),
                        messages.applyValueError(argument.getName(), String.valueOf(e.getMessage())), e);
            }
        }
        return instance;
    }

    private static Object zeroValue(final Class<?> parameterType) {
        if (!parameterType.isPrimitive()) {
            return null;
        }
        if (parameterType == boolean.class) return false;
        if (parameterType == char.class) return '\0';
        if (parameterType == byte.class) return (byte) 0;
        if (parameterType == short.class) return (short) 0;
        if (parameterType == int.class) return 0;
        if (parameterType == long.class) return 0L;
        if (parameterType == float.class) return 0f;
        return 0d;
    }

    private Set<String> suppliedNames() {
        final Set<String> supplied = new TreeSet<>(schema.getNameComparator());
        for (final ArgumentState argumentState : states.values()) {
            if (argumentState.hasValue()) {
                final ArgumentDescriptor argument = argumentState.getArgument();
                supplied.add(argument.getName());
                supplied.addAll(argument.getAliases());
                if (argument.hasShortName()) {
                    supplied.add(String.valueOf(argument.getShortName()));
                }
            }
        }
        return Collections.unmodifiableSet(supplied);
    }

    // ValidationContext

    @Override
    public boolean hasValue(final String argumentName) {
        final ArgumentDescriptor argument = schema.getArgument(argumentName);
        return argument != null && states.get(argument).hasValue();
    }

    @Override
    public Object getValue(final String argumentName) {
        final ArgumentDescriptor argument = schema.getArgument(argumentName);
        return argument == null ? null : states.get(argument).getValue();
    }

    @Override
    public ArgumentDescriptor getArgument(final String argumentName) {
        return schema.getArgument(argumentName);
    }

    @Override
    public Locale getLocale() {
        return locale;
    }
}
