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

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Walks the command line tokens, matches them to arguments of an {@link ArgumentSchema} and hands each raw value to
 * a {@link Binder}. The tokenizer has no state of its own beyond the position in the token list; whether an argument
 * already has a value is asked of the binder.
 */
final class ArgumentTokenizer {

    /** Receives the raw values matched by the tokenizer. */
    interface Binder {
        boolean hasValue(ArgumentDescriptor argument);

        /**
         * Converts, validates and stores one raw value.
         *
         * @return the cancel mode triggered by this value
         */
        CancelMode bind(ArgumentDescriptor argument, String usedName, String rawValue);
    }

    /** How tokenizing ended. */
    static final class Outcome {
        private final CancelMode cancelMode;
        private final ArgumentDescriptor cancelledBy;
        private final int nextIndex;

        Outcome(final CancelMode cancelMode, final ArgumentDescriptor cancelledBy, final int nextIndex) {
            this.cancelMode = cancelMode;
            this.cancelledBy = cancelledBy;
            this.nextIndex = nextIndex;
        }

        CancelMode getCancelMode() {
            return cancelMode;
        }

        /** @return the argument that cancelled parsing, or null if it ran to the end or stopped at {@code --}. */
        ArgumentDescriptor getCancelledBy() {
            return cancelledBy;
        }

        /** @return the index of the first token that was not processed. */
        int getNextIndex() {
            return nextIndex;
        }
    }

    private static final String NEGATIVE_SIGN = "-";

    /** A token that starts with an argument name prefix. */
    private static final class NamedToken {
        private final boolean isLong;
        private final String name;
        private final String value;

        NamedToken(final boolean isLong, final String name, final String value) {
            this.isLong = isLong;
            this.name = name;
            this.value = value;
        }
    }

    private final ArgumentSchema schema;
    private final MessageProvider messages;
    private final List<String> prefixes;
    private final String longPrefix;
    private final char[] separators;
    private final boolean longShort;
    private final boolean allowWhiteSpaceValueSeparator;
    private final boolean autoPrefixAliases;
    private final boolean negativeNumbersAsValues;
    private final PrefixTerminationMode prefixTermination;

    ArgumentTokenizer(final ArgumentSchema schema, final ParseOptions options) {
        this.schema = schema;
        this.messages = options.getMessageProvider();
        final List<String> sorted = new ArrayList<>(options.getArgumentNamePrefixes());
        sorted.sort(Comparator.comparingInt(String::length).reversed());
        this.prefixes = sorted;
        this.longPrefix = options.getLongArgumentNamePrefix();
        this.separators = options.getNameValueSeparators();
        this.longShort = schema.getMode() == ParsingMode.LONG_SHORT;
        this.allowWhiteSpaceValueSeparator = options.isAllowWhiteSpaceValueSeparator();
        this.autoPrefixAliases = options.isAutoPrefixAliases();
        this.negativeNumbersAsValues = options.isNegativeNumbersAsValues();
        this.prefixTermination = options.getPrefixTermination();
    }

    /**
     * Processes the tokens starting at {@code index}.
     *
     * @throws CommandLineArgumentException for the first token that cannot be matched, or any error from the binder
     */
    Outcome tokenize(final String[] args, final int index, final Binder binder) {
        int positionalIndex = 0;
        boolean positionalOnly = false;
        for (int i = index; i < args.length; ++i) {
            final String token = args[i];
            if (!positionalOnly && isPrefixTerminator(token)) {
                if (prefixTermination == PrefixTerminationMode.CANCEL_WITH_SUCCESS) {
                    return new Outcome(CancelMode.SUCCESS, null, i + 1);
                }
                positionalOnly = true;
                continue;
            }

            final NamedToken named = positionalOnly ? null : classify(token);
            if (named == null) {
                final ArgumentDescriptor slot = nextPositional(positionalIndex, binder);
                if (slot == null) {
                    throw new CommandLineArgumentException(ErrorCategory.TOO_MANY_ARGUMENTS, null, messages.tooManyArguments(token));
                }
                positionalIndex = slot.getPosition();
                if (!slot.isMultiValue()) {
                    ++positionalIndex;
                }
                final CancelMode cancel = binder.bind(slot, slot.getName(), token);
                if (cancel != CancelMode.NONE) {
                    return new Outcome(cancel, slot, i + 1);
                }
                continue;
            }

            if (named.name.isEmpty()) {
                throw new CommandLineArgumentException(ErrorCategory.UNKNOWN_ARGUMENT, token, messages.unknownArgument(token));
            }
            if (!named.isLong && named.name.length() > 1) {
                final Outcome outcome = bindCombinedShortNames(named, binder, i);
                if (outcome != null) {
                    return outcome;
                }
                continue;
            }

            final ArgumentDescriptor argument = named.isLong ? resolveLong(named.name) : resolveShort(named.name.charAt(0));
            String value = named.value;
            if (value == null && argument.isSwitch()) {
                value = "true";
            } else if (value == null) {
                if (!allowWhiteSpaceValueSeparator || i + 1 >= args.length || isNameToken(args[i + 1])) {
                    throw new CommandLineArgumentException(ErrorCategory.MISSING_NAMED_ARGUMENT_VALUE, argument.getName(),
                            messages.missingNamedArgumentValue(argument.getName()));
                }
                value = args[++i];
            }
            CancelMode cancel = binder.bind(argument, named.name, value);
            while (cancel == CancelMode.NONE && argument.isAllowMultiValueWhiteSpaceSeparator() &&
                    i + 1 < args.length && !isNameToken(args[i + 1])) {
                cancel = binder.bind(argument, named.name, args[++i]);
            }
            if (cancel != CancelMode.NONE) {
                return new Outcome(cancel, argument, i + 1);
            }
        }
        return new Outcome(CancelMode.NONE, null, args.length);
    }

    private boolean isPrefixTerminator(final String token) {
        return prefixTermination != PrefixTerminationMode.NONE && token.equals(longPrefix);
    }

    /** @return true if the token would be read as an argument name or as the prefix terminator. */
    private boolean isNameToken(final String token) {
        return isPrefixTerminator(token) || classify(token) != null;
    }

    /**
     * @return the named token, or null if the token is a value
     */
    private NamedToken classify(final String token) {
        String rest = null;
        String matchedPrefix = null;
        boolean isLong = !longShort;
        if (longShort && token.startsWith(longPrefix) && token.length() > longPrefix.length()) {
            matchedPrefix = longPrefix;
            rest = token.substring(longPrefix.length());
            isLong = true;
        } else {
            for (final String prefix : prefixes) {
                if (token.startsWith(prefix) && token.length() > prefix.length()) {
                    matchedPrefix = prefix;
                    rest = token.substring(prefix.length());
                    break;
                }
            }
        }
        if (rest == null) {
            return null;
        }

        int separatorIndex = -1;
        for (int i = 0; i < rest.length() && separatorIndex < 0; ++i) {
            for (final char separator : separators) {
                if (rest.charAt(i) == separator) {
                    separatorIndex = i;
                    break;
                }
            }
        }
        final String name = separatorIndex < 0 ? rest : rest.substring(0, separatorIndex);
        final String value = separatorIndex < 0 ? null : rest.substring(separatorIndex + 1);

        if (NEGATIVE_SIGN.equals(matchedPrefix) && Character.isDigit(rest.charAt(0))) {
            // -5 is a negative number unless configured to look for an argument of that name first
            if (negativeNumbersAsValues || !isKnownName(name, isLong)) {
                return null;
            }
        }
        return new NamedToken(isLong, name, value);
    }

    private boolean isKnownName(final String name, final boolean isLong) {
        if (!isLong) {
            return name.length() == 1 && schema.getShortArgument(name.charAt(0)) != null;
        }
        if (schema.getLongArgument(name) != null) {
            return true;
        }
        return autoPrefixAliases && schema.findLongArgumentsByPrefix(name).size() == 1;
    }

    private ArgumentDescriptor resolveLong(final String name) {
        final ArgumentDescriptor argument = schema.getLongArgument(name);
        if (argument != null) {
            return argument;
        }
        if (autoPrefixAliases) {
            final List<ArgumentDescriptor> matches = schema.findLongArgumentsByPrefix(name);
            if (matches.size() == 1) {
                return matches.get(0);
            }
            if (matches.size() > 1) {
                final List<String> names = new ArrayList<>();
                for (final ArgumentDescriptor match : matches) {
                    names.add(match.getName());
                }
                throw new CommandLineArgumentException(ErrorCategory.UNKNOWN_ARGUMENT, name, messages.ambiguousPrefix(name, names));
            }
        }
        throw new CommandLineArgumentException(ErrorCategory.UNKNOWN_ARGUMENT, name, messages.unknownArgument(name));
    }

    private ArgumentDescriptor resolveShort(final char name) {
        final ArgumentDescriptor argument = schema.getShortArgument(name);
        if (argument == null) {
            final String display = String.valueOf(name);
            throw new CommandLineArgumentException(ErrorCategory.UNKNOWN_ARGUMENT, display, messages.unknownArgument(display));
        }
        return argument;
    }

    /**
     * Binds a group of short names such as {@code -abc}. Every name must be a switch, except that the last may take
     * a value when one is given with a separator.
     *
     * @return the outcome if binding cancelled parsing, otherwise null
     */
    private Outcome bindCombinedShortNames(final NamedToken named, final Binder binder, final int tokenIndex) {
        final String names = named.name;
        final ArgumentDescriptor[] arguments = new ArgumentDescriptor[names.length()];
        for (int i = 0; i < names.length(); ++i) {
            arguments[i] = resolveShort(names.charAt(i));
            final boolean last = i == names.length() - 1;
            if (!arguments[i].isSwitch() && !(last && named.value != null)) {
                throw new CommandLineArgumentException(ErrorCategory.COMBINED_SHORT_NAME_NON_SWITCH, names,
                        messages.combinedShortNameNonSwitch(names));
            }
        }
        final boolean lastTakesValue = !arguments[arguments.length - 1].isSwitch();
        for (int i = 0; i < arguments.length; ++i) {
            final boolean last = i == arguments.length - 1;
            final String value;
            if (named.value == null || (lastTakesValue && !last)) {
                value = "true";
            } else {
                value = named.value;
            }
            final CancelMode cancel = binder.bind(arguments[i], String.valueOf(names.charAt(i)), value);
            if (cancel != CancelMode.NONE) {
                return new Outcome(cancel, arguments[i], tokenIndex + 1);
            }
        }
        return null;
    }

    /**
     * @return the first positional argument at or after {@code from} that can take another value, or null. Slots
     * already given a value by name are skipped; a multi-value argument always takes more.
     */
    private ArgumentDescriptor nextPositional(final int from, final Binder binder) {
        final List<ArgumentDescriptor> positional = schema.getPositionalArguments();
        for (int i = from; i < positional.size(); ++i) {
            final ArgumentDescriptor argument = positional.get(i);
            if (argument.isMultiValue() || !binder.hasValue(argument)) {
                return argument;
            }
        }
        return null;
    }
}
