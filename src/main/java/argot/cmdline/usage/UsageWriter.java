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
package argot.cmdline.usage;

import argot.cmdline.ArgumentDescriptor;
import argot.cmdline.ArgumentKind;
import argot.cmdline.ArgumentSchema;
import argot.cmdline.ParseOptions;
import argot.cmdline.ParsingMode;
import argot.cmdline.ValueKind;
import argot.cmdline.commands.CommandInfo;
import argot.cmdline.validation.ArgumentValidator;
import argot.cmdline.validation.ClassValidator;
import htsjdk.samtools.util.StringUtil;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Writes plain text usage for an argument schema or a list of commands.
 */
public class UsageWriter {
    private static final int OPTION_COLUMN_WIDTH = 30;
    private static final int MINIMUM_DESCRIPTION_WIDTH = 20;

    private final ParseOptions options;

    public UsageWriter(final ParseOptions options) {
        this.options = options;
    }

    /**
     * Writes the description, the syntax line and one entry per visible argument.
     */
    public void writeUsage(final PrintStream stream, final ArgumentSchema schema, final String programName) {
        if (!schema.getDescription().isEmpty()) {
            stream.println(StringUtil.wordWrap(schema.getDescription(), options.getUsageLineWidth()));
            stream.println();
        }
        stream.println(StringUtil.wordWrap("Usage: " + programName + makeSyntax(schema), options.getUsageLineWidth()));

        final List<ArgumentDescriptor> visible = new ArrayList<>();
        for (final ArgumentDescriptor argument : schema.getArguments()) {
            if (!argument.isHidden()) {
                visible.add(argument);
            }
        }
        if (!visible.isEmpty()) {
            stream.println("\nArguments:\n");
            for (final ArgumentDescriptor argument : visible) {
                printArgumentUsage(stream, schema, argument);
            }
        }
        for (final ClassValidator validator : schema.getClassValidators()) {
            if (validator.getUsageHelp() != null) {
                stream.println(StringUtil.wordWrap(validator.getUsageHelp(), options.getUsageLineWidth()));
            }
        }
    }

    /**
     * Writes the syntax for running a command followed by the name and summary of each command.
     */
    public void writeCommandList(final PrintStream stream, final String applicationName, final Collection<CommandInfo> commands) {
        stream.println("Usage: " + applicationName + " <command> [arguments]");
        stream.println();
        stream.println("Available commands:");
        stream.println();
        for (final CommandInfo command : commands) {
            printColumns(stream, "    " + command.getName(), command.getDescription());
        }
    }

    private String makeSyntax(final ArgumentSchema schema) {
        final StringBuilder sb = new StringBuilder();
        for (final ArgumentDescriptor argument : schema.getArguments()) {
            if (argument.isHidden()) {
                continue;
            }
            final String name = primaryName(schema, argument);
            final String value = "<" + argument.getValueDescription() + ">";
            final String suffix = argument.isMultiValue() ? "..." : "";
            final String item;
            if (argument.isPositional()) {
                item = "[" + name + "] " + value + suffix;
            } else if (argument.isSwitch()) {
                item = name + suffix;
            } else {
                item = name + " " + value + suffix;
            }
            sb.append(' ');
            if (argument.isRequired()) {
                sb.append(item);
            } else {
                sb.append('[').append(item).append(']');
            }
        }
        return sb.toString();
    }

    private void printArgumentUsage(final PrintStream stream, final ArgumentSchema schema, final ArgumentDescriptor argument) {
        String label = makeNames(schema, argument);
        if (!argument.isSwitch()) {
            label += " <" + argument.getValueDescription() + ">";
        }
        printColumns(stream, "    " + label, makeArgumentDescription(argument));
        stream.println();
    }

    private void printColumns(final PrintStream stream, final String label, final String description) {
        stream.print(label);
        int numSpaces = OPTION_COLUMN_WIDTH - label.length();
        if (label.length() >= OPTION_COLUMN_WIDTH) {
            stream.println();
            numSpaces = OPTION_COLUMN_WIDTH;
        }
        final int descriptionWidth = Math.max(MINIMUM_DESCRIPTION_WIDTH, options.getUsageLineWidth() - OPTION_COLUMN_WIDTH);
        final String[] descriptionLines = StringUtil.wordWrap(description, descriptionWidth).split("\n");
        for (int i = 0; i < descriptionLines.length; ++i) {
            if (i > 0) {
                numSpaces = OPTION_COLUMN_WIDTH;
            }
            printSpaces(stream, numSpaces);
            stream.println(descriptionLines[i]);
        }
    }

    private static void printSpaces(final PrintStream stream, final int numSpaces) {
        for (int i = 0; i < numSpaces; ++i) {
            stream.print(' ');
        }
    }

    private String makeArgumentDescription(final ArgumentDescriptor argument) {
        final StringBuilder sb = new StringBuilder();
        if (!argument.getDescription().isEmpty()) {
            sb.append(argument.getDescription()).append(' ');
        }
        if (argument.getKind() == ArgumentKind.AUTOMATIC_HELP || argument.getKind() == ArgumentKind.AUTOMATIC_VERSION) {
            return sb.toString().trim();
        }
        if (argument.isRequired()) {
            sb.append("Required. ");
        } else if (argument.hasDefaultValue()) {
            sb.append("Default value: ").append(formatDefault(argument.getDefaultValue())).append(". ");
        }
        if (argument.getValueKind() == ValueKind.ENUM
                || (argument.isMultiValue() && !argument.isDictionary() && argument.getElementType().isEnum())) {
            sb.append("Possible values: {");
            final Object[] constants = argument.getElementType().getEnumConstants();
            for (int i = 0; i < constants.length; ++i) {
                if (i > 0) {
                    sb.append(", ");
                }
                sb.append(constants[i]);
            }
            sb.append("} ");
        }
        if (argument.isMultiValue()) {
            if (argument.getMultiValueSeparator() != null) {
                sb.append("Values may be separated by '").append(argument.getMultiValueSeparator()).append("'. ");
            }
            if (argument.isDictionary()) {
                sb.append("Each value is a key").append(argument.getKeyValueSeparator()).append("value pair. ");
            }
            sb.append("This argument may be specified more than once. ");
        }
        for (final ArgumentValidator validator : argument.getValidators()) {
            if (validator.getUsageHelp() != null) {
                sb.append(validator.getUsageHelp()).append(' ');
            }
        }
        return sb.toString().trim();
    }

    private static String formatDefault(final Object value) {
        if (value instanceof List) {
            final List<String> parts = new ArrayList<>();
            for (final Object o : (List<?>) value) {
                if (o instanceof Map.Entry) {
                    parts.add(((Map.Entry<?, ?>) o).getKey() + "=" + ((Map.Entry<?, ?>) o).getValue());
                } else {
                    parts.add(String.valueOf(o));
                }
            }
            return String.join(", ", parts);
        }
        return String.valueOf(value);
    }

    private String primaryName(final ArgumentSchema schema, final ArgumentDescriptor argument) {
        if (schema.getMode() == ParsingMode.LONG_SHORT) {
            if (argument.hasLongName()) {
                return options.getLongArgumentNamePrefix() + argument.getName();
            }
            return shortPrefix() + argument.getShortName();
        }
        return shortPrefix() + argument.getName();
    }

    private String makeNames(final ArgumentSchema schema, final ArgumentDescriptor argument) {
        final List<String> names = new ArrayList<>();
        if (schema.getMode() == ParsingMode.LONG_SHORT) {
            if (argument.hasShortName()) {
                names.add(shortPrefix() + argument.getShortName());
            }
            for (final Character alias : argument.getShortAliases()) {
                names.add(shortPrefix() + alias);
            }
            if (argument.hasLongName()) {
                names.add(options.getLongArgumentNamePrefix() + argument.getName());
                for (final String alias : argument.getAliases()) {
                    names.add(options.getLongArgumentNamePrefix() + alias);
                }
            }
        } else {
            names.add(shortPrefix() + argument.getName());
            for (final String alias : argument.getAliases()) {
                names.add(shortPrefix() + alias);
            }
        }
        return String.join(", ", names);
    }

    private String shortPrefix() {
        return options.getArgumentNamePrefixes().get(0);
    }
}
