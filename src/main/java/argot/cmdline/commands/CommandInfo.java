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
package argot.cmdline.commands;

import argot.cmdline.Description;
import argot.cmdline.NameTransform;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Name, aliases and description of a command class.
 */
public final class CommandInfo {
    private static final String COMMAND_SUFFIX = "Command";

    private final Class<? extends Command> commandType;
    private final String name;
    private final List<String> aliases;
    private final String description;
    private final Class<? extends Command> parentCommandType;
    private final boolean omitFromCommandLine;

    private CommandInfo(final Class<? extends Command> commandType, final String name, final List<String> aliases,
                        final String description, final Class<? extends Command> parentCommandType,
                        final boolean omitFromCommandLine) {
        this.commandType = commandType;
        this.name = name;
        this.aliases = aliases;
        this.description = description;
        this.parentCommandType = parentCommandType;
        this.omitFromCommandLine = omitFromCommandLine;
    }

    public static CommandInfo create(final Class<? extends Command> commandType, final NameTransform nameTransform) {
        final CommandProperties properties = commandType.getAnnotation(CommandProperties.class);
        String name = properties == null ? "" : properties.name();
        if (name.isEmpty()) {
            name = commandType.getSimpleName();
            if (name.endsWith(COMMAND_SUFFIX) && name.length() > COMMAND_SUFFIX.length()) {
                name = name.substring(0, name.length() - COMMAND_SUFFIX.length());
            }
            name = nameTransform.apply(name);
        }

        String description = properties == null ? "" : properties.oneLineSummary();
        if (description.isEmpty()) {
            final Description classDescription = commandType.getAnnotation(Description.class);
            description = classDescription == null ? "" : classDescription.value();
        }

        final List<String> aliases = properties == null
                ? Collections.<String>emptyList()
                : Collections.unmodifiableList(Arrays.asList(properties.aliases()));
        final Class<? extends Command> parent = properties == null || properties.parent() == Command.class ? null : properties.parent();
        final boolean omit = properties != null && properties.omitFromCommandLine();
        return new CommandInfo(commandType, name, aliases, description, parent, omit);
    }

    public Class<? extends Command> getCommandType() {
        return commandType;
    }

    public String getName() {
        return name;
    }

    public List<String> getAliases() {
        return aliases;
    }

    public String getDescription() {
        return description;
    }

    /** @return the parent command class, or null for a top level command. */
    public Class<? extends Command> getParentCommandType() {
        return parentCommandType;
    }

    public boolean isOmitFromCommandLine() {
        return omitFromCommandLine;
    }

    public boolean isCustomParsing() {
        return CommandWithCustomParsing.class.isAssignableFrom(commandType);
    }

    @Override
    public String toString() {
        return name;
    }
}
