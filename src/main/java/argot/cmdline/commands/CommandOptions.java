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

import argot.cmdline.NameTransform;
import argot.cmdline.ParseOptions;

import java.util.function.Predicate;

/**
 * Options for a {@link CommandManager}. The inherited options apply to parsing the arguments of each command.
 */
public class CommandOptions extends ParseOptions {
    private boolean commandNameCaseSensitive;
    private Predicate<CommandInfo> commandFilter;
    private Class<? extends Command> parentCommand;
    private NameTransform commandNameTransform = NameTransform.NONE;
    private boolean autoCommandPrefixAliases = true;
    private String applicationName;

    public CommandOptions() {
    }

    protected CommandOptions(final CommandOptions other) {
        super(other);
        this.commandNameCaseSensitive = other.commandNameCaseSensitive;
        this.commandFilter = other.commandFilter;
        this.parentCommand = other.parentCommand;
        this.commandNameTransform = other.commandNameTransform;
        this.autoCommandPrefixAliases = other.autoCommandPrefixAliases;
        this.applicationName = other.applicationName;
    }

    @Override
    protected CommandOptions copy() {
        return new CommandOptions(this);
    }

    public boolean isCommandNameCaseSensitive() {
        return commandNameCaseSensitive;
    }

    public CommandOptions setCommandNameCaseSensitive(final boolean commandNameCaseSensitive) {
        this.commandNameCaseSensitive = commandNameCaseSensitive;
        return this;
    }

    /** @return the filter commands must pass to be available, or null to allow all. */
    public Predicate<CommandInfo> getCommandFilter() {
        return commandFilter;
    }

    public CommandOptions setCommandFilter(final Predicate<CommandInfo> commandFilter) {
        this.commandFilter = commandFilter;
        return this;
    }

    /** @return the parent whose child commands are available, or null for top level commands. */
    public Class<? extends Command> getParentCommand() {
        return parentCommand;
    }

    public CommandOptions setParentCommand(final Class<? extends Command> parentCommand) {
        this.parentCommand = parentCommand;
        return this;
    }

    /** Transformation applied to class names of commands without an explicit name. */
    public NameTransform getCommandNameTransform() {
        return commandNameTransform;
    }

    public CommandOptions setCommandNameTransform(final NameTransform commandNameTransform) {
        this.commandNameTransform = commandNameTransform;
        return this;
    }

    public boolean isAutoCommandPrefixAliases() {
        return autoCommandPrefixAliases;
    }

    public CommandOptions setAutoCommandPrefixAliases(final boolean autoCommandPrefixAliases) {
        this.autoCommandPrefixAliases = autoCommandPrefixAliases;
        return this;
    }

    /** Name of the application shown in the command list and in the usage of each command. */
    public String getApplicationName() {
        return applicationName;
    }

    public CommandOptions setApplicationName(final String applicationName) {
        this.applicationName = applicationName;
        return this;
    }
}
