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

import argot.ArgotException;
import argot.cmdline.CommandLineArgumentException;
import argot.cmdline.CommandLineParser;
import argot.cmdline.ErrorCategory;
import argot.cmdline.MessageProvider;
import argot.cmdline.usage.UsageWriter;
import htsjdk.samtools.util.Log;
import htsjdk.samtools.util.StringUtil;
import org.broadinstitute.barclay.argparser.ClassFinder;

import java.io.PrintStream;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Set;
import java.util.TreeMap;

/**
 * Finds commands, resolves the command named on the command line and runs it with the remaining arguments.
 *
 * Commands form a flat namespace. A hierarchy is built by giving child commands a
 * {@link CommandProperties#parent()} and creating a manager with {@link CommandOptions#setParentCommand} for each
 * level.
 */
public class CommandManager {
    private static final Log log = Log.getInstance(CommandManager.class);

    /** similarity floor for matching in printUnknown **/
    private static final int HELP_SIMILARITY_FLOOR = 7;
    private static final int MINIMUM_SUBSTRING_LENGTH = 5;

    private final CommandOptions options;
    private final List<CommandInfo> commands;
    private final NavigableMap<String, CommandInfo> commandNames;

    /**
     * @throws ArgotException if two commands have the same name or alias
     */
    public CommandManager(final Collection<Class<? extends Command>> commandTypes, final CommandOptions options) {
        this.options = options;
        final Comparator<String> comparator = options.isCommandNameCaseSensitive()
                ? Comparator.<String>naturalOrder()
                : String.CASE_INSENSITIVE_ORDER;
        this.commandNames = new TreeMap<>(comparator);

        final List<CommandInfo> infos = new ArrayList<>();
        for (final Class<? extends Command> commandType : commandTypes) {
            final CommandInfo info = CommandInfo.create(commandType, options.getCommandNameTransform());
            if (info.isOmitFromCommandLine() || info.getParentCommandType() != options.getParentCommand()) {
                continue;
            }
            if (options.getCommandFilter() != null && !options.getCommandFilter().test(info)) {
                continue;
            }
            registerName(info.getName(), info);
            for (final String alias : info.getAliases()) {
                registerName(alias, info);
            }
            infos.add(info);
        }
        infos.sort((a, b) -> comparator.compare(a.getName(), b.getName()));
        this.commands = Collections.unmodifiableList(infos);
    }

    @SafeVarargs
    public CommandManager(final CommandOptions options, final Class<? extends Command>... commandTypes) {
        this(Arrays.asList(commandTypes), options);
    }

    /**
     * Creates a manager for every concrete {@link Command} class in the given packages and their subpackages.
     */
    public static CommandManager fromPackages(final List<String> packageList, final CommandOptions options) {
        final ClassFinder classFinder = new ClassFinder();
        packageList.forEach(pkg -> classFinder.find(pkg, Command.class));

        final List<Class<? extends Command>> commandTypes = new ArrayList<>();
        for (final Class<?> clazz : classFinder.getClasses()) {
            // No interfaces, synthetic, primitive, local, or abstract classes.
            if (!clazz.isInterface() && !clazz.isSynthetic() && !clazz.isPrimitive() && !clazz.isLocalClass()
                    && !clazz.isAnonymousClass() && !Modifier.isAbstract(clazz.getModifiers())
                    && Modifier.isPublic(clazz.getModifiers())) {
                commandTypes.add(clazz.asSubclass(Command.class));
            }
        }
        log.debug("Found ", commandTypes.size(), " commands in ", packageList);
        return new CommandManager(commandTypes, options);
    }

    private void registerName(final String name, final CommandInfo info) {
        final CommandInfo existing = commandNames.get(name);
        if (existing != null) {
            throw new ArgotException("Command name collision: '" + name + "' is used by " +
                    existing.getCommandType().getName() + " and " + info.getCommandType().getName());
        }
        commandNames.put(name, info);
    }

    public CommandOptions getOptions() {
        return options;
    }

    /** @return the available commands, sorted by name. */
    public List<CommandInfo> getCommands() {
        return commands;
    }

    /**
     * Finds a command by name or alias. If that fails and prefix aliases are enabled, a prefix of exactly one
     * command's names is accepted.
     *
     * @return the command, or null
     */
    public CommandInfo getCommand(final String name) {
        final CommandInfo info = commandNames.get(name);
        if (info != null || !options.isAutoCommandPrefixAliases() || name.isEmpty()) {
            return info;
        }
        final Set<CommandInfo> matches = new LinkedHashSet<>();
        for (final Map.Entry<String, CommandInfo> entry : commandNames.tailMap(name, true).entrySet()) {
            if (!entry.getKey().regionMatches(!options.isCommandNameCaseSensitive(), 0, name, 0, name.length())) {
                break;
            }
            matches.add(entry.getValue());
        }
        return matches.size() == 1 ? matches.iterator().next() : null;
    }

    /**
     * Creates the command named by {@code args[index]} and parses the tokens after it.
     *
     * @return the command, or null if parsing its arguments was cancelled, for instance by {@code -help}
     * @throws CommandLineArgumentException if no command is named, the command is unknown, or its arguments are
     * invalid
     */
    public Command createCommand(final String[] args, final int index) {
        final MessageProvider messages = options.getMessageProvider();
        if (index >= args.length) {
            throw new CommandLineArgumentException(ErrorCategory.UNKNOWN_COMMAND, null, messages.noCommand());
        }
        final CommandInfo info = getCommand(args[index]);
        if (info == null) {
            throw new CommandLineArgumentException(ErrorCategory.UNKNOWN_COMMAND, args[index], messages.unknownCommand(args[index]));
        }
        log.debug("Resolved command ", args[index], " to ", info.getCommandType().getName());
        if (info.isCustomParsing()) {
            final CommandWithCustomParsing command = instantiateCustom(info);
            command.parse(args, index + 1, options);
            return command;
        }
        return createParser(info).parse(Arrays.copyOfRange(args, index + 1, args.length));
    }

    /**
     * Runs the command named by the first token with the remaining tokens as its arguments. Errors and usage are
     * written to the streams of the options.
     *
     * @return the command's exit code, or 1 if no command ran
     */
    public int runCommand(final String[] args) {
        final PrintStream error = options.getError();
        if (args.length < 1) {
            error.println(options.getMessageProvider().noCommand());
            writeCommandList(error);
            return 1;
        }
        final CommandInfo info = getCommand(args[0]);
        if (info == null) {
            writeCommandList(error);
            printUnknown(error, args[0]);
            return 1;
        }
        log.debug("Running command ", info.getName());
        if (info.isCustomParsing()) {
            final CommandWithCustomParsing command;
            try {
                command = instantiateCustom(info);
                command.parse(args, 1, options);
            } catch (final CommandLineArgumentException e) {
                error.println("ERROR: " + e.getMessage());
                return 1;
            }
            return command.run();
        }
        // we can lop off the first argument but it requires an array copy
        final String[] commandArgs = Arrays.copyOfRange(args, 1, args.length);
        final Command command = createParser(info).parseWithErrorHandling(commandArgs);
        if (command == null) {
            return 1;
        }
        return command.run();
    }

    public void writeCommandList(final PrintStream stream) {
        new UsageWriter(options).writeCommandList(stream, getApplicationName(), commands);
    }

    /**
     * @return the names of the commands most similar to the given unknown name, empty if none is close
     */
    public List<String> getSuggestions(final String command) {
        final Map<CommandInfo, Integer> distances = new HashMap<>();
        int bestDistance = Integer.MAX_VALUE;
        int bestN = 0;

        // Score against all commands
        for (final CommandInfo info : commands) {
            final String name = info.getName();
            final int distance;
            if (name.startsWith(command) || (MINIMUM_SUBSTRING_LENGTH <= command.length() && name.contains(command))) {
                distance = 0;
            } else {
                distance = StringUtil.levenshteinDistance(command, name, 0, 2, 1, 4);
            }
            distances.put(info, distance);

            if (distance < bestDistance) {
                bestDistance = distance;
                bestN = 1;
            } else if (distance == bestDistance) {
                bestN++;
            }
        }

        // Upper bound on the similarity score
        if (0 == bestDistance && bestN == commands.size()) {
            bestDistance = HELP_SIMILARITY_FLOOR + 1;
        }

        final List<String> suggestions = new ArrayList<>();
        if (bestDistance < HELP_SIMILARITY_FLOOR) {
            for (final CommandInfo info : commands) {
                if (bestDistance == distances.get(info)) {
                    suggestions.add(info.getName());
                }
            }
        }
        return suggestions;
    }

    /** When a command does not match any known command, searches for similar commands, using the same method as GIT **/
    private void printUnknown(final PrintStream stream, final String command) {
        final MessageProvider messages = options.getMessageProvider();
        stream.println(messages.unknownCommand(command));
        final List<String> suggestions = getSuggestions(command);
        if (!suggestions.isEmpty()) {
            stream.println(messages.didYouMean(suggestions));
            for (final String suggestion : suggestions) {
                stream.println(String.format("        %s", suggestion));
            }
        }
    }

    private CommandLineParser<? extends Command> createParser(final CommandInfo info) {
        final CommandOptions commandOptions = options.copy();
        commandOptions.setAutoVersionArgument(false);
        final String applicationName = getApplicationName();
        commandOptions.setProgramName(applicationName.isEmpty() ? info.getName() : applicationName + " " + info.getName());
        return newParser(info.getCommandType(), commandOptions);
    }

    private static <C extends Command> CommandLineParser<C> newParser(final Class<C> commandType, final CommandOptions commandOptions) {
        return new CommandLineParser<>(commandType, commandOptions);
    }

    private String getApplicationName() {
        return options.getApplicationName() != null ? options.getApplicationName() : "";
    }

    private static CommandWithCustomParsing instantiateCustom(final CommandInfo info) {
        try {
            return (CommandWithCustomParsing) info.getCommandType().getConstructor().newInstance();
        } catch (final InvocationTargetException e) {
            throw new CommandLineArgumentException(ErrorCategory.CREATE_ARGUMENTS_TYPE_ERROR, null,
                    "Could not create command " + info.getName() + ": " + e.getCause().getMessage(), e.getCause());
        } catch (final NoSuchMethodException | InstantiationException | IllegalAccessException e) {
            throw new ArgotException("Command " + info.getCommandType().getName() + " needs a public no-argument constructor", e);
        }
    }
}
