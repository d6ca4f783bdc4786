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
import argot.cmdline.Argument;
import argot.cmdline.CommandLineArgumentException;
import argot.cmdline.Description;
import argot.cmdline.ErrorCategory;
import argot.cmdline.NameTransform;
import org.testng.Assert;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

public class CommandManagerTest {

    @CommandProperties(name = "read", aliases = {"cat"}, oneLineSummary = "Reads a file.")
    public static class ReadCommand implements Command {
        @Argument(position = 0, required = true, doc = "File to read.")
        public String path;

        @Argument(doc = "Number of lines.")
        public int lines = 10;

        @Override
        public int run() {
            return lines;
        }
    }

    @Description("Writes a file.")
    public static class WriteCommand implements Command {
        @Argument
        public boolean append;

        @Override
        public int run() {
            return append ? 2 : 0;
        }
    }

    @CommandProperties(name = "echo", oneLineSummary = "Prints its arguments.")
    public static class EchoCommand implements CommandWithCustomParsing {
        private final List<String> words = new ArrayList<>();

        @Override
        public void parse(final String[] args, final int index, final CommandOptions options) {
            words.addAll(Arrays.asList(args).subList(index, args.length));
        }

        @Override
        public int run() {
            return words.size();
        }
    }

    @CommandProperties(name = "single", oneLineSummary = "Takes at most one argument.")
    public static class SingleWordCommand implements CommandWithCustomParsing {
        private String word;

        @Override
        public void parse(final String[] args, final int index, final CommandOptions options) {
            if (args.length - index > 1) {
                throw new CommandLineArgumentException(ErrorCategory.TOO_MANY_ARGUMENTS, null, "Only one word is allowed.");
            }
            word = index < args.length ? args[index] : "";
        }

        @Override
        public int run() {
            return word.length();
        }
    }

    @CommandProperties(omitFromCommandLine = true)
    public static class HiddenCommand implements Command {
        @Override
        public int run() {
            return 0;
        }
    }

    public static class ParentCommand implements Command {
        @Override
        public int run() {
            return 0;
        }
    }

    @CommandProperties(parent = ParentCommand.class)
    public static class ChildCommand implements Command {
        @Override
        public int run() {
            return 5;
        }
    }

    public static class ListFilesCommand implements Command {
        @Override
        public int run() {
            return 0;
        }
    }

    @CommandProperties(name = "READ")
    public static class DuplicateReadCommand implements Command {
        @Override
        public int run() {
            return 0;
        }
    }

    private static final List<Class<? extends Command>> COMMANDS = Collections.unmodifiableList(Arrays.<Class<? extends Command>>asList(
            ReadCommand.class, WriteCommand.class, EchoCommand.class, HiddenCommand.class, ParentCommand.class, ChildCommand.class));

    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;
    private CommandOptions options;

    @BeforeMethod
    public void setUp() {
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
        options = new CommandOptions().setApplicationName("app");
        options.setOut(new PrintStream(out, true));
        options.setError(new PrintStream(err, true));
    }

    private String out() {
        return new String(out.toByteArray(), StandardCharsets.UTF_8);
    }

    private String err() {
        return new String(err.toByteArray(), StandardCharsets.UTF_8);
    }

    private static List<String> names(final CommandManager manager) {
        final List<String> names = new ArrayList<>();
        for (final CommandInfo info : manager.getCommands()) {
            names.add(info.getName());
        }
        return names;
    }

    @Test
    public void testCommandList() {
        final CommandManager manager = new CommandManager(COMMANDS, options);
        Assert.assertEquals(names(manager), Arrays.asList("echo", "Parent", "read", "Write"));
        Assert.assertEquals(manager.getCommand("read").getDescription(), "Reads a file.");
        Assert.assertEquals(manager.getCommand("write").getDescription(), "Writes a file.");
        Assert.assertTrue(manager.getCommand("echo").isCustomParsing());
        Assert.assertNull(manager.getCommand("Hidden"));
        Assert.assertNull(manager.getCommand("Child"));
    }

    @Test
    public void testCommandLookup() {
        final CommandManager manager = new CommandManager(COMMANDS, options);
        Assert.assertEquals(manager.getCommand("cat").getCommandType(), ReadCommand.class);
        Assert.assertEquals(manager.getCommand("READ").getCommandType(), ReadCommand.class);
        Assert.assertEquals(manager.getCommand("wr").getCommandType(), WriteCommand.class);
        Assert.assertEquals(manager.getCommand("e").getCommandType(), EchoCommand.class);
        Assert.assertNull(manager.getCommand("x"));
        Assert.assertNull(manager.getCommand(""));

        options.setAutoCommandPrefixAliases(false);
        Assert.assertNull(new CommandManager(COMMANDS, options).getCommand("wr"));

        options.setCommandNameCaseSensitive(true);
        Assert.assertNull(new CommandManager(COMMANDS, options).getCommand("READ"));
    }

    @Test
    public void testNameTransform() {
        options.setCommandNameTransform(NameTransform.DASH_CASE);
        final CommandManager manager = new CommandManager(options, ListFilesCommand.class, ReadCommand.class);
        Assert.assertEquals(names(manager), Arrays.asList("list-files", "read"));
    }

    @Test
    public void testParentCommand() {
        options.setParentCommand(ParentCommand.class);
        final CommandManager manager = new CommandManager(COMMANDS, options);
        Assert.assertEquals(names(manager), Collections.singletonList("Child"));
        Assert.assertEquals(manager.runCommand(new String[]{"child"}), 5);
    }

    @Test
    public void testCommandFilter() {
        options.setCommandFilter(info -> !info.isCustomParsing());
        Assert.assertEquals(names(new CommandManager(COMMANDS, options)), Arrays.asList("Parent", "read", "Write"));
    }

    @Test(expectedExceptions = ArgotException.class)
    public void testNameCollision() {
        new CommandManager(options, ReadCommand.class, DuplicateReadCommand.class);
    }

    @Test
    public void testRunCommand() {
        final CommandManager manager = new CommandManager(COMMANDS, options);
        Assert.assertEquals(manager.runCommand(new String[]{"read", "file.txt", "-lines", "3"}), 3);
        Assert.assertEquals(manager.runCommand(new String[]{"cat", "file.txt"}), 10);
        Assert.assertEquals(manager.runCommand(new String[]{"write", "-append"}), 2);
        Assert.assertEquals(manager.runCommand(new String[]{"echo", "a", "-b", "c"}), 3);
        Assert.assertEquals(err(), "");
    }

    @Test
    public void testNoCommand() {
        Assert.assertEquals(new CommandManager(COMMANDS, options).runCommand(new String[0]), 1);
        Assert.assertTrue(err().contains("No command was specified."), err());
        Assert.assertTrue(err().contains("Available commands:"), err());
        Assert.assertTrue(err().contains("Reads a file."), err());
    }

    @Test
    public void testUnknownCommand() {
        final CommandManager manager = new CommandManager(COMMANDS, options);
        Assert.assertEquals(manager.getSuggestions("raed"), Collections.singletonList("read"));
        Assert.assertTrue(manager.getSuggestions("qqqqqqqqqqqq").isEmpty());

        Assert.assertEquals(manager.runCommand(new String[]{"raed"}), 1);
        Assert.assertTrue(err().contains("Unknown command 'raed'."), err());
        Assert.assertTrue(err().contains("Did you mean this?"), err());
    }

    @Test
    public void testCommandArgumentErrors() {
        final CommandManager manager = new CommandManager(COMMANDS, options);
        Assert.assertEquals(manager.runCommand(new String[]{"read"}), 1);
        Assert.assertTrue(err().startsWith("ERROR: "), err());
        Assert.assertTrue(err().contains("Usage: app read"), err());
    }

    @Test
    public void testCustomParsingErrors() {
        final CommandManager manager = new CommandManager(options, ReadCommand.class, SingleWordCommand.class);
        Assert.assertEquals(manager.runCommand(new String[]{"single", "abc"}), 3);
        Assert.assertEquals(err(), "");
        Assert.assertEquals(manager.runCommand(new String[]{"single", "a", "b"}), 1);
        Assert.assertTrue(err().startsWith("ERROR: Only one word is allowed."), err());
    }

    @Test
    public void testCommandsHaveNoVersionArgument() {
        final CommandManager manager = new CommandManager(COMMANDS, options);
        Assert.assertEquals(manager.runCommand(new String[]{"write", "-version"}), 1);
        Assert.assertTrue(err().contains("Unknown argument 'version'."), err());
    }

    @Test
    public void testCommandHelp() {
        final CommandManager manager = new CommandManager(COMMANDS, options);
        Assert.assertEquals(manager.runCommand(new String[]{"read", "-help"}), 1);
        Assert.assertTrue(out().contains("Usage: app read"), out());
        Assert.assertTrue(out().contains("File to read."), out());
    }

    @Test
    public void testCreateCommand() {
        final CommandManager manager = new CommandManager(COMMANDS, options);
        final Command command = manager.createCommand(new String[]{"-global", "read", "x"}, 1);
        Assert.assertTrue(command instanceof ReadCommand);
        Assert.assertEquals(((ReadCommand) command).path, "x");

        Assert.assertNull(manager.createCommand(new String[]{"read", "-?"}, 0));
        Assert.assertEquals(manager.createCommand(new String[]{"echo", "a"}, 0).run(), 1);
    }

    @Test
    public void testCreateUnknownCommand() {
        final CommandManager manager = new CommandManager(COMMANDS, options);
        try {
            manager.createCommand(new String[]{"bogus"}, 0);
            Assert.fail("Expected an unknown command error");
        } catch (final CommandLineArgumentException e) {
            Assert.assertEquals(e.getCategory(), ErrorCategory.UNKNOWN_COMMAND);
            Assert.assertEquals(e.getArgumentName(), "bogus");
        }
        try {
            manager.createCommand(new String[]{"read"}, 1);
            Assert.fail("Expected a missing command error");
        } catch (final CommandLineArgumentException e) {
            Assert.assertEquals(e.getCategory(), ErrorCategory.UNKNOWN_COMMAND);
        }
    }

    @Test
    public void testFromPackages() {
        options.setCommandFilter(info -> info.getCommandType().getEnclosingClass() == CommandManagerTest.class
                && info.getCommandType() != DuplicateReadCommand.class && info.getCommandType() != SingleWordCommand.class);
        final CommandManager manager = CommandManager.fromPackages(Collections.singletonList("argot.cmdline.commands"), options);
        Assert.assertEquals(names(manager), Arrays.asList("echo", "ListFiles", "Parent", "read", "Write"));
    }
}
