package com.mimecast.listrunner;

import com.mimecast.listrunner.main.EntryCLI;
import com.mimecast.listrunner.main.RunnerCLI;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.help.HelpFormatter;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.config.Configurator;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.util.Arrays;
import java.util.LinkedList;
import java.util.List;
import java.util.Optional;

/**
 * Main runnable.
 *
 * <p>This implements the commandline --entry, --runner and --maintain options.
 * <p>Further CLI options are implemented individually within each component.
 *
 * @see EntryCLI
 * @see RunnerCLI
 */
public class Main {

    /**
     * Application jar name.
     */
    private static final String NAME = "listrunner.jar";

    /**
     * Application jar usage.
     */
    public static final String USAGE = "java -jar " + NAME;

    /**
     * Application description.
     */
    public static final String DESCRIPTION = "Mailing list queue runner";

    /**
     * Exit code of a usage error.
     */
    public static final int EX_USAGE = 64;

    private String[] args;
    private int exitCode = 0;

    /**
     * Main runnable.
     *
     * @param args String array.
     */
    public static void main(String[] args) {
        Main main = new Main(args);
        if (main.getExitCode() != 0) {
            System.exit(main.getExitCode());
        }
    }

    /**
     * Constructs a new Main instance.
     *
     * @param args String array.
     */
    Main(String[] args) {
        this.args = args;

        // Raise logging.
        if (Arrays.asList(args).contains("--verbose")) {
            purgeArg("--verbose");
            Configurator.setAllLevels(LogManager.getRootLogger().getName(), Level.DEBUG);
        }

        // Parse options.
        Optional<CommandLine> opt = parseArgs(options());

        if (opt.isPresent()) {
            CommandLine cmd = opt.get();

            // Enqueue one inbound message.
            if (cmd.hasOption("entry")) {
                purgeArg("--entry");
                exitCode = new EntryCLI(this).run();
            }

            // Run queue runners or maintenance.
            else if (cmd.hasOption("runner") || cmd.hasOption("maintain")) {
                exitCode = new RunnerCLI(this).run();
            }

            // Show usage.
            else {
                optionsUsage(options());
                exitCode = EX_USAGE;
            }
        }

        // Show usage.
        else {
            exitCode = EX_USAGE;
        }
    }

    /**
     * CLI options.
     * <i>Listing order will be alphabetical</i>.
     *
     * @return Options instance.
     */
    private Options options() {
        Options options = new Options();
        options.addOption(null, "entry", false, "Enqueue a message read from standard input");
        options.addOption(null, "runner", false, "Run queue runners");
        options.addOption(null, "maintain", false, "Run maintenance once");
        options.addOption(null, "verbose", false, "Debug logging");
        return options;
    }

    /**
     * CLI usage.
     *
     * @param options Options instance.
     */
    public void optionsUsage(Options options) {
        log(USAGE);
        log(" " + DESCRIPTION);
        log("");

        // Capture System.out to get help output.
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        PrintStream ps = new PrintStream(baos);
        PrintStream oldOut = System.out;
        System.setOut(ps);

        try {
            HelpFormatter formatter = HelpFormatter.builder()
                .setShowSince(false)
                .get();
            formatter.printHelp(" ", "", options, "", true);
            System.out.flush();
        } catch (java.io.IOException e) {
            // Should not happen with ByteArrayOutputStream.
            throw new RuntimeException(e);
        } finally {
            System.setOut(oldOut);
        }

        log(baos.toString());
        log("");
    }

    /**
     * Parser for CLI arguments.
     *
     * @param options Options instance.
     * @return Optional of CommandLine.
     */
    public Optional<CommandLine> parseArgs(Options options) {
        CommandLine cmd = null;

        try {
            cmd = new DefaultParser().parse(options, args, true);
        } catch (Exception e) {
            log("Options error: " + e.getMessage());
            log("");
            optionsUsage(options);
        }

        return Optional.ofNullable(cmd);
    }

    /**
     * Remove entry from string array.
     *
     * @param entry Entry string.
     */
    private void purgeArg(String entry) {
        List<String> list = new LinkedList<>(Arrays.asList(args));
        list.remove(entry);
        args = list.toArray(new String[0]);
    }

    /**
     * Gets args.
     *
     * @return String array.
     */
    public String[] getArgs() {
        return args;
    }

    /**
     * Gets exit code.
     *
     * @return Integer.
     */
    public int getExitCode() {
        return exitCode;
    }

    /**
     * Logging wrapper.
     *
     * @param string String.
     */
    public void log(String string) {
        System.out.println(string);
    }
}
