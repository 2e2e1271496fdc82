package com.mimecast.listrunner.main;

import com.mimecast.listrunner.Main;
import com.mimecast.listrunner.entry.MalformedMessageException;
import com.mimecast.listrunner.entry.QueueEntry;
import com.mimecast.listrunner.entry.Role;
import com.mimecast.listrunner.entry.UnknownListException;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.Options;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.naming.ConfigurationException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.Optional;

/**
 * Queue entry command line.
 *
 * <p>Invoked by the mail transport once per inbound message, the message is read from standard input.
 * <p>Exit codes follow sysexits so the transport knows when to retry.
 */
public class EntryCLI {
    private static final Logger log = LogManager.getLogger(EntryCLI.class);

    public static final int EX_OK = 0;
    public static final int EX_USAGE = 64;
    public static final int EX_DATAERR = 65;
    public static final int EX_NOUSER = 67;
    public static final int EX_TEMPFAIL = 75;

    private final Main main;
    private final InputStream input;

    /**
     * Constructs a new EntryCLI instance reading standard input.
     *
     * @param main Main instance.
     */
    public EntryCLI(Main main) {
        this(main, System.in);
    }

    /**
     * Constructs a new EntryCLI instance with given input.
     *
     * @param main  Main instance.
     * @param input Message input stream.
     */
    public EntryCLI(Main main, InputStream input) {
        this.main = main;
        this.input = input;
    }

    /**
     * Runs the entry.
     *
     * @return Exit code.
     */
    public int run() {
        Optional<CommandLine> opt = main.parseArgs(options());
        if (opt.isEmpty()) {
            return EX_USAGE;
        }
        CommandLine cmd = opt.get();

        String listName = cmd.getOptionValue("list");
        if (listName == null && !cmd.getArgList().isEmpty()) {
            listName = cmd.getArgList().get(0);
        }
        Optional<Role> role = Role.fromName(cmd.getOptionValue("role", "post"));
        if (!cmd.hasOption("conf") || listName == null || role.isEmpty()) {
            main.optionsUsage(options());
            return EX_USAGE;
        }

        try {
            Foundation.init(cmd.getOptionValue("conf"));

            byte[] raw;
            if (cmd.hasOption("file")) {
                raw = Files.readAllBytes(Paths.get(cmd.getOptionValue("file")));
            } else {
                raw = input.readAllBytes();
            }

            QueueEntry entry = new QueueEntry(Factories.getListDirectory(), Factories.getSwitchboards(), Factories.getClock());
            entry.submit(listName, role.get(), raw, cmd.getOptionValue("sender"));
            return EX_OK;
        } catch (UnknownListException e) {
            log.error("Entry refused: list={}, error={}", listName, e.getMessage());
            return EX_NOUSER;
        } catch (MalformedMessageException e) {
            log.error("Entry refused: list={}, error={}", listName, e.getMessage());
            return EX_DATAERR;
        } catch (ConfigurationException | IOException e) {
            log.error("Entry failed: list={}, error={}", listName, e.getMessage());
            return EX_TEMPFAIL;
        }
    }

    /**
     * CLI options.
     *
     * @return Options instance.
     */
    private Options options() {
        Options options = new Options();
        options.addOption(null, "conf", true, "Configuration directory");
        options.addOption(null, "list", true, "Target list name");
        options.addOption(null, "role", true, "Address role: post, owner, request, join, leave, bounces");
        options.addOption(null, "sender", true, "Envelope sender");
        options.addOption(null, "file", true, "Read the message from file instead of standard input");
        return options;
    }
}
