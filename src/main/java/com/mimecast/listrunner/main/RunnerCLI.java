package com.mimecast.listrunner.main;

import com.mimecast.listrunner.Main;
import com.mimecast.listrunner.config.site.RunnerConfig;
import com.mimecast.listrunner.runner.Maintenance;
import com.mimecast.listrunner.runner.QueueRunner;
import com.mimecast.listrunner.runner.RunnerCron;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.naming.ConfigurationException;
import java.io.IOException;
import java.util.Optional;

/**
 * Queue runner command line.
 *
 * <ul>
 *     <li>{@code --runner} starts every enabled runner and blocks until shutdown.</li>
 *     <li>{@code --runner <name>} starts only the named runner.</li>
 *     <li>{@code --runner <name> --once} runs a single cycle and exits, for cron driven deployments.</li>
 *     <li>{@code --maintain} runs queue recovery, hold expiry and bounce maintenance once.</li>
 * </ul>
 */
public class RunnerCLI {
    private static final Logger log = LogManager.getLogger(RunnerCLI.class);

    public static final int EX_OK = 0;
    public static final int EX_USAGE = 64;
    public static final int EX_SOFTWARE = 70;
    public static final int EX_CONFIG = 78;

    private final Main main;

    /**
     * Constructs a new RunnerCLI instance.
     *
     * @param main Main instance.
     */
    public RunnerCLI(Main main) {
        this.main = main;
    }

    /**
     * Runs the command.
     *
     * @return Exit code.
     */
    public int run() {
        Optional<CommandLine> opt = main.parseArgs(options());
        if (opt.isEmpty()) {
            return EX_USAGE;
        }
        CommandLine cmd = opt.get();
        if (!cmd.hasOption("conf")) {
            main.optionsUsage(options());
            return EX_USAGE;
        }

        try {
            Foundation.init(cmd.getOptionValue("conf"));
        } catch (ConfigurationException e) {
            log.error("Configuration error: {}", e.getMessage());
            return EX_CONFIG;
        }

        if (cmd.hasOption("maintain")) {
            new Maintenance(Factories.getListDirectory(), Factories.getServices()).runAll();
            return EX_OK;
        }

        String name = cmd.getOptionValue("runner");
        try {
            if (cmd.hasOption("once")) {
                if (name == null) {
                    main.optionsUsage(options());
                    return EX_USAGE;
                }
                Optional<RunnerConfig> config = Config.getSite().getRunner(name);
                if (config.isEmpty()) {
                    log.error("No such runner: name={}", name);
                    return EX_USAGE;
                }
                QueueRunner runner = Factories.getRunner(config.get());
                int processed = runner.runOnce();
                main.log("Processed " + processed + " messages");
                return EX_OK;
            }

            RunnerCron.run(name);
            return EX_OK;
        } catch (IOException e) {
            log.error("Runner error: name={}, error={}", name, e.getMessage());
            return EX_SOFTWARE;
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
        options.addOption(Option.builder()
                .longOpt("runner")
                .hasArg()
                .optionalArg(true)
                .desc("Runner name, all enabled runners when omitted")
                .build());
        options.addOption(null, "once", false, "Run a single cycle and exit");
        options.addOption(null, "maintain", false, "Run maintenance once and exit");
        return options;
    }
}
