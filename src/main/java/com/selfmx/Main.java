package com.selfmx;

import com.selfmx.auth.AdminLoginService;
import com.selfmx.main.Server;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Optional;

/**
 * Main runnable.
 *
 * <p>Implements the commandline {@code --server <dir>} and {@code --hash-password <password>} options.
 */
public class Main {
    private static final Logger log = LogManager.getLogger(Main.class);

    /**
     * Application jar name.
     */
    private static final String NAME = "selfmx.jar";

    /**
     * Application jar usage.
     */
    public static final String USAGE = "java -jar " + NAME;

    /**
     * Application description.
     */
    public static final String DESCRIPTION = "Self-hosted email sending gateway";

    private final String[] args;

    /**
     * Main runnable.
     *
     * @param args String array.
     */
    public static void main(String[] args) {
        new Main(args).run();
    }

    /**
     * Constructs a new Main instance.
     *
     * @param args String array.
     */
    Main(String[] args) {
        this.args = args;
    }

    /**
     * Dispatches to the selected command.
     *
     * @return Process exit code.
     */
    int run() {
        Optional<CommandLine> opt = parseArgs(options());
        if (opt.isEmpty()) {
            return 1;
        }
        CommandLine cmd = opt.get();

        if (cmd.hasOption("hash-password")) {
            print(AdminLoginService.hashPassword(cmd.getOptionValue("hash-password")));
            return 0;
        }

        if (cmd.hasOption("server")) {
            String path = cmd.getOptionValue("server", "cfg");
            try {
                Server.run(path);
                return 0;
            } catch (IOException | RuntimeException e) {
                log.fatal("Unable to start gateway from {}: {}", path, e.getMessage(), e);
                System.exit(1);
                return 1;
            }
        }

        optionsUsage(options());
        return 1;
    }

    /**
     * CLI options.
     *
     * @return Options instance.
     */
    Options options() {
        Options options = new Options();
        options.addOption(Option.builder()
                .longOpt("server")
                .hasArg()
                .optionalArg(true)
                .argName("dir")
                .desc("Run the gateway with the configuration directory (default cfg)")
                .build());
        options.addOption(Option.builder()
                .longOpt("hash-password")
                .hasArg()
                .argName("password")
                .desc("Print the bcrypt hash for admin.passwordHash")
                .build());
        return options;
    }

    /**
     * CLI usage.
     *
     * @param options Options instance.
     */
    void optionsUsage(Options options) {
        StringWriter out = new StringWriter();
        try (PrintWriter pw = new PrintWriter(out)) {
            new HelpFormatter().printHelp(pw, 100, USAGE, DESCRIPTION, options, 1, 2, "", true);
        }
        print(out.toString());
    }

    /**
     * Parser for CLI arguments.
     *
     * @param options Options instance.
     * @return Optional of CommandLine.
     */
    Optional<CommandLine> parseArgs(Options options) {
        try {
            return Optional.of(new DefaultParser().parse(options, args));
        } catch (ParseException e) {
            print("Options error: " + e.getMessage());
            print("");
            optionsUsage(options);
            return Optional.empty();
        }
    }

    /**
     * Console output.
     *
     * @param string String.
     */
    void print(String string) {
        System.out.println(string);
    }
}
