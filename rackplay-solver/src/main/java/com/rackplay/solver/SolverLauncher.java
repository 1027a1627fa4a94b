package com.rackplay.solver;

import com.rackplay.common.CommonModule;
import com.rackplay.common.factory.ObjectFactory;
import com.rackplay.common.lifecycle.ExitService;
import com.rackplay.common.lifecycle.LifecycleModule;
import com.rackplay.common.lifecycle.LifecycleService;
import com.rackplay.common.tile.TileParser;
import com.rackplay.solver.play.BestPlay;
import java.nio.file.Path;
import java.util.concurrent.ExecutionException;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds the best play of a single rack from the command line.
 *
 * <pre>rackplay-solver [--no-discard] [--common] [--short] [--verify] [--longest N] [--most N] RACK</pre>
 */
public final class SolverLauncher {

    private static final Logger LOGGER = LoggerFactory.getLogger(SolverLauncher.class);

    private static final String HELP_OPTION = "help";
    private static final String NO_DISCARD_OPTION = "no-discard";
    private static final String COMMON_OPTION = "common";
    private static final String SHORT_OPTION = "short";
    private static final String VERIFY_OPTION = "verify";
    private static final String LONGEST_OPTION = "longest";
    private static final String MOST_OPTION = "most";

    private static final Options OPTIONS = createOptions();

    private SolverLauncher() {}

    public static void main(final String[] args) {
        final Invocation invocation;
        try {
            invocation = parse(args);
        } catch (final IllegalArgumentException e) {
            LOGGER.error("{}", e.getMessage());
            printHelp();
            System.exit(ExitService.Code.FAILURE.ordinal());
            return;
        }
        if (invocation.help()) {
            printHelp();
            return;
        }

        final var factory = ObjectFactory.create(
                new CommonModule(),
                new LifecycleModule(),
                new SolverModule(),
                binder -> {
                    binder.bind(Path.class).named("directory").toInst(Path.of(""));
                    binder.bind(ExitService.class).toInst(code -> System.exit(code.ordinal()));
                });
        final var lifecycle = factory.get(LifecycleService.class);
        lifecycle.load();

        var code = ExitService.Code.SUCCESS;
        try {
            final var play = factory.get(RackOptimizer.class)
                    .optimize(invocation.rack(), invocation.options())
                    .get();
            report(play);
        } catch (final ExecutionException e) {
            LOGGER.error("Failed to compute the best play of {}", invocation.rack(), e.getCause());
            code = ExitService.Code.FAILURE;
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            code = ExitService.Code.FAILURE;
        }
        lifecycle.exit(code);
    }

    private static Options createOptions() {
        final var options = new Options();
        options.addOption(Option.builder("h")
                .longOpt(HELP_OPTION)
                .desc("Show this help page.")
                .build());
        options.addOption(Option.builder()
                .longOpt(NO_DISCARD_OPTION)
                .desc("Penalize every leftover tile instead of discarding the most valuable one.")
                .build());
        options.addOption(Option.builder()
                .longOpt(COMMON_OPTION)
                .desc("Only play words the frequency list considers common.")
                .build());
        options.addOption(Option.builder()
                .longOpt(SHORT_OPTION)
                .desc("With --common, admit every two and three letter word.")
                .build());
        options.addOption(Option.builder()
                .longOpt(VERIFY_OPTION)
                .desc("Check the chosen words against the online dictionary.")
                .build());
        options.addOption(Option.builder()
                .longOpt(LONGEST_OPTION)
                .hasArg()
                .argName("N")
                .type(Number.class)
                .desc("Longest word length to beat for the longest word bonus.")
                .build());
        options.addOption(Option.builder()
                .longOpt(MOST_OPTION)
                .hasArg()
                .argName("N")
                .type(Number.class)
                .desc("Word count to beat for the most words bonus.")
                .build());
        return options;
    }

    private static void printHelp() {
        new HelpFormatter()
                .printHelp(
                        "rackplay-solver [options] RACK",
                        "Find the best play of a rack, digraphs in parentheses, e.g. \"(qu)ote\".",
                        OPTIONS,
                        "",
                        false);
    }

    static Invocation parse(final String[] args) {
        final CommandLine line;
        try {
            line = new DefaultParser().parse(OPTIONS, args);
        } catch (final ParseException e) {
            throw new IllegalArgumentException(e.getMessage(), e);
        }
        if (line.hasOption(HELP_OPTION)) {
            return new Invocation(true, "", OptimizeOptions.DEFAULT);
        }
        if (line.getArgList().isEmpty()) {
            throw new IllegalArgumentException("Missing rack");
        }
        var options = OptimizeOptions.DEFAULT
                .withNoDiscard(line.hasOption(NO_DISCARD_OPTION))
                .withVerifyOnline(line.hasOption(VERIFY_OPTION));
        if (line.hasOption(COMMON_OPTION)) {
            options = options.withCommonOnly(line.hasOption(SHORT_OPTION), 0);
        }
        options = options.withThresholds(parseCount(line, LONGEST_OPTION), parseCount(line, MOST_OPTION));
        return new Invocation(false, String.join(" ", line.getArgList()), options);
    }

    private static int parseCount(final CommandLine line, final String option) {
        if (!line.hasOption(option)) {
            return 0;
        }
        final var raw = line.getOptionValue(option);
        try {
            if (line.getParsedOptionValue(option) instanceof Long count && count >= 0 && count <= Integer.MAX_VALUE) {
                return count.intValue();
            }
        } catch (final ParseException e) {
            throw new IllegalArgumentException("Not a count for --" + option + ": " + raw, e);
        }
        throw new IllegalArgumentException("Not a count for --" + option + ": " + raw);
    }

    /**
     * A parsed command line.
     *
     * @param help whether only the help page was asked for
     * @param rack the rack in tile notation, the positional arguments joined by spaces
     * @param options the optimization options
     */
    record Invocation(boolean help, String rack, OptimizeOptions options) {}

    private static void report(final BestPlay play) {
        if (play.isEmpty()) {
            LOGGER.info("No playable words found, leftover penalty {}", play.leftoverPenalty());
            return;
        }
        for (final var word : play.words()) {
            LOGGER.info("  {} ({})", word.display(), word.score());
        }
        LOGGER.info(
                "Base {} - leftover {} + longest {} + most {} = {}",
                play.baseScore(),
                play.leftoverPenalty(),
                play.bonus().longest(),
                play.bonus().most(),
                play.totalScore());
        if (play.discardTile() != null) {
            LOGGER.info("Discard {}", TileParser.display(play.discardTile()));
        }
        if (!play.unusedTiles().isEmpty()) {
            LOGGER.info("Unused {}", TileParser.display(play.unusedTiles()));
        }
    }
}
