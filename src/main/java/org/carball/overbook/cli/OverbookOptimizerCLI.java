package org.carball.overbook.cli;

import lombok.extern.slf4j.Slf4j;
import org.carball.overbook.config.ConfigurationLoader;
import org.carball.overbook.config.OptimizationStrategy;
import org.carball.overbook.config.OptimizerConfig;
import org.carball.overbook.config.OutputFormat;
import org.carball.overbook.model.optimization.OptimizationResult;
import org.carball.overbook.model.schedule.ScheduleInput;
import org.carball.overbook.optimizer.EmptyScheduleException;
import org.carball.overbook.optimizer.ScheduleOptimizer;
import org.carball.overbook.output.OptimizationReport;
import org.carball.overbook.parser.ScheduleInputParser;
import org.carball.overbook.store.InMemoryOptimizationStore;
import org.carball.overbook.store.OptimizationService;
import org.carball.overbook.store.StoredOptimization;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Locale;

@Slf4j
public class OverbookOptimizerCLI {

    private static final String VERSION = "1.0.0";
    private static final String BANNER = """
        ╔═══════════════════════════════════════════════════════════════╗
        ║          No-Show Aware Schedule Optimizer v%s              ║
        ╚═══════════════════════════════════════════════════════════════╝
        """;

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        System.out.printf((BANNER) + "%n", VERSION);

        if (hasFlag(args, "--help-config")) {
            System.out.println(ConfigurationLoader.getConfigurationHelp());
            System.out.println(OptimizationStrategy.getStrategyHelp());
            return 0;
        }

        if (args.length < 1 || isHelpRequested(args)) {
            printUsage();
            return args.length < 1 ? 1 : 0;
        }

        try {
            CliOptions options = parseArgs(args);
            OptimizerConfig config = new ConfigurationLoader()
                    .loadConfiguration(options.strategy, options.settingsFile, args);

            System.out.println("\n🔍 Starting optimization...");
            System.out.println("   Schedule file: " + options.scheduleFile);
            System.out.println("   Strategy: " + config.getStrategy().getName());
            System.out.println();

            System.out.print("📅 Reading schedule... ");
            ScheduleInput input = new ScheduleInputParser().parse(options.scheduleFile);
            System.out.println("✓");
            if (options.verbose) {
                System.out.println("     - Date: " + input.date());
                System.out.println("     - Bookings: " + input.bookings().size());
                System.out.println("     - Providers: " + input.providerCalendars().size());
            }

            System.out.print("📊 Optimizing capacity... ");
            OptimizationService service = new OptimizationService(
                    new ScheduleOptimizer(config), new InMemoryOptimizationStore());
            StoredOptimization stored = service.optimizeAndStore(options.practiceId, options.providerId,
                    input.date(), input.bookings(), input.noShowProbabilities(), input.providerCalendars());
            System.out.println("✓");

            System.out.print("📝 Writing results... ");
            OptimizationReport report = new OptimizationReport(stored.result(), input.date(), config);
            writeReport(report, options);
            System.out.println("✓");

            printSummary(stored);
            System.out.println("\n✅ Optimization complete!");
            return 0;

        } catch (EmptyScheduleException e) {
            System.out.println("\n💡 " + e.getMessage() + ". Nothing to do.");
            return 0;
        } catch (IllegalArgumentException e) {
            System.err.println("\n❌ Configuration error: " + e.getMessage());
            System.err.println("\nRun with --help for usage information.");
            log.debug("Configuration error details", e);
            return 1;
        } catch (IOException e) {
            System.err.println("\n❌ IO error: " + e.getMessage());
            log.debug("IO error details", e);
            return 1;
        } catch (Exception e) {
            System.err.println("\n❌ Unexpected error: " + e.getMessage());
            log.debug("Unexpected error details", e);
            return 1;
        }
    }

    private static boolean isHelpRequested(String[] args) {
        return hasFlag(args, "--help") || hasFlag(args, "-h") || hasFlag(args, "help");
    }

    private static boolean hasFlag(String[] args, String flag) {
        return Arrays.asList(args).contains(flag);
    }

    private static void printUsage() {
        System.out.println("\nUsage: java -jar overbook-optimizer.jar <schedule-file> [options]");
        System.out.println();
        System.out.println("Arguments:");
        System.out.println("  schedule-file       YAML or JSON file with date, bookings, providerCalendars, noShowProbabilities");
        System.out.println();
        System.out.println("Options:");
        System.out.println("  --strategy, -s      Strategy: " + OptimizationStrategy.getAvailableStrategies() + " (default: balanced)");
        System.out.println("  --settings          YAML file with practice settings (optional)");
        System.out.println("  --output, -o        Output file for the report (default: optimization.json)");
        System.out.println("  --format, -f        Output format: json|markdown|both (default: json)");
        System.out.println("  --practice          Practice identifier recorded with the result");
        System.out.println("  --provider          Only optimize bookings for this provider");
        System.out.println("  --config.<name>     Override a single setting, see --help-config");
        System.out.println("  --verbose, -v       Enable verbose output");
        System.out.println("  --help, -h          Show this help message");
        System.out.println();
        System.out.println("Examples:");
        System.out.println("  java -jar overbook-optimizer.jar schedule.yml");
        System.out.println("  java -jar overbook-optimizer.jar schedule.yml --strategy aggressive --format both");
    }

    static CliOptions parseArgs(String[] args) {
        CliOptions options = new CliOptions();
        options.scheduleFile = Paths.get(args[0]);

        for (int i = 1; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--strategy":
                case "-s":
                    options.strategy = requireValue(args, ++i, "Strategy not specified");
                    OptimizationStrategy.fromName(options.strategy);
                    break;

                case "--settings":
                    options.settingsFile = Paths.get(requireValue(args, ++i, "Settings file not specified"));
                    break;

                case "--output":
                case "-o":
                    options.outputFile = requireValue(args, ++i, "Output file not specified");
                    break;

                case "--format":
                case "-f":
                    String format = requireValue(args, ++i, "Output format not specified");
                    try {
                        options.format = OutputFormat.valueOf(format.toUpperCase(Locale.ROOT));
                    } catch (IllegalArgumentException e) {
                        throw new IllegalArgumentException("Invalid output format. Use: json, markdown, or both");
                    }
                    break;

                case "--practice":
                    options.practiceId = requireValue(args, ++i, "Practice not specified");
                    break;

                case "--provider":
                    options.providerId = requireValue(args, ++i, "Provider not specified");
                    break;

                case "--verbose":
                case "-v":
                    options.verbose = true;
                    break;

                default:
                    if (arg.startsWith("--config.")) {
                        // Value is applied by ConfigurationLoader
                        requireValue(args, ++i, "Value not specified for " + arg);
                        break;
                    }
                    throw new IllegalArgumentException("Unknown option: " + arg);
            }
        }

        if (!Files.exists(options.scheduleFile)) {
            throw new IllegalArgumentException("Schedule file not found: " + options.scheduleFile);
        }

        Path outputDir = Paths.get(options.outputFile).toAbsolutePath().getParent();
        if (outputDir != null && !Files.exists(outputDir)) {
            throw new IllegalArgumentException("Output directory does not exist: " + outputDir);
        }

        return options;
    }

    private static String requireValue(String[] args, int index, String message) {
        if (index >= args.length) {
            throw new IllegalArgumentException(message);
        }
        return args[index];
    }

    private static void writeReport(OptimizationReport report, CliOptions options) throws IOException {
        String baseFileName = removeFileExtension(options.outputFile);

        if (options.format == OutputFormat.JSON || options.format == OutputFormat.BOTH) {
            Files.writeString(Paths.get(baseFileName + ".json"), report.toJson());
        }

        if (options.format == OutputFormat.MARKDOWN || options.format == OutputFormat.BOTH) {
            Files.writeString(Paths.get(baseFileName + ".md"), report.toMarkdown());
        }
    }

    static String removeFileExtension(String filename) {
        int lastDotIndex = filename.lastIndexOf('.');
        if (lastDotIndex > 0 && lastDotIndex < filename.length() - 1) {
            int lastSeparatorIndex = Math.max(filename.lastIndexOf('/'), filename.lastIndexOf('\\'));
            if (lastDotIndex > lastSeparatorIndex) {
                return filename.substring(0, lastDotIndex);
            }
        }
        return filename;
    }

    private static void printSummary(StoredOptimization stored) {
        OptimizationResult result = stored.result();

        System.out.println("\n" + "=".repeat(60));
        System.out.println("📊 OPTIMIZATION SUMMARY");
        System.out.println("=".repeat(60));

        System.out.println("\nOptimization id: " + stored.id());
        System.out.println("Slots: " + result.totalSlots());
        System.out.println("Changes: " + result.changes().size());
        System.out.println("Added capacity: " + result.addedCapacity());
        System.out.printf(Locale.ROOT, "Predicted revenue gain: %.2f%n", result.predictedRevenueGain());
        System.out.printf(Locale.ROOT, "Optimization score: %.3f%n", result.optimizationScore());

        if (!result.recommendations().isEmpty()) {
            System.out.println("\n🎯 Recommendations:");
            System.out.println("-".repeat(60));
            result.recommendations().forEach(r -> System.out.println("  - " + r));
        }
    }

    static class CliOptions {
        Path scheduleFile;
        String strategy;
        Path settingsFile;
        String outputFile = "optimization.json";
        OutputFormat format = OutputFormat.JSON;
        String practiceId = "default";
        String providerId;
        boolean verbose;
    }
}
