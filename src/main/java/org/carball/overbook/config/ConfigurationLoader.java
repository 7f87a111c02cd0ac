package org.carball.overbook.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.function.Consumer;

@Slf4j
public class ConfigurationLoader {

    private final Map<String, String> environment;

    public ConfigurationLoader() {
        this(System.getenv());
    }

    public ConfigurationLoader(Map<String, String> environment) {
        this.environment = environment;
    }

    /**
     * Loads configuration using the hierarchy: CLI args > env vars > defaults
     */
    public OptimizerConfig loadConfiguration(String[] args) {
        log.debug("Loading configuration");

        OptimizerConfig.OptimizerConfigBuilder builder = OptimizerConfig.builder();

        applyEnvironmentVariables(builder);
        applyCLIArguments(builder, args);

        OptimizerConfig config = builder.build();
        config.validate();

        log.info("Configuration loaded: {}", config.getConfigurationSummary());
        return config;
    }

    /**
     * Loads configuration from a named strategy profile.
     */
    public OptimizerConfig loadStrategy(String strategyName) {
        try {
            OptimizationStrategy strategy = OptimizationStrategy.fromName(strategyName);
            OptimizerConfig config = strategy.buildConfig();
            log.info("Loaded strategy '{}': {}", strategyName, config.getConfigurationSummary());
            return config;
        } catch (IllegalArgumentException e) {
            log.error("Unknown strategy: {}. {}", strategyName, e.getMessage());
            throw e;
        }
    }

    /**
     * Loads the strategy profile, overlays the practice settings file when given,
     * then environment variables and CLI arguments.
     */
    public OptimizerConfig loadConfiguration(String strategyName, Path settingsFile, String[] args) {
        OptimizerConfig.OptimizerConfigBuilder builder = strategyName != null
                ? loadStrategy(strategyName).toBuilder()
                : OptimizerConfig.builder();

        if (settingsFile != null) {
            loadPracticeSettings(settingsFile).applyTo(builder);
        }

        applyEnvironmentVariables(builder);
        applyCLIArguments(builder, args);

        OptimizerConfig config = builder.build();
        config.validate();

        log.info("Configuration loaded: {}", config.getConfigurationSummary());
        return config;
    }

    /**
     * Reads practice settings from a YAML or JSON file.
     */
    public PracticeSettings loadPracticeSettings(Path settingsFile) {
        if (!Files.exists(settingsFile)) {
            throw new IllegalArgumentException("Settings file not found: " + settingsFile);
        }
        try {
            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            PracticeSettings settings = mapper.readValue(settingsFile.toFile(), PracticeSettings.class);
            log.info("Loaded practice settings from: {}", settingsFile);
            return settings;
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed to read settings file " + settingsFile + ": " + e.getMessage(), e);
        }
    }

    private void applyEnvironmentVariables(OptimizerConfig.OptimizerConfigBuilder builder) {
        applyEnvironmentVariable("OVERBOOK_STRATEGY",
                value -> builder.strategy(OptimizationStrategy.fromName(value)));
        applyEnvironmentVariable("OVERBOOK_MAX_PERCENTAGE",
                value -> builder.maxOverbookPct(Double.parseDouble(value)));
        applyEnvironmentVariable("OVERBOOK_MIN_NO_SHOW_THRESHOLD",
                value -> builder.minNoShowThreshold(Double.parseDouble(value)));
        applyEnvironmentVariable("OVERBOOK_BUFFER_MINUTES",
                value -> builder.bufferMinutes(Integer.parseInt(value)));
        applyEnvironmentVariable("OVERBOOK_AVG_BOOKING_VALUE",
                value -> builder.avgBookingValue(Double.parseDouble(value)));
        applyEnvironmentVariable("OVERBOOK_FILL_RATE",
                value -> builder.fillRate(Double.parseDouble(value)));
    }

    private void applyEnvironmentVariable(String name, Consumer<String> setter) {
        String value = environment.get(name);
        if (value == null) {
            return;
        }
        try {
            setter.accept(value);
        } catch (NumberFormatException e) {
            log.warn("Invalid numeric value for {}: {}", name, value);
        }
    }

    private void applyCLIArguments(OptimizerConfig.OptimizerConfigBuilder builder, String[] args) {
        for (int i = 0; i < args.length - 1; i++) {
            String arg = args[i];
            String value = args[i + 1];

            try {
                switch (arg) {
                    case "--strategy":
                    case "-s":
                        builder.strategy(OptimizationStrategy.fromName(value));
                        break;
                    case "--config.max-overbook":
                        builder.maxOverbookPct(Double.parseDouble(value));
                        break;
                    case "--config.min-no-show":
                        builder.minNoShowThreshold(Double.parseDouble(value));
                        break;
                    case "--config.buffer-minutes":
                        builder.bufferMinutes(Integer.parseInt(value));
                        break;
                    case "--config.default-probability":
                        builder.defaultNoShowProbability(Double.parseDouble(value));
                        break;
                    case "--config.booking-value":
                        builder.avgBookingValue(Double.parseDouble(value));
                        break;
                    case "--config.fill-rate":
                        builder.fillRate(Double.parseDouble(value));
                        break;
                    case "--config.high-risk":
                        builder.highRiskThreshold(Double.parseDouble(value));
                        break;
                    case "--config.top-n":
                        builder.rescheduleTopN(Integer.parseInt(value));
                        break;
                    case "--config.scan-budget":
                        builder.dayScanBudget(Integer.parseInt(value));
                        break;
                }
            } catch (NumberFormatException e) {
                log.warn("Invalid numeric value for {}: {}", arg, value);
            }
        }
    }

    /**
     * Returns help text for configuration options.
     */
    public static String getConfigurationHelp() {
        return """
            Configuration Options:

            CLI Arguments:
              --config.max-overbook <num>          Max overbook fraction of a slot's bookings (default 0.15)
              --config.min-no-show <num>           Expected no-shows needed before overbooking (default 0.10)
              --config.buffer-minutes <num>        Recovery gap after each slot (default 5)
              --config.default-probability <num>   No-show probability for unscored bookings (default 0.1)
              --config.booking-value <num>         Average booking value for revenue estimates (default 150.0)
              --config.fill-rate <num>             Share of added capacity expected to fill (default 0.7)
              --config.high-risk <num>             Probability above which a booking is high risk (default 0.4)
              --config.top-n <num>                 Reschedule suggestions returned (default 3)
              --config.scan-budget <num>           Suggestions collected by the day scan (default 5)

            Environment Variables:
              OVERBOOK_STRATEGY                    Same as --strategy
              OVERBOOK_MAX_PERCENTAGE              Same as --config.max-overbook
              OVERBOOK_MIN_NO_SHOW_THRESHOLD       Same as --config.min-no-show
              OVERBOOK_BUFFER_MINUTES              Same as --config.buffer-minutes
              OVERBOOK_AVG_BOOKING_VALUE           Same as --config.booking-value
              OVERBOOK_FILL_RATE                   Same as --config.fill-rate

            Priority Order (highest to lowest):
              1. CLI arguments
              2. Environment variables
              3. Practice settings file
              4. Strategy defaults or built-in defaults
            """;
    }
}
