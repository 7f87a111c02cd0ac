package org.carball.overbook.config;

import lombok.Getter;

import java.util.Locale;

@Getter
public enum OptimizationStrategy {

    CONSERVATIVE("conservative", "Conservative approach - minimize patient wait times", 0.8),

    BALANCED("balanced", "Balanced approach - default settings for most practices", 1.0),

    AGGRESSIVE("aggressive", "Aggressive approach - overbook more for higher revenue", 1.2);

    private final String name;
    private final String description;
    private final double overbookFactor;

    OptimizationStrategy(String name, String description, double overbookFactor) {
        this.name = name;
        this.description = description;
        this.overbookFactor = overbookFactor;
    }

    /**
     * Creates an OptimizerConfig with default limits and this strategy selected.
     */
    public OptimizerConfig buildConfig() {
        return OptimizerConfig.builder()
                .strategy(this)
                .build();
    }

    /**
     * Finds strategy by name (case-insensitive).
     */
    public static OptimizationStrategy fromName(String name) {
        for (OptimizationStrategy strategy : values()) {
            if (strategy.getName().equalsIgnoreCase(name)) {
                return strategy;
            }
        }
        throw new IllegalArgumentException("Unknown optimization strategy: " + name +
                ". Available strategies: " + getAvailableStrategies());
    }

    /**
     * Returns a comma-separated list of available strategy names.
     */
    public static String getAvailableStrategies() {
        StringBuilder sb = new StringBuilder();
        for (OptimizationStrategy strategy : values()) {
            if (!sb.isEmpty()) sb.append(", ");
            sb.append(strategy.getName());
        }
        return sb.toString();
    }

    public static String getStrategyHelp() {
        StringBuilder help = new StringBuilder();
        help.append("Available Optimization Strategies:\n\n");
        for (OptimizationStrategy strategy : values()) {
            help.append(String.format(Locale.ROOT, "  %-15s %s (overbook factor %.1f)\n",
                    strategy.getName(), strategy.getDescription(), strategy.getOverbookFactor()));
        }
        help.append("\nUse --strategy <name> to select a strategy.\n");
        return help.toString();
    }
}
