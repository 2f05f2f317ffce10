package com.regolith.cli;

import com.regolith.core.flavor.FlagInfo;
import com.regolith.core.flavor.Flavor;
import com.regolith.core.flavor.FlavorRegistry;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to list available regex flavors.
 *
 * <p>Discovers flavors via Java Service Provider Interface (SPI) and displays their
 * flags and supported features.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * regolith flavors
 * }</pre>
 */
@Command(
    name = "flavors",
    description = "List available regex flavors",
    mixinStandardHelpOptions = true
)
public class FlavorsCommand implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    private final FlavorRegistry registry;

    public FlavorsCommand() {
        this(FlavorRegistry.loadDefault());
    }

    public FlavorsCommand(FlavorRegistry registry) {
        this.registry = registry;
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        out.println("Available Flavors:");
        out.println();

        if (registry.isEmpty()) {
            out.println("  No flavors found.");
            out.flush();
            return 0;
        }

        for (Flavor flavor : registry.all()) {
            out.printf("  • %s (ID: %s)%n", flavor.getDisplayName(), flavor.getId());
            out.printf("    Flags: %s%n", describeFlags(flavor.getSupportedFlags()));
            List<String> features = flavor.getSupportedFeatures().enabledFeatures();
            out.printf("    Features: %s%n", features.isEmpty() ? "none" : String.join(", ", features));
            out.println();
        }
        out.flush();
        return 0;
    }

    private static String describeFlags(List<FlagInfo> flags) {
        if (flags.isEmpty()) {
            return "none";
        }
        StringBuilder sb = new StringBuilder();
        for (FlagInfo flag : flags) {
            if (sb.length() > 0) {
                sb.append(", ");
            }
            sb.append(flag.flag()).append(" (").append(flag.name()).append(')');
        }
        return sb.toString();
    }
}
