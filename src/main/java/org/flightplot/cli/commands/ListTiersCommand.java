package org.flightplot.cli.commands;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

import org.flightplot.cli.CommandLineInterface;
import org.flightplot.export.ConfigurationException;
import org.flightplot.export.FrameStepPolicy;
import org.flightplot.export.QualityProfile;
import org.flightplot.export.QualityProfileResolver;

import com.typesafe.config.ConfigException;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Prints the configured quality tiers.
 */
@Command(name = "tiers", description = "Lists the configured quality tiers.")
public class ListTiersCommand implements Callable<Integer> {

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        QualityProfileResolver resolver;
        try {
            resolver = QualityProfileResolver.fromApplicationConfig(parent.getConfig());
        } catch (IllegalArgumentException | ConfigException e) {
            err.println("Failed to load configuration: " + e.getMessage());
            return CommandLineInterface.EXIT_FAILURE;
        }

        out.println(String.format("%-14s %-14s %-10s %-6s %-18s %-8s %s",
            "TIER", "LABEL", "SIZE", "SCALE", "COLORS", "DELAY", "SAMPLING"));
        int exitCode = CommandLineInterface.EXIT_OK;
        for (String tier : resolver.tierNames()) {
            try {
                QualityProfile profile = resolver.profile(tier);
                out.println(String.format("%-14s %-14s %-10s %-6.2f %-18s %-8s %s",
                    tier, profile.label(),
                    profile.targetWidth() + "x" + profile.targetHeight(),
                    profile.rasterScale(),
                    profile.colorEncoding(),
                    profile.perFrameDurationMs() + "ms",
                    describe(profile)));
            } catch (ConfigurationException e) {
                err.println(e.getMessage());
                exitCode = CommandLineInterface.EXIT_FAILURE;
            }
        }
        out.flush();
        return exitCode;
    }

    private static String describe(QualityProfile profile) {
        String budget = profile.maxFrameBudget().isPresent()
            ? ", at most " + profile.maxFrameBudget().getAsInt() + " frames" : "";
        FrameStepPolicy policy = profile.frameStepPolicy();
        if (policy instanceof FrameStepPolicy.Threshold threshold) {
            return "stride max(1, n/" + threshold.threshold() + ")" + budget;
        }
        if (policy instanceof FrameStepPolicy.Buckets buckets) {
            return buckets.buckets().size() + " size buckets" + budget;
        }
        return policy.getClass().getSimpleName() + budget;
    }
}
