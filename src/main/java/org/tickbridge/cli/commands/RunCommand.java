package org.tickbridge.cli.commands;

import java.util.concurrent.Callable;
import java.util.concurrent.TimeUnit;

import org.tickbridge.cli.CommandLineInterface;
import org.tickbridge.cli.demo.DemoWorld;
import org.tickbridge.host.WorldHost;
import org.tickbridge.runtime.BridgeOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;
import picocli.CommandLine.Model.CommandSpec;

/**
 * Runs a demo world for a fixed number of ticks, with a message producer feeding it events
 * and a background task writing into it from the task runtime.
 */
@Command(
    name = "run",
    description = "Run a demo world with a channel bridge and a background task"
)
public class RunCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(RunCommand.class);

    @Option(
        names = {"--ticks"},
        description = "Number of ticks to run (default: tickbridge.host.maxTicks, or 50 if unlimited)"
    )
    private Long ticks;

    @Option(
        names = {"--interval"},
        description = "Milliseconds between ticks (default: tickbridge.host.tickIntervalMs)"
    )
    private Long intervalMs;

    @Option(
        names = {"--producer-period"},
        defaultValue = "250",
        description = "Milliseconds between produced messages (default: ${DEFAULT-VALUE})"
    )
    private long producerPeriodMs;

    @Option(
        names = {"--greet-after"},
        defaultValue = "5",
        description = "Ticks the background task sleeps before writing to the world (default: ${DEFAULT-VALUE})"
    )
    private long greetAfterTicks;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() throws InterruptedException {
        var out = spec.commandLine().getOut();
        var err = spec.commandLine().getErr();

        BridgeOptions options;
        try {
            options = BridgeOptions.fromConfig(parent.getConfig().getConfig("tickbridge"));
        } catch (IllegalArgumentException | ParameterException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }
        long tickLimit = ticks != null ? ticks : (options.maxTicks() > 0 ? options.maxTicks() : 50);
        if (tickLimit <= 0) {
            err.println("Error: --ticks must be positive");
            return 1;
        }
        options = options.withMaxTicks(tickLimit);
        if (intervalMs != null) {
            options = options.withTickInterval(intervalMs);
        }
        if (producerPeriodMs <= 0) {
            err.println("Error: --producer-period must be positive");
            return 1;
        }

        try (DemoWorld demo = new DemoWorld(options, producerPeriodMs, greetAfterTicks)) {
            demo.start();
            long budgetMs = tickLimit * Math.max(1, options.tickIntervalMs()) + TimeUnit.SECONDS.toMillis(10);
            if (!demo.awaitCompletion(budgetMs, TimeUnit.MILLISECONDS)) {
                err.println("Error: world did not finish within " + budgetMs + " ms");
                return 1;
            }
            WorldHost host = demo.getHost();
            DemoWorld.MessageStats stats = host.getWorld().resource(DemoWorld.MessageStats.class);
            out.printf("Ran %d ticks: %d messages produced, %d received, greeting at tick %d%n",
                    host.getBridge().currentTick(), demo.getProduced(), stats.received(), stats.lastGreetingTick());
            log.debug("Demo world finished in state {}", host.getCurrentState());
            return host.getCurrentState() == WorldHost.State.ERROR ? 1 : 0;
        }
    }
}
