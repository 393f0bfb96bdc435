package org.tickbridge.cli.demo;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

import org.tickbridge.host.WorldHost;
import org.tickbridge.runtime.BridgeHandle;
import org.tickbridge.runtime.BridgeOptions;
import org.tickbridge.runtime.channels.EventChannel;
import org.tickbridge.world.EventReader;
import org.tickbridge.world.World;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Small end-to-end setup exercising both directions of the bridge: an external producer
 * feeding {@link TextMessage} events into the world, and a background task that waits for
 * ticks and then writes into the world from its thread.
 */
public class DemoWorld implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DemoWorld.class);

    /**
     * World resource counting the messages seen by the listening system.
     */
    public static final class MessageStats {
        private int received;
        private long lastGreetingTick = -1;

        public int received() {
            return received;
        }

        public long lastGreetingTick() {
            return lastGreetingTick;
        }
    }

    private final WorldHost host;
    private final EventChannel<TextMessage> channel = new EventChannel<>("text-messages");
    private final ScheduledExecutorService producer = Executors.newSingleThreadScheduledExecutor(runnable -> {
        Thread thread = new Thread(runnable, "text-producer");
        thread.setDaemon(true);
        return thread;
    });
    private final AtomicInteger produced = new AtomicInteger();
    private final long producerPeriodMs;

    /**
     * @param options          bridge and host options, the tick limit ends the demo
     * @param producerPeriodMs interval between produced messages
     * @param greetAfterTicks  ticks the background task sleeps before greeting the world
     */
    public DemoWorld(BridgeOptions options, long producerPeriodMs, long greetAfterTicks) {
        this.producerPeriodMs = producerPeriodMs;
        World world = new World();
        world.insertResource(MessageStats.class, new MessageStats());
        this.host = new WorldHost("demo-world", world, options);
        host.addStartupSystem(bridge -> setUp(bridge, greetAfterTicks));
        host.addSystem("listen-for-text", new TextListener());
    }

    private void setUp(BridgeHandle bridge, long greetAfterTicks) {
        bridge.addEventChannel(TextMessage.class, channel);
        bridge.spawnBackgroundTask(context -> {
            log.info("Background task running on '{}'", Thread.currentThread().getName());
            return context.sleepUpdates(greetAfterTicks)
                    .thenCompose(ignored -> context.runOnMainThread(main -> {
                        MessageStats stats = main.world().resource(MessageStats.class);
                        stats.lastGreetingTick = main.currentTick();
                        return main.currentTick();
                    }))
                    .thenAccept(tick -> log.info("Background task greeted the world at tick {}", tick));
        });
    }

    /**
     * Per-tick system logging every new text event.
     */
    private static final class TextListener implements Consumer<World> {
        private EventReader<TextMessage> reader;

        @Override
        public void accept(World world) {
            if (reader == null) {
                reader = world.events(TextMessage.class).reader();
            }
            MessageStats stats = world.resource(MessageStats.class);
            for (TextMessage message : reader.read()) {
                stats.received++;
                log.info("Event from {}: {}", message.sender(), message.text());
            }
        }
    }

    public void start() {
        host.start();
        producer.scheduleAtFixedRate(() -> {
            int number = produced.incrementAndGet();
            if (!channel.send(new TextMessage("producer", "message #" + number))) {
                produced.decrementAndGet();
            }
        }, 0, producerPeriodMs, TimeUnit.MILLISECONDS);
    }

    /**
     * @return true if the world reached its tick limit within the timeout
     */
    public boolean awaitCompletion(long timeout, TimeUnit unit) throws InterruptedException {
        return host.awaitTermination(timeout, unit);
    }

    public WorldHost getHost() {
        return host;
    }

    public int getProduced() {
        return produced.get();
    }

    @Override
    public void close() {
        producer.shutdownNow();
        channel.close();
        host.stop();
    }
}
