package org.tickbridge.runtime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

import org.tickbridge.junit.extensions.logging.ExpectLog;
import org.tickbridge.junit.extensions.logging.LogLevel;
import org.tickbridge.junit.extensions.logging.LogWatchExtension;
import org.tickbridge.runtime.api.ClockClosedException;
import org.tickbridge.runtime.api.ResponseLostException;
import org.tickbridge.runtime.api.WorldUnavailableException;
import org.tickbridge.world.World;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import com.typesafe.config.ConfigFactory;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class TaskContextTest {

    private World world;
    private BridgeHandle bridge;

    @BeforeEach
    void setUp() {
        world = new World();
        bridge = new BridgeHandle(world, BridgeOptions.fromConfig(ConfigFactory.parseString("runtime.threads = 2")));
    }

    @AfterEach
    void tearDown() {
        bridge.close();
    }

    /**
     * Spawns a task exposing its context and waits until the task is running.
     */
    private TaskContext spawnIdleTask() {
        AtomicReference<TaskContext> captured = new AtomicReference<>();
        bridge.spawnBackgroundTask(context -> {
            captured.set(context);
            return new CompletableFuture<Void>();
        });
        await().atMost(2, TimeUnit.SECONDS).until(() -> captured.get() != null);
        return captured.get();
    }

    @Test
    void currentTickReflectsPumpedTicks() {
        TaskContext context = spawnIdleTask();
        assertThat(context.currentTick()).isZero();

        bridge.tickPump();
        bridge.tickPump();

        assertThat(context.currentTick()).isEqualTo(2);
    }

    @Test
    void sleepResumesOnlyAfterRequestedTicks() {
        TaskContext context = spawnIdleTask();
        CompletableFuture<Void> sleep = context.sleepUpdates(3);

        bridge.tickPump();
        bridge.tickPump();
        await().during(Duration.ofMillis(100)).atMost(Duration.ofSeconds(1)).until(() -> !sleep.isDone());

        bridge.tickPump();
        await().atMost(2, TimeUnit.SECONDS).until(sleep::isDone);
        assertThat(sleep).isCompleted();
        assertThat(context.currentTick()).isGreaterThanOrEqualTo(3);
    }

    @Test
    void sleepResumesExactlyOnceWhenTicksCoalesce() {
        AtomicInteger resumptions = new AtomicInteger();
        AtomicLong observedTick = new AtomicLong(-1);
        TaskHandle<Void> task = bridge.spawnBackgroundTask(context -> context.sleepUpdates(3)
                .thenRun(() -> {
                    resumptions.incrementAndGet();
                    observedTick.set(context.currentTick());
                }));
        await().atMost(2, TimeUnit.SECONDS).until(() -> task.getState() == TaskState.SLEEPING);

        // Three advances in a row; the task never gets to observe ticks 1 and 2 individually.
        bridge.tickPump();
        bridge.tickPump();
        bridge.tickPump();

        await().atMost(2, TimeUnit.SECONDS).until(task::isDone);
        assertThat(resumptions).hasValue(1);
        assertThat(observedTick.get()).isGreaterThanOrEqualTo(3);
        assertThat(task.getState()).isEqualTo(TaskState.COMPLETED);
    }

    @Test
    void sleepStillResumesWhenMoreTicksPassThanRequested() {
        TaskContext context = spawnIdleTask();
        CompletableFuture<Void> sleep = context.sleepUpdates(2);

        for (int i = 0; i < 10; i++) {
            bridge.tickPump();
        }

        await().atMost(2, TimeUnit.SECONDS).until(sleep::isDone);
        assertThat(sleep).isCompleted();
    }

    @Test
    void sleepAcrossTickWraparoundResumesOnce() {
        bridge.close();
        bridge = new BridgeHandle(world, BridgeOptions.defaults(), -2L);
        AtomicInteger resumptions = new AtomicInteger();
        TaskHandle<Void> task = bridge.spawnBackgroundTask(context -> context.sleepUpdates(3)
                .thenRun(resumptions::incrementAndGet));
        await().atMost(2, TimeUnit.SECONDS).until(() -> task.getState() == TaskState.SLEEPING);

        assertThat(bridge.tickPump().tick()).isEqualTo(-1L);
        assertThat(bridge.tickPump().tick()).isZero();
        await().during(Duration.ofMillis(100)).atMost(Duration.ofSeconds(1)).until(() -> !task.isDone());

        assertThat(bridge.tickPump().tick()).isEqualTo(1L);
        await().atMost(2, TimeUnit.SECONDS).until(task::isDone);
        assertThat(resumptions).hasValue(1);
        assertThat(task.getState()).isEqualTo(TaskState.COMPLETED);
    }

    @Test
    void sleepOfZeroTicksCompletesImmediately() {
        TaskContext context = spawnIdleTask();

        assertThat(context.sleepUpdates(0)).isCompleted();
        assertThatThrownBy(() -> context.sleepUpdates(-1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void sleepFailsWithClockClosedOnTeardown() {
        TaskContext context = spawnIdleTask();
        CompletableFuture<Void> sleep = context.sleepUpdates(100);
        bridge.tickPump();

        bridge.close();

        await().atMost(2, TimeUnit.SECONDS).until(sleep::isDone);
        assertThatThrownBy(sleep::join).hasCauseInstanceOf(ClockClosedException.class);
    }

    @Test
    void mainThreadResultObservesTickOfTheDrainingPump() {
        for (int i = 0; i < 5; i++) {
            bridge.tickPump();
        }
        TaskContext context = spawnIdleTask();
        CompletableFuture<Long> tick = context.runOnMainThread(MainThreadContext::currentTick);
        assertThat(bridge.pendingCallbacks()).isEqualTo(1);

        TickReport report = bridge.tickPump();

        assertThat(report.tick()).isEqualTo(6);
        assertThat(report.callbacksExecuted()).isEqualTo(1);
        assertThat(tick.join()).isEqualTo(6L);
    }

    @Test
    void mainThreadResultCompletesOffTheWorldThread() {
        TaskContext context = spawnIdleTask();
        Thread worldThread = Thread.currentThread();
        AtomicReference<Thread> continuationThread = new AtomicReference<>();
        CompletableFuture<Void> chained = context.runOnMainThread(ctx -> "value")
                .thenAccept(value -> continuationThread.set(Thread.currentThread()));

        bridge.tickPump();

        await().atMost(2, TimeUnit.SECONDS).until(chained::isDone);
        assertThat(continuationThread.get()).isNotSameAs(worldThread);
    }

    @Test
    void callbacksHaveExclusiveWorldAccess() {
        world.insertResource(StringBuilder.class, new StringBuilder());
        int tasks = 50;
        List<TaskHandle<Integer>> handles = new ArrayList<>();
        for (int i = 0; i < tasks; i++) {
            handles.add(bridge.spawnBackgroundTask(context -> context.runOnMainThread(ctx -> {
                StringBuilder log = ctx.world().resource(StringBuilder.class);
                int before = log.length();
                log.append('x');
                return log.length() - before;
            })));
        }

        await().pollInSameThread().atMost(5, TimeUnit.SECONDS).until(() -> {
            bridge.tickPump();
            return handles.stream().allMatch(TaskHandle::isDone);
        });

        assertThat(handles).allSatisfy(h -> assertThat(h.join()).isEqualTo(1));
        assertThat(world.resource(StringBuilder.class).length()).isEqualTo(tasks);
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Main-thread callback failed.*")
    void failingCallbackSurfacesAsResponseLost() {
        TaskHandle<String> task = bridge.spawnBackgroundTask(context -> context.runOnMainThread(ctx -> {
            throw new IllegalArgumentException("bad world state");
        }));
        await().atMost(2, TimeUnit.SECONDS).until(() -> bridge.pendingCallbacks() == 1);

        bridge.tickPump();

        await().atMost(2, TimeUnit.SECONDS).until(task::isDone);
        assertThatThrownBy(task::join)
                .hasCauseInstanceOf(ResponseLostException.class)
                .hasRootCauseInstanceOf(IllegalArgumentException.class);
        assertThat(task.getState()).isEqualTo(TaskState.FAILED);
        // The world keeps ticking.
        assertThat(bridge.tickPump().tick()).isEqualTo(2);
    }

    @Test
    void runOnMainThreadAfterTeardownFailsWithWorldUnavailable() {
        TaskContext context = spawnIdleTask();
        bridge.close();

        CompletableFuture<Integer> result = context.runOnMainThread(ctx -> 1);

        assertThatThrownBy(result::join).hasCauseInstanceOf(WorldUnavailableException.class);
    }

    @Test
    void cancelledTaskDoesNotRetractEnqueuedCallback() {
        AtomicInteger executions = new AtomicInteger();
        TaskHandle<Integer> task = bridge.spawnBackgroundTask(context -> context.runOnMainThread(ctx -> {
            executions.incrementAndGet();
            return 99;
        }));
        await().atMost(2, TimeUnit.SECONDS).until(() -> bridge.pendingCallbacks() == 1);

        assertThat(task.cancel()).isTrue();
        TickReport report = bridge.tickPump();

        assertThat(report.callbacksExecuted()).isEqualTo(1);
        assertThat(executions).hasValue(1);
        assertThat(task.isCancelled()).isTrue();
        assertThat(task.getState()).isEqualTo(TaskState.CANCELLED);
        assertThatThrownBy(task::join).isInstanceOf(CancellationException.class);
    }

    @Test
    void cancelledTaskNoLongerReceivesTheCallbackResult() {
        List<MainThreadCallback<?>> enqueued = new ArrayList<>();
        MainThreadQueue queue = new MainThreadQueue() {
            @Override
            public void enqueue(MainThreadCallback<?> callback) {
                enqueued.add(callback);
                super.enqueue(callback);
            }
        };
        TaskScope scope = new TaskScope();
        TaskContext context = new TaskContext(new TickClock(), queue, Runnable::run, scope);
        AtomicInteger executions = new AtomicInteger();
        CompletableFuture<Integer> result = context.runOnMainThread(ctx -> executions.incrementAndGet());

        scope.cancel();

        assertThat(result).isCancelled();
        assertThat(enqueued).hasSize(1);
        assertThat(enqueued.get(0).response()).isCancelled();
        assertThat(queue.drainAll(tick -> new MainThreadContext(world, tick), 1L)).isEqualTo(1);
        assertThat(executions).hasValue(1);
    }

    @Test
    void cancellingTaskCancelsItsSleep() {
        AtomicReference<CompletableFuture<Void>> sleep = new AtomicReference<>();
        TaskHandle<Void> task = bridge.spawnBackgroundTask(context -> {
            sleep.set(context.sleepUpdates(1_000));
            return sleep.get();
        });
        await().atMost(2, TimeUnit.SECONDS).until(() -> sleep.get() != null);

        task.cancel();

        assertThat(sleep.get()).isCancelled();
        bridge.tickPump();
        assertThat(task.getState()).isEqualTo(TaskState.CANCELLED);
    }

    @Test
    void copiesShareTheSameTask() {
        TaskContext context = spawnIdleTask();
        TaskContext copy = context.copy();

        bridge.tickPump();

        assertThat(copy.currentTick()).isEqualTo(context.currentTick());
        assertThat(copy.isCancelled()).isFalse();
        CompletableFuture<Integer> viaCopy = copy.runOnMainThread(ctx -> 5);
        bridge.tickPump();
        assertThat(viaCopy.join()).isEqualTo(5);
    }
}
