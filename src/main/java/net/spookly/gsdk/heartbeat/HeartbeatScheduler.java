package net.spookly.gsdk.heartbeat;

import java.io.IOException;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import net.spookly.gsdk.api.HealthCallback;
import net.spookly.gsdk.log.AgentLogFile;
import net.spookly.gsdk.protocol.HeartbeatCodec;
import net.spookly.gsdk.protocol.HeartbeatDecodingException;
import net.spookly.gsdk.protocol.HeartbeatRequest;
import net.spookly.gsdk.protocol.HeartbeatResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the heartbeat loop on one dedicated thread: wait up to the interval or until a state change asks for an early
 * heartbeat, then exchange one heartbeat with the orchestrator.
 */
public final class HeartbeatScheduler implements AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(HeartbeatScheduler.class);

    private final HeartbeatState state;
    private final HeartbeatCodec codec;
    private final HeartbeatTransport transport;
    private final OperationDispatcher dispatcher;
    private final AgentCallbacks callbacks;
    private final Duration interval;
    private final AgentLogFile log;
    private final boolean debug;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private ExecutorService executor;
    private Future<?> loop;
    private volatile Thread loopThread;

    public HeartbeatScheduler(HeartbeatState state,
                              HeartbeatCodec codec,
                              HeartbeatTransport transport,
                              OperationDispatcher dispatcher,
                              AgentCallbacks callbacks,
                              Duration interval,
                              AgentLogFile log,
                              boolean debug) {
        this.state = Objects.requireNonNull(state, "state");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.callbacks = Objects.requireNonNull(callbacks, "callbacks");
        this.interval = Objects.requireNonNull(interval, "interval");
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("heartbeat interval must be positive");
        }
        this.log = log == null ? AgentLogFile.disabled() : log;
        this.debug = debug;
    }

    /**
     * Start the heartbeat thread. Starting again while it runs is a no-op that reports success.
     *
     * @return false only when the scheduler has already been stopped
     */
    public synchronized boolean start() {
        if (loop != null) {
            return true;
        }
        if (stopped.get()) {
            return false;
        }
        running.set(true);
        executor = Executors.newSingleThreadExecutor(threadFactory());
        loop = executor.submit(this::runLoop);
        return true;
    }

    /**
     * Whether heartbeats are still being issued.
     */
    public boolean isRunning() {
        return running.get();
    }

    /**
     * Clear the run flag and wake the loop so no further heartbeats are sent. Does not wait for the thread.
     */
    public void requestStop() {
        running.set(false);
        state.requestHeartbeat();
    }

    /**
     * Stop the loop, wait for the heartbeat thread to exit and then release the transport. Safe to call repeatedly
     * and before {@link #start()}.
     */
    public void stop() {
        Future<?> pending;
        ExecutorService pendingExecutor;
        // Under the monitor so a concurrent start cannot set the run flag after this clears it.
        synchronized (this) {
            if (!stopped.compareAndSet(false, true)) {
                return;
            }
            requestStop();
            pending = loop;
            pendingExecutor = executor;
        }
        if (pending != null && Thread.currentThread() != loopThread) {
            try {
                pending.get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                pendingExecutor.shutdownNow();
                LOGGER.warn("Interrupted while waiting for the heartbeat thread; transport left open");
                return;
            } catch (ExecutionException e) {
                LOGGER.error("Heartbeat loop failed", e.getCause());
            }
        }
        if (pendingExecutor != null) {
            pendingExecutor.shutdown();
        }
        try {
            transport.close();
        } catch (Exception e) {
            LOGGER.warn("Failed to close heartbeat transport: {}", e.getMessage());
        }
    }

    @Override
    public void close() {
        stop();
    }

    private void runLoop() {
        loopThread = Thread.currentThread();
        long intervalNanos = interval.toNanos();
        try {
            while (running.get()) {
                boolean signaled;
                try {
                    signaled = state.awaitHeartbeatRequest(intervalNanos, TimeUnit.NANOSECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
                if (signaled && debug) {
                    log.log("State transition signaled an early heartbeat.");
                }
                // A stop may have been the reason we woke up.
                if (running.get()) {
                    tick();
                }
            }
        } catch (Error e) {
            LOGGER.error("Heartbeat loop terminated", e);
            log.log("Heartbeat loop terminated: " + e);
            throw e;
        } finally {
            running.set(false);
        }
    }

    private void tick() {
        try {
            runOnce();
        } catch (RuntimeException e) {
            LOGGER.warn("Heartbeat failed, retrying on the next tick", e);
            log.log("Heartbeat failed: " + e);
        }
    }

    /**
     * Perform one heartbeat exchange. Failures are logged and leave the shared state untouched; the next tick is the
     * retry.
     */
    void runOnce() {
        HeartbeatRequest request = buildRequest();
        String body = codec.encode(request);
        TransportResponse response;
        try {
            response = transport.send(body);
        } catch (IOException e) {
            LOGGER.warn("Heartbeat request failed: {}", e.getMessage());
            log.log("Heartbeat request failed: " + e);
            return;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return;
        }
        if (!response.isSuccess()) {
            LOGGER.warn("Received non-success code from agent. Status Code: {}", response.status());
            log.log("Received non-success code from Agent.  Status Code: " + response.status()
                    + " Response Body: " + response.body());
            return;
        }
        HeartbeatResponse decoded;
        try {
            decoded = codec.decode(response.body());
        } catch (HeartbeatDecodingException e) {
            LOGGER.warn("Failed to parse heartbeat: {}", e.getMessage());
            log.log("Failed to parse heartbeat: " + e.getMessage());
            log.log("Message: " + response.body());
            return;
        }
        dispatcher.dispatch(decoded);
    }

    private HeartbeatRequest buildRequest() {
        HealthCallback healthCallback = callbacks.health();
        if (healthCallback != null) {
            state.recordHealth(queryHealth(healthCallback));
        }
        return state.snapshotRequest();
    }

    private boolean queryHealth(HealthCallback callback) {
        try {
            return callback.isHealthy();
        } catch (VirtualMachineError e) {
            throw e;
        } catch (RuntimeException | Error e) {
            LOGGER.warn("Health callback failed, reporting unhealthy", e);
            log.log("Health callback failed: " + e);
            return false;
        }
    }

    private static ThreadFactory threadFactory() {
        return runnable -> {
            Thread thread = new Thread(runnable, "gsdk-heartbeat");
            thread.setDaemon(true);
            return thread;
        };
    }
}
