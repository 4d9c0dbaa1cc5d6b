package com.questrail.simmonitor.runtime;

import com.questrail.simmonitor.api.MonitorReport;
import com.questrail.simmonitor.api.MonitorVerdict;
import com.questrail.simmonitor.ast.RequirementParser;
import com.questrail.simmonitor.bus.ManagedMessageBus;
import com.questrail.simmonitor.bus.MessageBusException;
import com.questrail.simmonitor.bus.rosbridge.RosbridgeMessageBus;
import com.questrail.simmonitor.config.MonitorConfig;
import com.questrail.simmonitor.internal.build.RequirementTreeBuilder;
import com.questrail.simmonitor.internal.node.MonitorCoordinator;
import com.questrail.simmonitor.internal.node.RequirementContext;
import com.questrail.simmonitor.internal.node.RequirementNode;
import com.questrail.simmonitor.internal.time.MonotonicClock;
import com.questrail.simmonitor.internal.time.MonotonicScheduler;
import com.questrail.simmonitor.internal.time.ScheduledExecutorScheduler;
import com.questrail.simmonitor.internal.time.SystemMonotonicClock;
import com.questrail.simmonitor.internal.time.SystemWallClock;
import com.questrail.simmonitor.internal.time.WallClock;
import com.questrail.simmonitor.observability.MonitorObservabilitySink;
import com.questrail.simmonitor.observability.NullObservabilitySink;
import com.questrail.simmonitor.transport.netty.NettyWebSocketEndpoint;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * SimulationMonitorRuntime
 * =============================================================================
 * Composition root and lifecycle owner for one monitored simulation run.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * SimulationMonitorRuntime runtime = SimulationMonitorRuntime.builder()
 *         .withConfig(config)
 *         .withParser(parser)
 *         .build();          // parses and builds every requirement
 * runtime.start();           // connects to the bus, starts the timers
 * MonitorReport report = runtime.awaitCompletion();
 * runtime.stop();
 * }</pre>
 *
 * <p>Building fails with {@code RequirementBuildException} if any requirement
 * is invalid; nothing is connected in that case.</p>
 */
public final class SimulationMonitorRuntime {
    private final MonitorCoordinator coordinator;
    private final ManagedMessageBus bus;
    private final ScheduledExecutorService schedulerExecutor;
    private final AtomicBoolean started = new AtomicBoolean();
    private final AtomicBoolean stopped = new AtomicBoolean();

    private SimulationMonitorRuntime(
            MonitorCoordinator coordinator,
            ManagedMessageBus bus,
            ScheduledExecutorService schedulerExecutor) {
        this.coordinator = coordinator;
        this.bus = bus;
        this.schedulerExecutor = schedulerExecutor;
    }

    /**
     * Opens the bus and starts the run.
     *
     * @throws MonitorRunException if the bus cannot be reached or subscriptions fail
     */
    public void start() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Runtime already started");
        }

        bus.setErrorListener(coordinator::fail);
        try {
            bus.open();
        } catch (MessageBusException e) {
            coordinator.fail(e);
            throw new MonitorRunException("Could not open the message bus", e);
        }

        try {
            coordinator.start(bus);
        } catch (RuntimeException e) {
            coordinator.fail(e);
            throw new MonitorRunException("Could not subscribe requirements to the message bus", e);
        }
    }

    /**
     * Blocks until the run finishes.
     *
     * @return the final report
     * @throws MonitorRunException if the run ended with {@link MonitorVerdict#FAILED}
     */
    public MonitorReport awaitCompletion() throws InterruptedException {
        coordinator.awaitFinished();
        return completedReport();
    }

    /**
     * Blocks until the run finishes or {@code timeout} elapses.
     *
     * @return the final report, or empty if the run is still going
     */
    public Optional<MonitorReport> awaitCompletion(Duration timeout) throws InterruptedException {
        if (!coordinator.awaitFinished(timeout)) {
            return Optional.empty();
        }
        return Optional.of(completedReport());
    }

    private MonitorReport completedReport() {
        MonitorReport report = coordinator.report();
        if (report.verdict() == MonitorVerdict.FAILED) {
            Throwable cause = coordinator.failure().orElse(null);
            throw new MonitorRunException("Simulation monitor failed: "
                    + (cause == null ? "unknown cause" : cause.getMessage()), cause, report);
        }
        return report;
    }

    /**
     * Aborts the run if still going, closes the bus and stops the timers. Idempotent.
     */
    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }

        coordinator.abort();
        bus.close();

        if (schedulerExecutor != null) {
            schedulerExecutor.shutdown();
            try {
                if (!schedulerExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                    schedulerExecutor.shutdownNow();
                }
            } catch (InterruptedException e) {
                schedulerExecutor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }

    public boolean isFinished() {
        return coordinator.isFinished();
    }

    public MonitorVerdict verdict() {
        return coordinator.verdict();
    }

    /**
     * Current state of every requirement; final once the run has finished.
     */
    public MonitorReport report() {
        return coordinator.report();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private MonitorConfig config;
        private RequirementParser parser;
        private ManagedMessageBus bus;
        private MonitorObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private MonotonicClock clock = SystemMonotonicClock.INSTANCE;
        private WallClock wallClock = SystemWallClock.INSTANCE;
        private MonotonicScheduler scheduler;

        public Builder withConfig(MonitorConfig config) {
            this.config = config;
            return this;
        }

        public Builder withParser(RequirementParser parser) {
            this.parser = parser;
            return this;
        }

        /**
         * Bus to use instead of a rosbridge connection built from the config.
         */
        public Builder withMessageBus(ManagedMessageBus bus) {
            this.bus = bus;
            return this;
        }

        public Builder withObservabilitySink(MonitorObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withClock(MonotonicClock clock) {
            this.clock = clock;
            return this;
        }

        public Builder withWallClock(WallClock wallClock) {
            this.wallClock = wallClock;
            return this;
        }

        /**
         * Scheduler to use instead of a dedicated timer thread. It must measure
         * time on the same clock as {@link #withClock}.
         */
        public Builder withScheduler(MonotonicScheduler scheduler) {
            this.scheduler = scheduler;
            return this;
        }

        public SimulationMonitorRuntime build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(parser, "parser");
            Objects.requireNonNull(clock, "clock");
            Objects.requireNonNull(wallClock, "wallClock");
            MonitorObservabilitySink sink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);

            ScheduledExecutorService schedulerExec = null;
            MonotonicScheduler effectiveScheduler = scheduler;
            if (effectiveScheduler == null) {
                schedulerExec = Executors.newScheduledThreadPool(1, runnable -> {
                    Thread thread = new Thread(runnable, "sim-monitor-timer");
                    thread.setDaemon(true);
                    return thread;
                });
                effectiveScheduler = new ScheduledExecutorScheduler(schedulerExec, clock);
            }

            try {
                RequirementContext context = new RequirementContext(clock, wallClock, effectiveScheduler, sink);
                List<RequirementNode> requirements = new RequirementTreeBuilder(context)
                        .buildAll(config.requirements(), parser);

                MonitorCoordinator coordinator = new MonitorCoordinator(context, config.timeout(), config.ignore());
                coordinator.adoptAll(requirements);

                ManagedMessageBus effectiveBus = bus;
                if (effectiveBus == null) {
                    effectiveBus = new RosbridgeMessageBus(
                            new NettyWebSocketEndpoint(config.busUri(), config.connectTimeout()),
                            config.busUri().toString(),
                            config.connectTimeout(),
                            sink,
                            wallClock);
                }

                return new SimulationMonitorRuntime(coordinator, effectiveBus, schedulerExec);
            } catch (RuntimeException e) {
                if (schedulerExec != null) {
                    schedulerExec.shutdownNow();
                }
                throw e;
            }
        }
    }
}
