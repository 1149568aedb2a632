package com.questrail.cbf.subarray.runtime;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.cbf.api.ObsState;
import com.questrail.cbf.api.SubarrayController;
import com.questrail.cbf.fleet.DeviceFleetGateway;
import com.questrail.cbf.subarray.SubarrayOrchestrator;
import com.questrail.cbf.subarray.config.SubarrayRuntimeConfig;
import com.questrail.cbf.subarray.internal.exec.FleetIntentExecutor;
import com.questrail.cbf.subarray.internal.health.DeviceHealthAggregator;
import com.questrail.cbf.subarray.internal.model.ModelDocumentParser;
import com.questrail.cbf.subarray.internal.model.ModelUpdateScheduler;
import com.questrail.cbf.subarray.internal.resource.NodeGroupAssignments;
import com.questrail.cbf.subarray.internal.resource.ResourceAllocator;
import com.questrail.cbf.subarray.internal.scan.OutputLinkPlanner;
import com.questrail.cbf.subarray.internal.scan.ScanConfigDistributor;
import com.questrail.cbf.subarray.internal.scan.ScanConfigValidator;
import com.questrail.cbf.subarray.internal.state.SubarrayStateReducer;
import com.questrail.cbf.subarray.internal.time.MonotonicClock;
import com.questrail.cbf.subarray.internal.time.MonotonicScheduler;
import com.questrail.cbf.subarray.internal.time.ScheduledExecutorScheduler;
import com.questrail.cbf.subarray.internal.time.SystemMonotonicClock;
import com.questrail.cbf.subarray.internal.time.SystemWallClock;
import com.questrail.cbf.subarray.internal.time.WallClock;
import com.questrail.cbf.subarray.observability.NullObservabilitySink;
import com.questrail.cbf.subarray.observability.SubarrayObservabilitySink;
import com.questrail.cbf.subarray.transport.DatagramEndpoint;
import com.questrail.cbf.subarray.transport.udp.UdpModelFeedAdapter;
import com.questrail.cbf.subarray.transport.udp.netty.NettyUdpDatagramEndpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * SubarrayProductionRuntime
 * =============================================================================
 * Composition root and lifecycle owner for one subarray.
 *
 * <p>Wires the allocator, validator, distributor, model-update scheduler and
 * health aggregator around a {@link SubarrayOrchestrator}, and optionally a
 * UDP model feed.</p>
 */
public final class SubarrayProductionRuntime {
    private static final Logger log = LoggerFactory.getLogger(SubarrayProductionRuntime.class);

    private final SubarrayOrchestrator orchestrator;
    private final ModelUpdateScheduler modelScheduler;
    private final UdpModelFeedAdapter modelFeed;
    private final ScheduledExecutorService schedulerExecutor;

    private SubarrayProductionRuntime(
            SubarrayOrchestrator orchestrator,
            ModelUpdateScheduler modelScheduler,
            UdpModelFeedAdapter modelFeed,
            ScheduledExecutorService schedulerExecutor) {
        this.orchestrator = orchestrator;
        this.modelScheduler = modelScheduler;
        this.modelFeed = modelFeed;
        this.schedulerExecutor = schedulerExecutor;
    }

    public void start() {
        if (modelFeed != null) {
            modelFeed.start();
        }
        log.info("Subarray {} runtime started", orchestrator.subarrayId());
    }

    public void stop() {
        if (modelFeed != null) {
            modelFeed.stop();
        }
        modelScheduler.shutdown();
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
        log.info("Subarray {} runtime stopped", orchestrator.subarrayId());
    }

    public SubarrayController controller() {
        return orchestrator;
    }

    public ModelUpdateScheduler modelScheduler() {
        return modelScheduler;
    }

    public Optional<UdpModelFeedAdapter> modelFeed() {
        return Optional.ofNullable(modelFeed);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private SubarrayRuntimeConfig config;
        private DeviceFleetGateway gateway;
        private SubarrayObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private MonotonicClock clock = SystemMonotonicClock.INSTANCE;
        private WallClock wallClock = SystemWallClock.INSTANCE;
        private MonotonicScheduler scheduler;
        private DatagramEndpoint modelFeedEndpoint;
        private Random random = new Random();
        private ObjectMapper mapper = new ObjectMapper();

        public Builder withConfig(SubarrayRuntimeConfig config) {
            this.config = config;
            return this;
        }

        public Builder withGateway(DeviceFleetGateway gateway) {
            this.gateway = gateway;
            return this;
        }

        public Builder withObservabilitySink(SubarrayObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withClocks(MonotonicClock clock, WallClock wallClock) {
            this.clock = clock;
            this.wallClock = wallClock;
            return this;
        }

        /**
         * Supplies the scheduler for model updates. When unset the runtime owns
         * a scheduled thread pool sized by the configuration.
         */
        public Builder withScheduler(MonotonicScheduler scheduler) {
            this.scheduler = scheduler;
            return this;
        }

        /**
         * Supplies the model-feed endpoint. When unset and the configuration
         * names a bind address, a Netty UDP endpoint is created.
         */
        public Builder withModelFeedEndpoint(DatagramEndpoint endpoint) {
            this.modelFeedEndpoint = endpoint;
            return this;
        }

        /** Seeds output-link planning. */
        public Builder withRandom(Random random) {
            this.random = random;
            return this;
        }

        public Builder withObjectMapper(ObjectMapper mapper) {
            this.mapper = mapper;
            return this;
        }

        public SubarrayProductionRuntime build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(gateway, "gateway");
            Objects.requireNonNull(clock, "clock");
            Objects.requireNonNull(wallClock, "wallClock");
            Objects.requireNonNull(random, "random");
            Objects.requireNonNull(mapper, "mapper");
            SubarrayObservabilitySink sink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
            int subarrayId = config.subarrayId();

            // 1. Time
            ScheduledExecutorService schedulerExec = null;
            MonotonicScheduler effectiveScheduler = scheduler;
            if (effectiveScheduler == null) {
                schedulerExec = Executors.newScheduledThreadPool(config.schedulerThreads());
                effectiveScheduler = new ScheduledExecutorScheduler(schedulerExec, clock);
            }

            // 2. Shared fleet bookkeeping
            NodeGroupAssignments groups = new NodeGroupAssignments();
            DeviceHealthAggregator health = new DeviceHealthAggregator(gateway);
            ResourceAllocator allocator = new ResourceAllocator(subarrayId, config.receptors(), gateway, health, groups);

            // 3. Model updates, gated by the orchestrator's obsState once it exists
            AtomicReference<SubarrayOrchestrator> orchestratorRef = new AtomicReference<>();
            ModelUpdateScheduler modelScheduler = new ModelUpdateScheduler(
                    gateway,
                    groups,
                    () -> {
                        SubarrayOrchestrator o = orchestratorRef.get();
                        return o == null ? ObsState.EMPTY : o.obsState();
                    },
                    clock,
                    wallClock,
                    effectiveScheduler,
                    sink,
                    new ModelDocumentParser(mapper));

            // 4. Scan configuration
            ScanConfigValidator validator = new ScanConfigValidator(subarrayId, config.fspCount(), gateway, mapper);
            ScanConfigDistributor distributor = new ScanConfigDistributor(
                    subarrayId,
                    gateway,
                    health,
                    groups,
                    allocator,
                    modelScheduler,
                    new OutputLinkPlanner(random),
                    mapper);

            // 5. Executor and orchestrator
            FleetIntentExecutor executor = new FleetIntentExecutor(allocator, validator, distributor, groups, wallClock);
            SubarrayOrchestrator orchestrator = new SubarrayOrchestrator(
                    subarrayId,
                    new SubarrayStateReducer(),
                    executor,
                    allocator,
                    groups,
                    health,
                    distributor,
                    modelScheduler,
                    wallClock,
                    sink);
            orchestratorRef.set(orchestrator);

            // 6. Optional model feed
            DatagramEndpoint endpoint = modelFeedEndpoint;
            if (endpoint == null && config.modelFeed().isPresent()) {
                endpoint = new NettyUdpDatagramEndpoint(config.modelFeed().get());
            }
            UdpModelFeedAdapter feed = endpoint == null ? null : new UdpModelFeedAdapter(modelScheduler, endpoint);

            return new SubarrayProductionRuntime(orchestrator, modelScheduler, feed, schedulerExec);
        }
    }
}
