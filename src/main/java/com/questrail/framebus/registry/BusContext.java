package com.questrail.framebus.registry;

import com.questrail.framebus.api.Frame;
import com.questrail.framebus.api.Port;
import com.questrail.framebus.config.FrameBusConfig;
import com.questrail.framebus.observability.FrameBusObservabilitySink;
import com.questrail.framebus.observability.Slf4jFrameBusObservabilitySink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * BusContext
 * =============================================================================
 * Owner of one frame bus and of the type registries that feed it.
 *
 * <h2>Why a context</h2>
 * Nothing here is process-global. Each context has its own frame and port
 * registries, its own {@link FrameBus}, its configuration and its
 * observability sink, so independent buses can coexist in one JVM (and tests
 * never share state).
 *
 * <h2>Startup</h2>
 * {@link Builder#build()} creates the context and runs the configured
 * {@link TypeCatalog}s in order. Types are therefore registered before the
 * caller can create any instance.
 *
 * <h2>Teardown</h2>
 * {@link #close()} clears the frame bus, releasing every bus-held frame
 * reference. Frames still held by ports stay alive until those ports let go.
 */
public final class BusContext implements AutoCloseable
{
    private static final Logger log = LoggerFactory.getLogger(BusContext.class);

    private final FrameBusConfig config;
    private final FrameBusObservabilitySink observability;

    private final TypeRegistry<Frame> frameTypes = new TypeRegistry<>("frame");
    private final TypeRegistry<Port> portTypes = new TypeRegistry<>("port");
    private final FrameBus frameBus;

    private BusContext(FrameBusConfig config, FrameBusObservabilitySink observability) {
        this.config = Objects.requireNonNull(config, "config");
        this.observability = Objects.requireNonNull(observability, "observability");
        this.frameBus = new FrameBus(observability);
    }

    public static Builder builder() {
        return new Builder();
    }

    public FrameBusConfig config() {
        return config;
    }

    public FrameBusObservabilitySink observability() {
        return observability;
    }

    public TypeRegistry<Frame> frameTypes() {
        return frameTypes;
    }

    public TypeRegistry<Port> portTypes() {
        return portTypes;
    }

    public FrameBus frameBus() {
        return frameBus;
    }

    /**
     * Creates a frame without registering it. The caller owns the instance and
     * must {@link Frame#close() close} it unless it is handed to a holder.
     */
    public Optional<Frame> createFrame(String typeName, String instanceName) {
        return frameTypes.create(typeName, instanceName, this);
    }

    /**
     * Creates a frame and registers it on the frame bus under its
     * {@link Frame#id() instance name}.
     */
    public Optional<Frame> createAndRegisterFrame(String typeName, String instanceName) {
        Optional<Frame> frame = createFrame(typeName, instanceName);
        frame.ifPresent(f -> frameBus.register(f.id(), f));
        return frame;
    }

    public Optional<Port> createPort(String typeName, String instanceName) {
        return portTypes.create(typeName, instanceName, this);
    }

    @Override
    public void close() {
        log.debug("Closing bus context with {} registered frame(s)", frameBus.size());
        frameBus.clear();
    }

    public static final class Builder {
        private FrameBusConfig config = FrameBusConfig.defaults();
        private FrameBusObservabilitySink observability = Slf4jFrameBusObservabilitySink.INSTANCE;
        private final List<TypeCatalog> catalogs = new ArrayList<>();

        public Builder withConfig(FrameBusConfig config) {
            this.config = config;
            return this;
        }

        public Builder withObservabilitySink(FrameBusObservabilitySink sink) {
            this.observability = sink;
            return this;
        }

        public Builder withCatalog(TypeCatalog... catalogs) {
            this.catalogs.addAll(Arrays.asList(catalogs));
            return this;
        }

        public BusContext build() {
            BusContext context = new BusContext(config, observability);
            for (TypeCatalog catalog : catalogs) {
                catalog.register(context);
            }
            return context;
        }
    }
}
