package com.streamfirst.dataset.unpublish.adapters;

import com.streamfirst.dataset.unpublish.ports.DiscoveryServicePort;
import com.streamfirst.dataset.unpublish.ports.ServingIndexPort;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory stand-ins for the serving layer's index and the discovery service. Both only count the
 * requests they receive.
 */
@Slf4j
public final class InMemoryServingLayerAdapters {

    private InMemoryServingLayerAdapters() {}

    public static final class InMemoryServingIndex implements ServingIndexPort {
        private final AtomicInteger regenerations = new AtomicInteger();

        @Override
        public void regenerateIndex() {
            log.debug("Regenerating serving index (#{})", regenerations.incrementAndGet());
        }

        public int getRegenerationCount() {
            return regenerations.get();
        }
    }

    public static final class InMemoryDiscoveryService implements DiscoveryServicePort {
        private final AtomicInteger reinitializations = new AtomicInteger();

        @Override
        public void reinitialize() {
            log.debug("Reinitializing discovery service (#{})", reinitializations.incrementAndGet());
        }

        public int getReinitializationCount() {
            return reinitializations.get();
        }
    }
}
