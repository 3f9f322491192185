package com.davisodom.townsim.core;

import java.util.*;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Internal event channel of one simulation instance.
 *
 * Dispatch is synchronous on the publishing thread, in registration order. A failing listener
 * is logged and skipped; it never stops delivery to the others or escapes into the tick.
 */
public class EventBus {

    private static final Logger LOGGER = Logger.getLogger(EventBus.class.getName());

    private final List<Registration> registrations = new CopyOnWriteArrayList<>();

    /**
     * Listener for simulation events.
     */
    @FunctionalInterface
    public interface Listener {
        void onEvent(SimulationEvent event);
    }

    /**
     * Handle returned by {@link #register}; closing it unregisters the listener.
     */
    public final class Registration implements AutoCloseable {
        private final Listener listener;
        private final Set<SimulationEventType> types;

        private Registration(Listener listener, Set<SimulationEventType> types) {
            this.listener = listener;
            this.types = types;
        }

        boolean accepts(SimulationEventType type) {
            return types.isEmpty() || types.contains(type);
        }

        @Override
        public void close() {
            unregister(this);
        }
    }

    /**
     * Registers a listener for the given types, or for every type when none are given.
     */
    public Registration register(Listener listener, SimulationEventType... types) {
        Objects.requireNonNull(listener, "listener cannot be null");
        Set<SimulationEventType> filter = types.length == 0
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(Arrays.asList(types)));
        Registration registration = new Registration(listener, filter);
        registrations.add(registration);
        return registration;
    }

    public boolean unregister(Registration registration) {
        return registrations.remove(registration);
    }

    public void publish(SimulationEvent event) {
        for (Registration registration : registrations) {
            if (!registration.accepts(event.getType())) {
                continue;
            }
            try {
                registration.listener.onEvent(event);
            } catch (Exception e) {
                LOGGER.log(Level.SEVERE, "Event listener failed for " + event, e);
            }
        }
    }

    public int getListenerCount() {
        return registrations.size();
    }
}
