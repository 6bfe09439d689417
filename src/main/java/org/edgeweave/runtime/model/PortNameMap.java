package org.edgeweave.runtime.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Read-only mapping from logical signal handles to simulator port identifiers.
 * <p>
 * A strict map rejects signals it does not know. A map built with
 * {@link Builder#withIdentityFallback()} (or {@link #identity()}) falls back to the signal's own
 * name as port, which suits simulators whose port namespace equals the test's naming.
 * <p>
 * <b>Thread Safety:</b> Immutable after construction.
 */
public final class PortNameMap {

    private final Map<Signal, String> ports;
    private final boolean identityFallback;

    private PortNameMap(Map<Signal, String> ports, boolean identityFallback) {
        this.ports = Collections.unmodifiableMap(new LinkedHashMap<>(ports));
        this.identityFallback = identityFallback;
    }

    /**
     * Returns a map that resolves every signal to a port of the same name.
     *
     * @return The identity port map.
     */
    public static PortNameMap identity() {
        return new PortNameMap(Map.of(), true);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Resolves the simulator port for a signal.
     *
     * @param signal The signal handle.
     * @return The simulator port identifier.
     * @throws IllegalArgumentException if the signal is unmapped and the map is strict
     */
    public String portFor(Signal signal) {
        String port = ports.get(signal);
        if (port != null) {
            return port;
        }
        if (identityFallback) {
            return signal.getName();
        }
        throw new IllegalArgumentException("No simulator port mapped for signal '" + signal + "'");
    }

    /**
     * Returns a name suitable for diagnostics. Never fails: unmapped signals report their own name.
     *
     * @param signal The signal handle.
     * @return The mapped port name, or the signal name.
     */
    public String displayName(Signal signal) {
        return ports.getOrDefault(signal, signal.getName());
    }

    public boolean contains(Signal signal) {
        return identityFallback || ports.containsKey(signal);
    }

    public Map<Signal, String> asMap() {
        return ports;
    }

    /**
     * Builder for {@link PortNameMap}.
     */
    public static final class Builder {
        private final Map<Signal, String> ports = new LinkedHashMap<>();
        private boolean identityFallback;

        private Builder() {
        }

        /**
         * Maps a signal to a simulator port.
         *
         * @param signal The signal handle.
         * @param port   The simulator port identifier.
         * @return This builder.
         * @throws IllegalArgumentException if the signal is already mapped to a different port
         */
        public Builder map(Signal signal, String port) {
            String previous = ports.putIfAbsent(signal, port);
            if (previous != null && !previous.equals(port)) {
                throw new IllegalArgumentException(
                        "Signal '" + signal + "' already mapped to port '" + previous + "'");
            }
            return this;
        }

        public Builder withIdentityFallback() {
            this.identityFallback = true;
            return this;
        }

        public PortNameMap build() {
            return new PortNameMap(ports, identityFallback);
        }
    }
}
