package org.edgeweave.runtime.model;

/**
 * Handle to a named signal of the circuit under test.
 * <p>
 * Two handles of the same kind with the same name denote the same signal. The name is the
 * logical name used by test code; the simulator port it is driven through is resolved by a
 * {@link PortNameMap}.
 */
public class Signal {

    private final String name;

    /**
     * Creates a signal handle.
     *
     * @param name The logical signal name.
     * @throws IllegalArgumentException if the name is null or blank
     */
    protected Signal(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Signal name must not be blank");
        }
        this.name = name;
    }

    /**
     * Creates a handle for a data signal.
     *
     * @param name The logical signal name.
     * @return The signal handle.
     */
    public static Signal of(String name) {
        return new Signal(name);
    }

    public String getName() {
        return name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return name.equals(((Signal) o).name);
    }

    @Override
    public int hashCode() {
        return 31 * getClass().hashCode() + name.hashCode();
    }

    @Override
    public String toString() {
        return name;
    }
}
