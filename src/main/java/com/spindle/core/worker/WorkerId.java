package com.spindle.core.worker;

import java.util.Optional;

/**
 * Identifier of a worker, assigned by {@link WorkerRegistry} when the worker is spawned.
 * <p>
 * Ids are positive, assigned in increasing order and never reused within a process.
 *
 * @param value the numeric id as typed by the operator
 */
public record WorkerId(long value) implements Comparable<WorkerId> {

    public WorkerId {
        if (value <= 0) {
            throw new IllegalArgumentException("Worker id must be positive: " + value);
        }
    }

    public static WorkerId of(long value) {
        return new WorkerId(value);
    }

    /**
     * Parses an operator-supplied id.
     *
     * @param text raw console argument, may be null
     * @return the id, or empty when the text is not a positive integer
     */
    public static Optional<WorkerId> parse(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        try {
            long value = Long.parseLong(text.trim());
            return value > 0 ? Optional.of(new WorkerId(value)) : Optional.empty();
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    @Override
    public int compareTo(WorkerId other) {
        return Long.compare(value, other.value);
    }

    @Override
    public String toString() {
        return String.valueOf(value);
    }
}
