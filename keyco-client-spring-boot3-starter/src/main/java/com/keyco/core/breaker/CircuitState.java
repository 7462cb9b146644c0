package com.keyco.core.breaker;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * 熔断状态: Closed | Open(until) | HalfOpen(until)
 */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class CircuitState {

    public enum Phase { CLOSED, OPEN, HALF_OPEN }

    private static final CircuitState CLOSED = new CircuitState(Phase.CLOSED, null);

    private final Phase phase;

    /** Closed 时为 null */
    private final Instant until;

    public static CircuitState closed() {
        return CLOSED;
    }

    public static CircuitState open(Instant until) {
        return new CircuitState(Phase.OPEN, until);
    }

    public static CircuitState halfOpen(Instant until) {
        return new CircuitState(Phase.HALF_OPEN, until);
    }

    public boolean isClosed() {
        return phase == Phase.CLOSED;
    }

    public boolean isOpen() {
        return phase == Phase.OPEN;
    }

    public boolean isHalfOpen() {
        return phase == Phase.HALF_OPEN;
    }
}
