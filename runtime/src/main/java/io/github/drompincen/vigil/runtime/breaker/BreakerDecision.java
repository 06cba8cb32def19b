package io.github.drompincen.vigil.runtime.breaker;

public record BreakerDecision(boolean allowed, String reason) {

    public static BreakerDecision allow() {
        return new BreakerDecision(true, null);
    }

    public static BreakerDecision block(String reason) {
        return new BreakerDecision(false, reason);
    }
}
