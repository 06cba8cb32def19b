package io.github.drompincen.vigil.runtime.breaker;

/**
 * Thrown by {@link CircuitBreakerRegistry#call} when the breaker refuses the request.
 */
public class CircuitOpenException extends RuntimeException {

    private final ResourceRef resource;

    public CircuitOpenException(ResourceRef resource, String reason) {
        super(reason);
        this.resource = resource;
    }

    public ResourceRef getResource() {
        return resource;
    }
}
