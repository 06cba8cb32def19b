package io.github.drompincen.vigil.runtime.breaker;

import io.github.drompincen.vigil.persistence.document.CircuitBreakerDocument;

import java.util.Objects;

/**
 * An external resource as seen by one tenant, e.g. a configured search or CRM API.
 */
public record ResourceRef(String tenantId, String resourceId, String provider) {

    public ResourceRef {
        Objects.requireNonNull(tenantId, "tenantId");
        Objects.requireNonNull(resourceId, "resourceId");
    }

    public String breakerId() {
        return CircuitBreakerDocument.idFor(tenantId, resourceId);
    }
}
