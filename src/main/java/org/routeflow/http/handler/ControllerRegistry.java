package org.routeflow.http.handler;

import java.util.Optional;

public interface ControllerRegistry {

    /**
     * Creates a fresh controller for the given type identifier, or empty if the type is unknown.
     */
    Optional<Object> newInstance(String type);

    static ControllerRegistry empty() {
        return type -> Optional.empty();
    }

}
