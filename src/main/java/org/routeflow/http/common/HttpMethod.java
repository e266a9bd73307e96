package org.routeflow.http.common;

import java.util.Optional;

public enum HttpMethod {

    GET,
    POST,
    PUT,
    PATCH,
    DELETE;

    /**
     * Case-sensitive lookup; anything outside the five routable verbs is empty.
     */
    public static Optional<HttpMethod> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        for (HttpMethod method : values()) {
            if (method.name().equals(name)) {
                return Optional.of(method);
            }
        }
        return Optional.empty();
    }

}
