package org.routeflow.http.routing;

import java.util.Map;
import java.util.Optional;

/**
 * Read access to the submitted form fields of a request, used for the method override.
 */
@FunctionalInterface
public interface FormFields {

    Optional<String> get(String name);

    static FormFields none() {
        return name -> Optional.empty();
    }

    static FormFields of(Map<String, String> fields) {
        return name -> Optional.ofNullable(fields.get(name));
    }

}
