package org.routeflow.http.routing;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * @param pathParams placeholder values keyed by name, iterating in the order the placeholders appear in the route
 */
public record RouteMatch(RouteDefinition route, Map<String, String> pathParams) implements DispatchResult {

    public RouteMatch {
        pathParams = Collections.unmodifiableMap(new LinkedHashMap<>(pathParams));
    }

}
