package org.routeflow.http.routing;

public sealed interface DispatchResult permits RouteMatch, NotFound {

    default boolean matched() {
        return this instanceof RouteMatch;
    }

}
