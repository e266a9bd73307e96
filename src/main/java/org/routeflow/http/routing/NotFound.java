package org.routeflow.http.routing;

public enum NotFound implements DispatchResult {

    INSTANCE

}
