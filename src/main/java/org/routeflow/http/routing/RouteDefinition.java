package org.routeflow.http.routing;

import org.routeflow.http.common.HttpMethod;
import org.routeflow.http.handler.RouteHandler;

import java.util.List;

public record RouteDefinition(HttpMethod method, String originalPath, PathPattern pattern, RouteHandler handler) {

    public List<String> paramNames() {
        return pattern.getParamNames();
    }

}
