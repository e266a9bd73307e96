package org.routeflow.http.routing;

import lombok.extern.slf4j.Slf4j;
import org.routeflow.configuration.RouterProperties;
import org.routeflow.http.common.HttpMethod;
import org.routeflow.http.handler.ControllerRegistry;
import org.routeflow.http.handler.HandlerInvoker;
import org.routeflow.http.handler.RouteHandler;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Maps an HTTP method and path to a registered handler.
 *
 * <p>Routes are tried in registration order and the first one whose pattern matches wins. Register everything
 * before dispatching; once built the router can be shared between threads for dispatch only.</p>
 */
@Slf4j
public class Router {

    private final Map<HttpMethod, List<RouteDefinition>> routes = new EnumMap<>(HttpMethod.class);
    private final GroupPrefixStack groups = new GroupPrefixStack();
    private final RouterProperties properties;
    private final HandlerInvoker handlerInvoker;
    private Supplier<?> notFoundHandler;

    public Router() {
        this(RouterProperties.defaults());
    }

    public Router(RouterProperties properties) {
        this(properties, ControllerRegistry.empty());
    }

    public Router(RouterProperties properties, ControllerRegistry controllerRegistry) {
        this.properties = Objects.requireNonNull(properties, "properties");
        this.handlerInvoker = new HandlerInvoker(Objects.requireNonNull(controllerRegistry, "controllerRegistry"));
        for (HttpMethod method : HttpMethod.values()) {
            routes.put(method, new ArrayList<>());
        }
    }

    public Router get(String path, RouteHandler handler) {
        return register(HttpMethod.GET, path, handler);
    }

    public Router post(String path, RouteHandler handler) {
        return register(HttpMethod.POST, path, handler);
    }

    public Router put(String path, RouteHandler handler) {
        return register(HttpMethod.PUT, path, handler);
    }

    public Router patch(String path, RouteHandler handler) {
        return register(HttpMethod.PATCH, path, handler);
    }

    public Router delete(String path, RouteHandler handler) {
        return register(HttpMethod.DELETE, path, handler);
    }

    public Router any(String path, RouteHandler handler) {
        for (HttpMethod method : HttpMethod.values()) {
            register(method, path, handler);
        }
        return this;
    }

    public Router register(HttpMethod method, String path, RouteHandler handler) {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(path, "path");

        String fullPath = groups.apply(path);
        PathPattern pattern = PathPattern.compile(fullPath, properties.isQuoteLiterals());
        routes.get(method).add(new RouteDefinition(method, fullPath, pattern, handler));
        log.debug("Registered {} {} as {}", method, fullPath, pattern);
        return this;
    }

    /**
     * Registers everything {@code body} adds with {@code prefix} in front of its paths. Groups nest; the prefix is
     * dropped again even if {@code body} throws.
     */
    public Router group(String prefix, Consumer<Router> body) {
        Objects.requireNonNull(prefix, "prefix");
        Objects.requireNonNull(body, "body");
        try (GroupPrefixStack.Scope ignored = groups.open(prefix)) {
            body.accept(this);
        }
        return this;
    }

    public Router setNotFoundHandler(Supplier<?> handler) {
        this.notFoundHandler = handler;
        return this;
    }

    public Map<HttpMethod, List<RouteDefinition>> getRoutes() {
        Map<HttpMethod, List<RouteDefinition>> snapshot = new EnumMap<>(HttpMethod.class);
        routes.forEach((method, definitions) -> snapshot.put(method, List.copyOf(definitions)));
        return Collections.unmodifiableMap(snapshot);
    }

    public Optional<RouteMatch> findRoute(HttpMethod method, String path) {
        Objects.requireNonNull(method, "method");
        for (RouteDefinition route : routes.get(method)) {
            Optional<Map<String, String>> params = route.pattern().match(path);
            if (params.isPresent()) {
                return Optional.of(new RouteMatch(route, params.get()));
            }
        }
        return Optional.empty();
    }

    public DispatchResult dispatch(String method, String uri) {
        return dispatch(method, uri, FormFields.none());
    }

    public DispatchResult dispatch(String method, String uri, FormFields formFields) {
        String effectiveMethod = effectiveMethod(method, formFields);
        String path = extractPath(uri);

        Optional<HttpMethod> httpMethod = HttpMethod.fromName(effectiveMethod);
        if (httpMethod.isEmpty()) {
            log.debug("Unsupported method {} for {}", effectiveMethod, path);
            return NotFound.INSTANCE;
        }

        Optional<RouteMatch> match = findRoute(httpMethod.get(), path);
        if (match.isEmpty()) {
            log.debug("No route for {} {}", effectiveMethod, path);
            return NotFound.INSTANCE;
        }
        return match.get();
    }

    public Object handle(String method, String uri) {
        return handle(method, uri, FormFields.none());
    }

    /**
     * Dispatches and runs the outcome: the matched handler's result, the not-found handler's result, or a
     * {@link NotFoundResponse}. Handler failures propagate; no later route is tried.
     */
    public Object handle(String method, String uri, FormFields formFields) {
        DispatchResult result = dispatch(method, uri, formFields);
        if (result instanceof RouteMatch match) {
            return handlerInvoker.invoke(match.route().handler(), match.pathParams());
        }
        return handleNotFound();
    }

    private Object handleNotFound() {
        if (notFoundHandler != null) {
            return notFoundHandler.get();
        }
        return NotFoundResponse.withMessage(properties.getNotFoundMessage());
    }

    private String effectiveMethod(String method, FormFields formFields) {
        if (!properties.isMethodOverrideEnabled() || !HttpMethod.POST.name().equals(method)) {
            return method;
        }
        Optional<String> override = formFields.get(properties.getMethodOverrideField());
        if (override.isEmpty()) {
            return method;
        }
        String overridden = override.get().toUpperCase(Locale.ROOT);
        log.debug("POST overridden to {}", overridden);
        return overridden;
    }

    static String extractPath(String uri) {
        if (uri == null) {
            return "";
        }
        String path = uri;
        int end = firstIndexOf(path, '?', '#');
        if (end >= 0) {
            path = path.substring(0, end);
        }
        int scheme = path.indexOf("://");
        if (scheme > 0 && path.indexOf('/') > scheme) {
            int pathStart = path.indexOf('/', scheme + 3);
            path = pathStart < 0 ? "/" : path.substring(pathStart);
        }
        return path;
    }

    private static int firstIndexOf(String value, char first, char second) {
        int a = value.indexOf(first);
        int b = value.indexOf(second);
        if (a < 0) {
            return b;
        }
        if (b < 0) {
            return a;
        }
        return Math.min(a, b);
    }

}
