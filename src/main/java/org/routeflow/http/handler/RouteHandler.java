package org.routeflow.http.handler;

import org.routeflow.exception.HandlerException;

import java.util.List;
import java.util.Objects;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * What a route resolves to: either something directly invocable, or a controller type plus method name that is
 * looked up through a {@link ControllerRegistry} when the route is hit.
 */
public sealed interface RouteHandler permits RouteHandler.Bound, RouteHandler.ControllerMethod {

    /**
     * Receives the path parameter values in the order their placeholders appear in the route.
     */
    @FunctionalInterface
    non-sealed interface Bound extends RouteHandler {
        Object invoke(List<String> args);
    }

    record ControllerMethod(String type, String method) implements RouteHandler {
        public ControllerMethod {
            Objects.requireNonNull(type, "type");
            Objects.requireNonNull(method, "method");
        }
    }

    static Bound of(Supplier<?> handler) {
        Objects.requireNonNull(handler);
        return args -> handler.get();
    }

    static Bound of(Function<String, ?> handler) {
        Objects.requireNonNull(handler);
        return args -> {
            requireArity(args, 1);
            return handler.apply(args.get(0));
        };
    }

    static Bound of(BiFunction<String, String, ?> handler) {
        Objects.requireNonNull(handler);
        return args -> {
            requireArity(args, 2);
            return handler.apply(args.get(0), args.get(1));
        };
    }

    static ControllerMethod controller(String type, String method) {
        return new ControllerMethod(type, method);
    }

    private static void requireArity(List<String> args, int expected) {
        if (args.size() < expected) {
            throw new HandlerException("Handler expects " + expected + " path parameter(s) but route supplied "
                    + args.size());
        }
    }

}
