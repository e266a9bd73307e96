package org.routeflow.http.handler;

import lombok.RequiredArgsConstructor;
import lombok.SneakyThrows;
import org.routeflow.exception.HandlerException;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

@RequiredArgsConstructor
public class HandlerInvoker {

    private final ControllerRegistry controllerRegistry;

    public Object invoke(RouteHandler handler, Map<String, String> pathParams) {
        return invoke(handler, new ArrayList<>(pathParams.values()));
    }

    public Object invoke(RouteHandler handler, List<String> args) {
        if (handler instanceof RouteHandler.Bound bound) {
            return bound.invoke(List.copyOf(args));
        }
        if (handler instanceof RouteHandler.ControllerMethod controllerMethod) {
            return invokeControllerMethod(controllerMethod, args);
        }
        throw new HandlerException("Invalid route handler");
    }

    private Object invokeControllerMethod(RouteHandler.ControllerMethod handler, List<String> args) {
        Object controller = controllerRegistry.newInstance(handler.type())
                .orElseThrow(() -> new HandlerException("Controller type " + handler.type() + " does not exist"));

        List<Method> candidates = publicMethods(controller.getClass(), handler.method());
        if (candidates.isEmpty()) {
            throw new HandlerException("Controller type " + handler.type() + " has no method " + handler.method());
        }
        Method method = widestFitting(candidates, args.size());
        if (method == null) {
            throw new HandlerException("Method " + handler.method() + " of controller type " + handler.type()
                    + " cannot be called with " + args.size() + " path parameter(s)");
        }

        return call(method, controller, args.subList(0, method.getParameterCount()).toArray());
    }

    private static List<Method> publicMethods(Class<?> type, String name) {
        List<Method> methods = new ArrayList<>();
        for (Method candidate : type.getMethods()) {
            if (candidate.getName().equals(name) && !Modifier.isStatic(candidate.getModifiers())) {
                methods.add(candidate);
            }
        }
        return methods;
    }

    // Widest overload that the available path parameters can fill; each parameter must accept a String.
    private static Method widestFitting(List<Method> candidates, int available) {
        Method best = null;
        for (Method candidate : candidates) {
            int arity = candidate.getParameterCount();
            boolean acceptsStrings = Arrays.stream(candidate.getParameterTypes())
                    .allMatch(type -> type.isAssignableFrom(String.class));
            if (acceptsStrings && arity <= available && (best == null || arity > best.getParameterCount())) {
                best = candidate;
            }
        }
        return best;
    }

    @SneakyThrows
    private static Object call(Method method, Object controller, Object[] args) {
        method.trySetAccessible();
        try {
            return method.invoke(controller, args);
        } catch (InvocationTargetException e) {
            throw e.getCause();
        } catch (IllegalAccessException e) {
            throw new HandlerException("Method " + method.getName() + " is not accessible", e);
        }
    }

}
