package org.routeflow.http.handler;

import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

@Slf4j
public class SimpleControllerRegistry implements ControllerRegistry {

    private final Map<String, Supplier<?>> factories = new ConcurrentHashMap<>();

    public SimpleControllerRegistry register(String type, Supplier<?> factory) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(factory, "factory");
        if (factories.put(type, factory) != null) {
            log.warn("Controller factory for '{}' replaced", type);
        }
        return this;
    }

    public <T> SimpleControllerRegistry register(Class<T> type, Supplier<? extends T> factory) {
        return register(type.getName(), factory);
    }

    @Override
    public Optional<Object> newInstance(String type) {
        Supplier<?> factory = factories.get(type);
        if (factory == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(factory.get());
    }

}
