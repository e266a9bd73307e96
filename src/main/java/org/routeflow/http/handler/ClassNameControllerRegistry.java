package org.routeflow.http.handler;

import lombok.extern.slf4j.Slf4j;
import org.routeflow.exception.HandlerException;

import java.lang.reflect.InvocationTargetException;
import java.util.Optional;

/**
 * Treats the type identifier as a fully qualified class name and builds it through its public no-arg constructor.
 */
@Slf4j
public class ClassNameControllerRegistry implements ControllerRegistry {

    private final ClassLoader classLoader;

    public ClassNameControllerRegistry() {
        this(ClassNameControllerRegistry.class.getClassLoader());
    }

    public ClassNameControllerRegistry(ClassLoader classLoader) {
        this.classLoader = classLoader;
    }

    @Override
    public Optional<Object> newInstance(String type) {
        Class<?> controllerClass;
        try {
            controllerClass = Class.forName(type, true, classLoader);
        } catch (ClassNotFoundException e) {
            log.debug("Controller class {} not found", type);
            return Optional.empty();
        }

        try {
            return Optional.of(controllerClass.getConstructor().newInstance());
        } catch (NoSuchMethodException | IllegalAccessException e) {
            throw new HandlerException("Controller class " + type + " has no public no-arg constructor", e);
        } catch (InstantiationException e) {
            throw new HandlerException("Controller class " + type + " cannot be instantiated", e);
        } catch (InvocationTargetException e) {
            throw new HandlerException("Constructor of controller class " + type + " failed", e.getCause());
        }
    }

}
