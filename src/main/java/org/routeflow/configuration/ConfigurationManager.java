package org.routeflow.configuration;

import lombok.extern.slf4j.Slf4j;
import org.routeflow.exception.ConfigurationException;

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

@Slf4j
public class ConfigurationManager {

    static final String DEFAULT_RESOURCE = "router.properties";

    private static ConfigurationManager INSTANCE;
    private final Properties properties;

    private ConfigurationManager(Properties properties) {
        this.properties = properties;
    }

    public static synchronized ConfigurationManager getINSTANCE() {
        if (INSTANCE == null) {
            INSTANCE = new ConfigurationManager(loadResource(DEFAULT_RESOURCE));
        }

        return INSTANCE;
    }

    public static synchronized void overrideProperties(String path) {
        Properties overrides = new Properties();
        try (FileInputStream input = new FileInputStream(path)) {
            overrides.load(input);
        } catch (FileNotFoundException e) {
            log.error("Configuration file not found: {}", path, e);
            throw new ConfigurationException("Configuration file not found: " + path, e);
        } catch (IOException e) {
            log.error("Error loading configuration file: {}", path, e);
            throw new ConfigurationException("Error loading configuration file: " + path, e);
        }
        getINSTANCE().properties.putAll(overrides);
        log.info("Applied {} configuration overrides from {}", overrides.size(), path);
    }

    public static ConfigurationManager fromProperties(Properties properties) {
        Properties copy = new Properties();
        copy.putAll(properties);
        return new ConfigurationManager(copy);
    }

    static synchronized void reset() {
        INSTANCE = null;
    }

    private static Properties loadResource(String resource) {
        Properties properties = new Properties();
        try (InputStream input = ConfigurationManager.class.getClassLoader().getResourceAsStream(resource)) {
            if (input == null) {
                log.info("Configuration resource {} not found on classpath, using defaults", resource);
                return properties;
            }
            properties.load(input);
        } catch (IOException e) {
            log.error("Error loading configuration resource: {}", resource, e);
            throw new ConfigurationException("Error loading configuration resource: " + resource, e);
        }
        return properties;
    }

    public String getProperty(String key, String defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            log.debug("Property {} not found in configuration. Using default value: {}", key, defaultValue);
            return defaultValue;
        }
        return value.trim();
    }

    public boolean getBooleanProperty(String key, boolean defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            log.debug("Using default value for property: {}", key);
            return defaultValue;
        }
        String trimmed = value.trim();
        if (trimmed.equalsIgnoreCase("true")) {
            return true;
        }
        if (trimmed.equalsIgnoreCase("false")) {
            return false;
        }
        log.warn("Invalid boolean format for property: {}", key);
        throw new ConfigurationException("Invalid boolean format for property: " + key);
    }

}
