package org.routeflow.configuration;

import lombok.Builder;
import lombok.Data;
import org.routeflow.exception.ConfigurationException;

@Data
@Builder
public class RouterProperties {

    public static final String DEFAULT_OVERRIDE_FIELD = "_method";
    public static final String DEFAULT_NOT_FOUND_MESSAGE = "Route not found";

    @Builder.Default
    private boolean methodOverrideEnabled = true;
    @Builder.Default
    private String methodOverrideField = DEFAULT_OVERRIDE_FIELD;
    @Builder.Default
    private boolean quoteLiterals = true;
    @Builder.Default
    private String notFoundMessage = DEFAULT_NOT_FOUND_MESSAGE;

    public static RouterProperties defaults() {
        return RouterProperties.builder().build();
    }

    public static RouterProperties initialize() {
        return from(ConfigurationManager.getINSTANCE());
    }

    public static RouterProperties from(ConfigurationManager config) {
        String overrideField = config.getProperty("router.method-override.field", DEFAULT_OVERRIDE_FIELD);
        if (overrideField.isEmpty()) {
            throw new ConfigurationException("router.method-override.field must not be empty");
        }

        return RouterProperties.builder()
                .methodOverrideEnabled(config.getBooleanProperty("router.method-override.enabled", true))
                .methodOverrideField(overrideField)
                .quoteLiterals(config.getBooleanProperty("router.pattern.quote-literals", true))
                .notFoundMessage(config.getProperty("router.not-found.message", DEFAULT_NOT_FOUND_MESSAGE))
                .build();
    }

}
