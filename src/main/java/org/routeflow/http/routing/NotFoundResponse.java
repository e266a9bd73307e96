package org.routeflow.http.routing;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Map;

/**
 * Default outcome when nothing matched and no not-found handler is set. Rendering it is left to the transport.
 */
public record NotFoundResponse(int status, String contentType, String body) {

    public static final int STATUS = 404;
    public static final String CONTENT_TYPE = "application/json";

    private static final ObjectMapper objectMapper = new ObjectMapper();

    public static NotFoundResponse withMessage(String message) {
        try {
            return new NotFoundResponse(STATUS, CONTENT_TYPE, objectMapper.writeValueAsString(Map.of("error", message)));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot encode not-found body", e);
        }
    }

}
