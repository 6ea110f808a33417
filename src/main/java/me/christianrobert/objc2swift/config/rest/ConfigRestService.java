package me.christianrobert.objc2swift.config.rest;

import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import me.christianrobert.objc2swift.config.service.ConfigService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;

/**
 * REST access to the transformer settings.
 *
 * <pre>
 * curl http://localhost:8080/api/config
 * curl -X PUT http://localhost:8080/api/config/swift.indent-width \
 *   -H "Content-Type: application/json" --data '{"value": 2}'
 * </pre>
 */
@Path("/api/config")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class ConfigRestService {

    private static final Logger log = LoggerFactory.getLogger(ConfigRestService.class);

    static final int MAX_INDENT_WIDTH = 16;

    @Inject
    ConfigService configService;

    @GET
    public Response getConfiguration() {
        log.info("Getting configuration");
        return Response.ok(configService.getAllConfiguration()).build();
    }

    @GET
    @Path("/{key}")
    public Response getConfigValue(@PathParam("key") String key) {
        log.debug("Getting config value for key: {}", key);

        Object value = configService.getConfigValue(key);
        if (value == null) {
            return Response.status(Response.Status.NOT_FOUND)
                    .entity(Map.of("error", "Configuration key not found: " + key))
                    .build();
        }

        return Response.ok(Map.of("key", key, "value", value)).build();
    }

    @PUT
    @Path("/{key}")
    public Response setConfigValue(@PathParam("key") String key, Map<String, Object> body) {
        log.debug("Setting config value for key: {}", key);

        if (body == null || !body.containsKey("value")) {
            return badRequest("Request body must contain 'value' field");
        }
        if (!configService.hasConfigKey(key)) {
            return Response.status(Response.Status.NOT_FOUND)
                    .entity(Map.of("error", "Configuration key not found: " + key))
                    .build();
        }

        Object value = body.get("value");
        String problem = validate(key, value);
        if (problem != null) {
            log.warn("Rejected config value for {}: {}", key, problem);
            return badRequest(problem);
        }

        configService.setConfigValue(key, value);

        Map<String, Object> response = new HashMap<>();
        response.put("status", "success");
        response.put("key", key);
        response.put("value", configService.getConfigValue(key));

        return Response.ok(response).build();
    }

    @POST
    @Path("/reset")
    public Response resetConfiguration() {
        log.info("Resetting configuration to defaults");
        configService.resetToDefaults();
        return Response.ok(Map.of("status", "success")).build();
    }

    // Returns an error message, or null when the value fits the key
    static String validate(String key, Object value) {
        if (ConfigService.INDENT_WIDTH.equals(key)) {
            Integer width = ConfigService.toInteger(value);
            if (width == null || width < 0 || width > MAX_INDENT_WIDTH) {
                return ConfigService.INDENT_WIDTH + " must be a number between 0 and " + MAX_INDENT_WIDTH;
            }
        } else if (ConfigService.INCLUDE_AST.equals(key)) {
            if (!(value instanceof Boolean) && !"true".equals(value) && !"false".equals(value)) {
                return ConfigService.INCLUDE_AST + " must be true or false";
            }
        }
        return null;
    }

    private Response badRequest(String message) {
        return Response.status(Response.Status.BAD_REQUEST)
                .entity(Map.of("error", message))
                .build();
    }
}
