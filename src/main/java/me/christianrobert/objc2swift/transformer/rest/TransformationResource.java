package me.christianrobert.objc2swift.transformer.rest;

import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import me.christianrobert.objc2swift.transformer.context.TransformationResult;
import me.christianrobert.objc2swift.transformer.service.TransformationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * REST endpoint for Objective-C to Swift transformation.
 *
 * <p>Usage:
 * <pre>
 * curl -X POST "http://localhost:8080/api/transformation/objc?showAst=false" \
 *   -H "Content-Type: text/plain" \
 *   --data-binary @Person.m
 * </pre>
 *
 * <p>Response format (JSON):
 * <pre>
 * {
 *   "success": true,
 *   "objcSource": "...",
 *   "swiftSource": "...",
 *   "errorMessage": null
 * }
 * </pre>
 *
 * <p>Note: Always returns HTTP 200. Check "success" field in response.
 * Transformation failure is a valid business outcome, not an HTTP error.
 */
@Path("/api/transformation")
@Produces(MediaType.APPLICATION_JSON)
public class TransformationResource {

    private static final Logger log = LoggerFactory.getLogger(TransformationResource.class);

    @Inject
    TransformationService transformationService;

    /**
     * Transforms Objective-C source to Swift.
     *
     * @param showAst Optional flag to include the AST tree (defaults to configuration)
     * @param objcSource Objective-C source (text/plain body)
     * @return TransformationResult as JSON (always HTTP 200, check "success" field)
     */
    @POST
    @Path("/objc")
    @Consumes(MediaType.TEXT_PLAIN)
    public TransformationResult transformObjc(
            @QueryParam("showAst") Boolean showAst,
            String objcSource
    ) {
        log.info("Objective-C transformation request received via REST API");
        log.trace("Objective-C source: {}", objcSource);

        if (objcSource == null || objcSource.trim().isEmpty()) {
            log.warn("Empty source received");
            return TransformationResult.failure("", "Source cannot be empty");
        }

        TransformationResult result = showAst != null
                ? transformationService.transformSource(objcSource, showAst)
                : transformationService.transformSource(objcSource);

        if (result.isSuccess()) {
            log.info("Transformation successful");
        } else {
            log.warn("Transformation failed: {}", result.getErrorMessage());
        }
        return result;
    }
}
