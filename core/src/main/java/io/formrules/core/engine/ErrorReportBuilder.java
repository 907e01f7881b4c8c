package io.formrules.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.formrules.core.error.FormReadException;
import io.formrules.core.model.ValidationResult;
import io.formrules.core.model.Violation;
import java.util.List;
import java.util.Map;

/**
 * Builds RFC 9457 Problem Details reports.
 *
 * <p>A failed validation produces:
 *
 * <pre>{@code
 * {
 *   "type": "urn:formrules:validation-failed",
 *   "title": "Validation Failed",
 *   "status": 422,
 *   "detail": "2 rule(s) failed on 1 field(s) of rule set 'create-event'",
 *   "instance": "/events",
 *   "errors": {
 *     "end": [ { "rule": "after", "parameters": ["start"] } ]
 *   }
 * }
 * }</pre>
 *
 * <p>Thread-safe and immutable.
 */
public final class ErrorReportBuilder {

    public static final String VALIDATION_FAILED_URN = "urn:formrules:validation-failed";
    public static final String MALFORMED_FORM_URN = "urn:formrules:malformed-form";

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final int DEFAULT_STATUS = 422;
    private static final int BAD_REQUEST = 400;

    private final int status;

    /** Creates a builder reporting failed validations with HTTP status 422. */
    public ErrorReportBuilder() {
        this(DEFAULT_STATUS);
    }

    /**
     * Creates a builder with a custom HTTP status for failed validations.
     *
     * @param status the HTTP status code to report
     */
    public ErrorReportBuilder(int status) {
        this.status = status;
    }

    /** Returns the HTTP status code reported for failed validations. */
    public int status() {
        return status;
    }

    /**
     * Builds the report of a failed validation.
     *
     * @param result       a result with at least one violation
     * @param instancePath the request path, may be null
     * @throws IllegalArgumentException if the result is valid
     */
    public JsonNode buildReport(ValidationResult result, String instancePath) {
        if (result.isValid()) {
            throw new IllegalArgumentException("No report for a valid result of rule set '" + result.ruleSetId() + "'");
        }
        Map<String, List<Violation>> byPath = result.violationsByPath();

        ObjectNode report = problem(
                VALIDATION_FAILED_URN,
                "Validation Failed",
                status,
                String.format(
                        "%d rule(s) failed on %d field(s) of rule set '%s'",
                        result.violations().size(), byPath.size(), result.ruleSetId()),
                instancePath);

        ObjectNode errors = report.putObject("errors");
        byPath.forEach((path, violations) -> {
            ArrayNode entries = errors.putArray(path);
            for (Violation violation : violations) {
                ObjectNode entry = entries.addObject();
                entry.put("rule", violation.rule());
                ArrayNode parameters = entry.putArray("parameters");
                violation.parameters().forEach(parameters::add);
            }
        });
        return report;
    }

    /**
     * Builds the report of a request body that could not be decoded. Always uses HTTP status 400.
     *
     * @param exception    the decoding failure
     * @param instancePath the request path, may be null
     */
    public JsonNode buildReport(FormReadException exception, String instancePath) {
        return problem(MALFORMED_FORM_URN, "Malformed Form", BAD_REQUEST, exception.getMessage(), instancePath);
    }

    private static ObjectNode problem(String type, String title, int status, String detail, String instancePath) {
        ObjectNode response = MAPPER.createObjectNode();
        response.put("type", type);
        response.put("title", title);
        response.put("status", status);
        response.put("detail", detail);

        if (instancePath != null) {
            response.put("instance", instancePath);
        } else {
            response.putNull("instance");
        }
        return response;
    }
}
