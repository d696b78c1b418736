package org.schemadiff.format.openapi;

import org.schemadiff.model.SchemaPath;

import java.util.List;
import java.util.Locale;

/**
 * Reads the normalized OpenAPI layout back out of a path:
 * {@code /paths/{path}/{method}/parameters|requestBody|responses/...} and
 * {@code /components/schemas|securitySchemes/{name}/...}.
 */
final class ApiLocation {

    static final String PATHS = "paths";
    static final String COMPONENTS = "components";
    static final String PARAMETERS = "parameters";
    static final String REQUEST_BODY = "requestBody";
    static final String RESPONSES = "responses";
    static final String SCHEMAS = "schemas";
    static final String SECURITY_SCHEMES = "securitySchemes";

    enum Direction {
        REQUEST,
        RESPONSE,
        NONE
    }

    private ApiLocation() {
    }

    static Direction direction(SchemaPath path) {
        List<String> segments = path.segments();
        if (segments.size() < 4 || !PATHS.equals(segments.get(0))) {
            return Direction.NONE;
        }
        return switch (segments.get(3)) {
            case PARAMETERS, REQUEST_BODY -> Direction.REQUEST;
            case RESPONSES -> Direction.RESPONSE;
            default -> Direction.NONE;
        };
    }

    static String describe(SchemaPath path) {
        List<String> s = path.segments();
        if (s.isEmpty()) {
            return "document";
        }
        if (PATHS.equals(s.get(0))) {
            if (s.size() == 1) return "paths";
            if (s.size() == 2) return "path " + s.get(1);
            String operation = s.get(2).toUpperCase(Locale.ROOT) + " " + s.get(1);
            if (s.size() == 3) return "operation " + operation;
            return switch (s.get(3)) {
                case PARAMETERS -> s.size() == 4
                        ? "parameters of " + operation
                        : "parameter " + s.get(4) + field(s, 5) + " of " + operation;
                case REQUEST_BODY -> "request body" + field(s, 4) + " of " + operation;
                case RESPONSES -> s.size() == 4
                        ? "responses of " + operation
                        : "response " + s.get(4) + field(s, 5) + " of " + operation;
                default -> path.toString();
            };
        }
        if (COMPONENTS.equals(s.get(0)) && s.size() >= 3) {
            if (SCHEMAS.equals(s.get(1))) return "schema " + s.get(2) + field(s, 3);
            if (SECURITY_SCHEMES.equals(s.get(1))) return "security scheme " + s.get(2);
        }
        return path.toString();
    }

    private static String field(List<String> segments, int from) {
        if (segments.size() <= from) {
            return "";
        }
        return " field " + String.join(".", segments.subList(from, segments.size()));
    }
}
