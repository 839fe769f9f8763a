package org.Aayush.navigation.data;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * HTTP-response-like value a loader or action may return or throw.
 *
 * <p>Statuses 300-399 with a {@code Location} header are redirects. A body whose
 * {@code Content-Type} starts with {@code application/json} is parsed as JSON when it
 * is a string; any other body is handed through as-is.</p>
 */
@Value
@Builder(toBuilder = true)
public class DataResponse {
    public static final String LOCATION = "Location";
    public static final String CONTENT_TYPE = "Content-Type";
    public static final String REVALIDATE = "X-Remix-Revalidate";
    public static final String APPLICATION_JSON = "application/json; charset=utf-8";

    @Builder.Default
    int status = 200;
    @Builder.Default
    String statusText = "";
    @Singular
    Map<String, String> headers;
    Object body;

    /**
     * Looks a header up case-insensitively.
     *
     * @return header value or null.
     */
    public String header(String name) {
        for (Map.Entry<String, String> entry : headers.entrySet()) {
            if (entry.getKey().equalsIgnoreCase(name)) {
                return entry.getValue();
            }
        }
        return null;
    }

    public boolean isRedirect() {
        return status >= 300 && status <= 399;
    }

    public boolean isJson() {
        String contentType = header(CONTENT_TYPE);
        return contentType != null && contentType.startsWith("application/json");
    }

    /**
     * JSON response carrying {@code data}; the body stays an object and is not re-parsed.
     */
    public static DataResponse json(Object data) {
        return json(data, 200);
    }

    public static DataResponse json(Object data, int status) {
        return DataResponse.builder()
                .status(status)
                .header(CONTENT_TYPE, APPLICATION_JSON)
                .body(data)
                .build();
    }

    /**
     * 302 redirect to {@code location}.
     */
    public static DataResponse redirect(String location) {
        return redirect(location, 302);
    }

    public static DataResponse redirect(String location, int status) {
        return DataResponse.builder()
                .status(status)
                .header(LOCATION, location)
                .build();
    }

    /**
     * Redirect that forces the follow-up navigation to revalidate every loader.
     */
    public static DataResponse redirectWithRevalidation(String location) {
        return DataResponse.builder()
                .status(302)
                .header(LOCATION, location)
                .header(REVALIDATE, "yes")
                .build();
    }
}
