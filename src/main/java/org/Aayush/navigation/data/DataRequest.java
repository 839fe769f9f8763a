package org.Aayush.navigation.data;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import org.Aayush.navigation.core.history.Path;
import org.Aayush.navigation.core.signal.AbortSignal;

/**
 * Request-like descriptor passed to loaders and actions.
 *
 * <p>The path never carries a fragment identifier. Submissions with a mutating
 * method carry their form data; loader requests carry none.</p>
 */
@Value
@Builder
public class DataRequest {
    @NonNull
    String origin;
    @NonNull
    Path path;
    @NonNull
    @Builder.Default
    FormMethod method = FormMethod.GET;
    @NonNull
    AbortSignal signal;
    FormEncType encType;
    FormData formData;

    /**
     * Absolute URL of this request.
     */
    public String getUrl() {
        return origin + path.toHref();
    }
}
