package org.Aayush.navigation.router;

import lombok.Builder;
import lombok.Value;
import org.Aayush.navigation.data.FormData;
import org.Aayush.navigation.data.FormEncType;
import org.Aayush.navigation.data.FormMethod;

/**
 * Options of {@link Router#navigate(String, NavigateOptions)} and
 * {@link Router#fetch(String, String, String, NavigateOptions)}.
 *
 * <p>Without form method and form data the call is a plain navigation or load. A
 * mutating method makes it a submission. Form data with {@code GET} is serialized
 * into the search string.</p>
 */
@Value
@Builder
public class NavigateOptions {
    public static final NavigateOptions NONE = NavigateOptions.builder().build();

    boolean replace;
    Object state;
    /** Null leaves the scroll-reset decision to the rendering layer. */
    Boolean preventScrollReset;
    FormMethod formMethod;
    FormEncType formEncType;
    FormData formData;

    public boolean hasForm() {
        return formMethod != null || formData != null;
    }
}
