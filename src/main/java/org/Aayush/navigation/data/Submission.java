package org.Aayush.navigation.data;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A pending mutation request driving an action call.
 */
@Value
@Builder
public class Submission {
    @NonNull
    FormMethod formMethod;
    @NonNull
    String formAction;
    @NonNull
    @Builder.Default
    FormEncType formEncType = FormEncType.URL_ENCODED;
    @NonNull
    FormData formData;
}
