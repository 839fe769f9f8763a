package org.Aayush.navigation.data;

import lombok.Getter;

import java.util.Objects;

/**
 * Carries a thrown {@link DataResponse} out of a loader or action.
 *
 * <p>Thrown redirects behave exactly like returned ones. Thrown non-redirect
 * responses become an {@link ErrorResponse} recorded at the nearest boundary.</p>
 */
@Getter
public final class DataResponseException extends RuntimeException {
    private final transient DataResponse response;

    public DataResponseException(DataResponse response) {
        super("Response thrown with status " + Objects.requireNonNull(response, "response").getStatus(),
                null, false, false);
        this.response = response;
    }
}
