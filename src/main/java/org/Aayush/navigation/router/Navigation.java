package org.Aayush.navigation.router;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;
import org.Aayush.navigation.core.history.Location;
import org.Aayush.navigation.data.FormData;
import org.Aayush.navigation.data.FormEncType;
import org.Aayush.navigation.data.FormMethod;
import org.Aayush.navigation.data.Submission;

import java.util.Objects;

/**
 * Phase of the main navigation.
 *
 * <p>{@code IDLE} carries nothing. {@code LOADING} carries the target location and,
 * when loaders run after a submission, the submission fields. {@code SUBMITTING}
 * always carries both.</p>
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Navigation {

    public enum State {
        IDLE,
        LOADING,
        SUBMITTING
    }

    public static final Navigation IDLE = new Navigation(State.IDLE, null, null, null, null, null);

    State state;
    Location location;
    FormMethod formMethod;
    String formAction;
    FormEncType formEncType;
    FormData formData;

    public static Navigation loading(Location location) {
        return new Navigation(State.LOADING, Objects.requireNonNull(location, "location"), null, null, null, null);
    }

    /**
     * Loading phase that keeps the fields of the submission (if any) that caused it.
     */
    public static Navigation loading(Location location, Submission submission) {
        if (submission == null) {
            return loading(location);
        }
        return new Navigation(
                State.LOADING,
                Objects.requireNonNull(location, "location"),
                submission.getFormMethod(),
                submission.getFormAction(),
                submission.getFormEncType(),
                submission.getFormData()
        );
    }

    public static Navigation submitting(Location location, Submission submission) {
        Objects.requireNonNull(submission, "submission");
        return new Navigation(
                State.SUBMITTING,
                Objects.requireNonNull(location, "location"),
                submission.getFormMethod(),
                submission.getFormAction(),
                submission.getFormEncType(),
                submission.getFormData()
        );
    }

    public boolean isIdle() {
        return state == State.IDLE;
    }

    /**
     * Submission fields as a {@link Submission}, or null when none are carried.
     */
    public Submission submission() {
        if (formMethod == null) {
            return null;
        }
        return Submission.builder()
                .formMethod(formMethod)
                .formAction(formAction)
                .formEncType(formEncType)
                .formData(formData)
                .build();
    }
}
