package org.Aayush.navigation.router;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;
import org.Aayush.navigation.data.FormData;
import org.Aayush.navigation.data.FormEncType;
import org.Aayush.navigation.data.FormMethod;
import org.Aayush.navigation.data.Submission;

/**
 * State of one keyed fetcher.
 *
 * <p>Every phase carries the last known data. Submission fields are present while a
 * fetcher submits and while it reloads after its own action.</p>
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Fetcher {

    public enum State {
        IDLE,
        LOADING,
        SUBMITTING
    }

    public static final Fetcher IDLE = new Fetcher(State.IDLE, null, null, null, null, null);

    State state;
    Object data;
    FormMethod formMethod;
    String formAction;
    FormEncType formEncType;
    FormData formData;

    public static Fetcher idle(Object data) {
        return new Fetcher(State.IDLE, data, null, null, null, null);
    }

    public static Fetcher loading(Object data) {
        return new Fetcher(State.LOADING, data, null, null, null, null);
    }

    public static Fetcher loading(Object data, Submission submission) {
        return new Fetcher(
                State.LOADING,
                data,
                submission.getFormMethod(),
                submission.getFormAction(),
                submission.getFormEncType(),
                submission.getFormData()
        );
    }

    public static Fetcher submitting(Object data, Submission submission) {
        return new Fetcher(
                State.SUBMITTING,
                data,
                submission.getFormMethod(),
                submission.getFormAction(),
                submission.getFormEncType(),
                submission.getFormData()
        );
    }
}
