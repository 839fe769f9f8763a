package org.Aayush.navigation.router;

import org.Aayush.navigation.data.DataResponse;

/**
 * Outcome of {@link StaticHandler#query}: a render context, or a response such as a
 * redirect to send back as is.
 */
public sealed interface QueryResult permits StaticHandlerContext, QueryResult.RawResponse {

    record RawResponse(DataResponse response) implements QueryResult {
    }
}
