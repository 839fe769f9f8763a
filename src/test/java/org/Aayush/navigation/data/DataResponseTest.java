package org.Aayush.navigation.data;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("DataResponse Tests")
class DataResponseTest {

    // ========== Responses ==========

    @Test
    @DisplayName("Redirect helpers set status and Location")
    void testRedirects() {
        DataResponse redirect = DataResponse.redirect("/login");
        assertTrue(redirect.isRedirect());
        assertEquals(302, redirect.getStatus());
        assertEquals("/login", redirect.header("location"));
        assertNull(redirect.header(DataResponse.REVALIDATE));

        DataResponse revalidating = DataResponse.redirectWithRevalidation("/home");
        assertEquals("yes", revalidating.header(DataResponse.REVALIDATE));
    }

    @ParameterizedTest
    @ValueSource(ints = {200, 204, 299, 400, 500})
    void testNonRedirectStatuses(int status) {
        assertFalse(DataResponse.builder().status(status).build().isRedirect());
    }

    @Test
    @DisplayName("JSON helper marks the body as JSON")
    void testJson() {
        DataResponse response = DataResponse.json(Map.of("a", 1), 201);

        assertTrue(response.isJson());
        assertEquals(201, response.getStatus());
        assertEquals(Map.of("a", 1), response.getBody());
        assertFalse(DataResponse.builder().body("text").build().isJson());
    }

    @Test
    @DisplayName("Thrown responses carry their response")
    void testDataResponseException() {
        DataResponse response = DataResponse.json("nope", 404);
        DataResponseException ex = new DataResponseException(response);

        assertSame(response, ex.getResponse());
        assertTrue(ex.getMessage().contains("404"));
    }

    // ========== JSON bodies ==========

    @Test
    @DisplayName("String and byte bodies are parsed; objects pass through")
    void testReadBody() {
        JsonBodyCodec codec = new JsonBodyCodec(new ObjectMapper());
        Object body = List.of("kept");

        assertEquals(Map.of("items", List.of(1, 2)), codec.readBody("{\"items\":[1,2]}"));
        assertEquals(List.of("x"), codec.readBody("[\"x\"]".getBytes()));
        assertSame(body, codec.readBody(body));
        assertNull(codec.readBody("  "));
        assertNull(codec.readBody(null));
    }

    @Test
    @DisplayName("Malformed JSON bodies are rejected")
    void testReadBodyMalformed() {
        assertThrows(IllegalArgumentException.class, () -> JsonBodyCodec.defaults().readBody("{not json"));
    }
}
