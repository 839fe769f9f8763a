package org.Aayush.navigation.data;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("FormData Tests")
class FormDataTest {

    @Test
    @DisplayName("Fields keep insertion order and repeated names")
    void testMultiMap() {
        FormData formData = FormData.of("tag", "a", "name", "x").append("tag", "b");

        assertEquals("a", formData.get("tag"));
        assertEquals(List.of("a", "b"), formData.getAll("tag"));
        assertNull(formData.get("missing"));
        assertEquals(3, formData.entries().size());
    }

    @Test
    @DisplayName("Odd name/value input is rejected")
    void testOddPairs() {
        assertThrows(IllegalArgumentException.class, () -> FormData.of("lonely"));
    }

    @Test
    @DisplayName("Text fields serialize as URL-encoded search params")
    void testToSearchParams() {
        FormData formData = FormData.of("q", "hello world", "filter", "a&b=c");

        assertEquals("q=hello+world&filter=a%26b%3Dc", formData.toSearchParams());
        assertEquals("", new FormData().toSearchParams());
    }

    @Test
    @DisplayName("Binary fields cannot be serialized into a search string")
    void testBinaryFields() {
        byte[] content = {1, 2, 3};
        FormData formData = new FormData().append("name", "x").appendBinary("file", content);
        content[0] = 9;

        assertTrue(formData.hasBinary());
        assertFalse(FormData.of("a", "b").hasBinary());
        assertNull(formData.get("file"));
        assertEquals(1, formData.entries().get(1).binary()[0]);
        assertThrows(IllegalStateException.class, formData::toSearchParams);
    }
}
