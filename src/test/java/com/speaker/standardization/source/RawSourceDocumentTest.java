package com.speaker.standardization.source;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RawSourceDocument Tests")
class RawSourceDocumentTest {

    private RawSourceDocument document() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("_id", 42);
        fields.put("name", "Jane Smith");
        fields.put("blank", "  ");
        fields.put("location", Map.of("travels_from", "Austin, TX"));
        fields.put("topics", Arrays.asList("AI", null, 7, "Leadership"));
        fields.put("keynotes", List.of(Map.of("title", "Talk"), "plain"));
        return new RawSourceDocument(SpeakerSource.BIGSPEAK, fields);
    }

    @Test
    @DisplayName("string should stringify scalars and ignore containers")
    void string() {
        RawSourceDocument doc = document();

        assertEquals("42", doc.string("_id"));
        assertNull(doc.string("location"));
        assertNull(doc.string("topics"));
        assertNull(doc.string("missing"));
    }

    @Test
    @DisplayName("firstString should skip blank values")
    void firstString() {
        assertEquals("Jane Smith", document().firstString("missing", "blank", "name"));
        assertNull(document().firstString("missing", "blank"));
    }

    @Test
    @DisplayName("nested should keep the source and read sub-fields")
    void nested() {
        RawSourceDocument location = document().nested("location");

        assertEquals(SpeakerSource.BIGSPEAK, location.source());
        assertEquals("Austin, TX", location.string("travels_from"));
        assertTrue(document().nested("name").fields().isEmpty());
    }

    @Test
    @DisplayName("List accessors should drop nulls and wrong element types")
    void lists() {
        RawSourceDocument doc = document();

        assertEquals(List.of("AI", 7, "Leadership"), doc.list("topics"));
        assertEquals(List.of("AI", "Leadership"), doc.stringList("topics"));
        assertEquals(1, doc.documentList("keynotes").size());
        assertEquals("Talk", doc.documentList("keynotes").get(0).string("title"));
        assertTrue(doc.list("name").isEmpty());
    }

    @Test
    @DisplayName("Fields should be read-only")
    void readOnly() {
        assertThrows(UnsupportedOperationException.class, () -> document().fields().put("x", 1));
    }
}
