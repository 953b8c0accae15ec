package eu.virtualparadox.notedraft.rag.stream;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class StreamingFieldDecoderTest {

    @Test
    @DisplayName("Nothing is available before the key and the opening quote arrive")
    void notYetAvailable() {
        assertNull(StreamingFieldDecoder.feed("", "text"));
        assertNull(StreamingFieldDecoder.feed("{\"te", "text"));
        assertNull(StreamingFieldDecoder.feed("{\"text\"", "text"));
        assertNull(StreamingFieldDecoder.feed("{\"text\": ", "text"));
        assertEquals("", StreamingFieldDecoder.feed("{\"text\": \"", "text"));
    }

    @Test
    @DisplayName("Partial values grow with the buffer")
    void partialValues() {
        StringBuilder buffer = new StringBuilder("{\"text\": \"Patient rep");
        DecodedField partial = StreamingFieldDecoder.decode(buffer, "text");
        assertEquals("Patient rep", partial.value());
        assertFalse(partial.complete());

        buffer.append("orts insomnia.\", \"citations\": []}");
        DecodedField complete = StreamingFieldDecoder.decode(buffer, "text");
        assertEquals("Patient reports insomnia.", complete.value());
        assertTrue(complete.complete());
    }

    @Test
    @DisplayName("JSON escapes are inverted")
    void escapes() {
        String buffer = "{\"text\":\"Line 1\\nLine\\t2 \\\"quoted\\\" back\\\\slash \\u00e9\\/\"}";

        assertEquals("Line 1\nLine\t2 \"quoted\" back\\slash \u00e9/", StreamingFieldDecoder.feed(buffer, "text"));
    }

    @Test
    @DisplayName("An escape cut off at the end of the buffer is held back")
    void danglingEscape() {
        assertEquals("Mood", StreamingFieldDecoder.feed("{\"text\":\"Mood\\", "text"));
        assertEquals("Mood ", StreamingFieldDecoder.feed("{\"text\":\"Mood \\u00", "text"));
    }

    @Test
    @DisplayName("Other fields before the target do not confuse the decoder")
    void otherFields() {
        String buffer = "{\"citations\":[{\"chunkId\":\"a_chunk_0\"}],\"text\":\"Sleeps 4h";

        assertEquals("Sleeps 4h", StreamingFieldDecoder.feed(buffer, "text"));
    }

    @Test
    @DisplayName("Malformed buffers never throw")
    void neverThrows() {
        assertDoesNotThrow(() -> StreamingFieldDecoder.feed("}}}{\"text\":\"\\u12zz\"", "text"));
        assertNull(StreamingFieldDecoder.feed(null, "text"));
        assertNull(StreamingFieldDecoder.feed("{\"text\":\"x\"}", ""));
    }
}
