package com.challenges.jtree.json;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Valid documents must produce the same tree as Jackson does.
 */
public class JacksonConformanceTest {

    private final JsonParser parser = new JsonParser();
    private final JacksonTreeReader jackson = new JacksonTreeReader();

    @ParameterizedTest
    @ValueSource(strings = {
        "null",
        "true",
        "[]",
        "{}",
        "[0, -1, 42, 1e3, 2E+2, 2.5, -1.25, 0.5]",
        "\"plain\"",
        "\"escapes \\\" \\\\ \\/ \\b \\f \\n \\r \\t\"",
        "\"\\u00e9\\u20ac\\ud83d\\ude00\"",
        "{\"name\":\"John\",\"age\":30,\"tags\":[\"a\",\"b\"],\"address\":{\"city\":\"NYC\",\"zip\":null}}",
        "[[[[]]], {\"a\": {\"b\": {\"c\": [true, false]}}}]",
        "  {\n\t\"spaced\" : [ 1 , 2 ]\r\n}  ",
        "{\"dup\":1,\"dup\":2}",
        "[\"caf\u00e9\", \"\uD83D\uDE00\"]"
    })
    public void testSameTreeAsJackson(String json) throws IOException {
        JsonNode expected = jackson.read(json);
        JsonNode actual = parser.parse(json, true).orElseThrow();
        assertTrue(actual.equivalentTo(expected),
            () -> "Expected " + expected + " but got " + actual);
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "{\"name\":\"John\",\"nested\":{\"list\":[1,2,3],\"empty\":{}}}",
        "[\"tab\\tnewline\\ncontrol\\u0001\", -7, 2147483647]"
    })
    public void testPrintedTextReadsBackInJackson(String json) throws IOException {
        JsonNode tree = parser.parse(json).orElseThrow();
        assertTrue(jackson.read(tree.toString()).equivalentTo(tree));
        assertTrue(jackson.read(tree.toPrettyString()).equivalentTo(tree));
    }
}
