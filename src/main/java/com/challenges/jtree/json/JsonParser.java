package com.challenges.jtree.json;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * Recursive-descent JSON parser producing a {@link JsonNode} tree.
 * <p>
 * The parser keeps no state between calls: every call reports its own
 * error position through the returned {@link ParseResult}, so one instance
 * can be shared between threads.
 */
public class JsonParser {
    public static final int DEFAULT_MAX_DEPTH = 512;

    private final int maxDepth;

    public JsonParser() {
        this(DEFAULT_MAX_DEPTH);
    }

    /**
     * @param maxDepth how deeply arrays and objects may nest before parsing fails
     */
    public JsonParser(int maxDepth) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
        }
        this.maxDepth = maxDepth;
    }

    public ParseResult parse(InputStream input) throws IOException {
        return parse(new String(input.readAllBytes(), StandardCharsets.UTF_8));
    }

    /**
     * Parses the first value in {@code text}. Anything after it is ignored.
     */
    public ParseResult parse(CharSequence text) {
        return parse(text, false);
    }

    /**
     * @param requireFullConsumption if true, anything but whitespace after the
     *                               value is an error
     */
    public ParseResult parse(CharSequence text, boolean requireFullConsumption) {
        Parse parse = new Parse(new JsonScanner(text));
        ParseResult result = parse.run(requireFullConsumption);
        if (result instanceof ParseResult.Failure f && LOGGER.isDebugEnabled()) {
            LOGGER.debug("Parse failed at offset {}: {}", f.position(), f.message());
        }
        return result;
    }

    /**
     * State of a single parse call.
     * Each rule returns the node it built, or null after recording the failure.
     */
    private final class Parse {
        private final JsonScanner scanner;
        private int depth = 0;
        private int errorPosition;
        private String errorMessage;

        Parse(JsonScanner scanner) {
            this.scanner = scanner;
        }

        ParseResult run(boolean requireFullConsumption) {
            scanner.skipWhitespace();
            JsonNode root = parseValue();
            if (root == null) {
                return new ParseResult.Failure(errorPosition, errorMessage);
            }
            if (requireFullConsumption) {
                scanner.skipWhitespace();
                if (!scanner.atEnd()) {
                    return new ParseResult.Failure(scanner.position(), "Unexpected content after value");
                }
            }
            return new ParseResult.Success(root, scanner.position());
        }

        private JsonNode fail(String message) {
            errorPosition = scanner.position();
            errorMessage = message;
            return null;
        }

        private JsonNode parseValue() {
            if (scanner.startsWith("null")) {
                scanner.advance(4);
                return JsonNode.nullNode();
            }
            if (scanner.startsWith("false")) {
                scanner.advance(5);
                return JsonNode.falseNode();
            }
            if (scanner.startsWith("true")) {
                scanner.advance(4);
                return JsonNode.trueNode();
            }
            int c = scanner.peek();
            if (c == '"') {
                return JsonNode.string(scanner.scanString());
            }
            if (c == '-' || (c >= '0' && c <= '9')) {
                return JsonNode.number(scanner.scanNumber());
            }
            if (c == '[') {
                return parseArray();
            }
            if (c == '{') {
                return parseObject();
            }
            return fail(c == JsonScanner.END ? "Unexpected end of input" : "Unexpected character '" + (char) c + "'");
        }

        private JsonNode parseArray() {
            if (++depth > maxDepth) {
                return fail("Nesting deeper than " + maxDepth);
            }
            JsonNode array = JsonNode.array();
            scanner.advance(1);
            scanner.skipWhitespace();
            if (scanner.peek() == ']') {
                scanner.advance(1);
                depth--;
                return array;
            }
            do {
                scanner.skipWhitespace();
                JsonNode element = parseValue();
                if (element == null) {
                    return null;
                }
                array.link(element);
                scanner.skipWhitespace();
            } while (consume(','));

            if (!consume(']')) {
                return fail("Expected ',' or ']'");
            }
            depth--;
            return array;
        }

        private JsonNode parseObject() {
            if (++depth > maxDepth) {
                return fail("Nesting deeper than " + maxDepth);
            }
            JsonNode object = JsonNode.object();
            scanner.advance(1);
            scanner.skipWhitespace();
            if (scanner.peek() == '}') {
                scanner.advance(1);
                depth--;
                return object;
            }
            do {
                scanner.skipWhitespace();
                String key = scanner.scanString();
                if (key == null) {
                    return fail("Expected string key");
                }
                scanner.skipWhitespace();
                if (!consume(':')) {
                    return fail("Expected ':'");
                }
                scanner.skipWhitespace();
                JsonNode member = parseValue();
                if (member == null) {
                    return null;
                }
                member.setKey(key);
                object.link(member);
                scanner.skipWhitespace();
            } while (consume(','));

            if (!consume('}')) {
                return fail("Expected ',' or '}'");
            }
            depth--;
            return object;
        }

        private boolean consume(char expected) {
            if (scanner.peek() == expected) {
                scanner.advance(1);
                return true;
            }
            return false;
        }
    }

    private static final Logger LOGGER = LoggerFactory.getLogger(JsonParser.class);
}
