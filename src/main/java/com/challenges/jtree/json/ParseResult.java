package com.challenges.jtree.json;

import com.challenges.jtree.exceptions.JsonSyntaxException;

import java.util.Optional;

/**
 * The outcome of one {@link JsonParser} call: either the parsed tree or the
 * position and reason of the first syntax error.
 */
public sealed interface ParseResult {

    /**
     * @param end offset just past the parsed value (and past trailing whitespace
     *            when full consumption was required)
     */
    record Success(JsonNode value, int end) implements ParseResult {}

    /**
     * @param position offset of the first offending character
     */
    record Failure(int position, String message) implements ParseResult {}

    default boolean isSuccess() {
        return this instanceof Success;
    }

    default Optional<JsonNode> toOptional() {
        return this instanceof Success s ? Optional.of(s.value()) : Optional.empty();
    }

    default JsonNode orElseThrow() {
        if (this instanceof Failure f) {
            throw new JsonSyntaxException(f.message(), f.position());
        }
        return ((Success) this).value();
    }
}
