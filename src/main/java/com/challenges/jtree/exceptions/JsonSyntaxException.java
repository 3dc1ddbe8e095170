package com.challenges.jtree.exceptions;

/**
 * The input text is not valid JSON.
 * {@link #position()} is the offset of the first offending character.
 */
public final class JsonSyntaxException extends JsonException {
    private final int position;

    public JsonSyntaxException(String message, int position) {
        super(message + " at offset " + position);
        this.position = position;
    }

    public int position() {
        return position;
    }
}
