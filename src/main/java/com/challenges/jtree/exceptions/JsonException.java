package com.challenges.jtree.exceptions;

public sealed abstract class JsonException extends RuntimeException permits JsonSyntaxException {
    protected JsonException(String message) {
        super(message);
    }
}
