package com.solstream.producer.format;

public class FormatException extends Exception {

    public enum Kind { MISSING_FIELD, DECODE_FAILURE }

    private final Kind kind;

    public FormatException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public FormatException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public static FormatException missingField(String field) {
        return new FormatException(Kind.MISSING_FIELD, "missing field: " + field);
    }

    public Kind kind() { return kind; }
}
