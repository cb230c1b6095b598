package org.pragmatica.prompt.error;

/**
 * The only exception raised by prompt parsing. Malformed punctuation never raises;
 * this signals a violated structural contract, described by {@link #error()}.
 */
public class ParsingException extends RuntimeException {

    private final ParseError error;

    public ParsingException(ParseError error) {
        super(error.message());
        this.error = error;
    }

    public ParseError error() {
        return error;
    }
}
