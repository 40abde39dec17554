package com.logchef.logchefql;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;
import java.util.Optional;

/**
 * An error reported as data: code, human readable message and an optional position
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ParseError {

    @JsonProperty("code")
    private final ErrorCode code;

    @JsonProperty("message")
    private final String message;

    @JsonProperty("position")
    private final Position position;

    public ParseError(ErrorCode code, String message) {
        this(code, message, null);
    }

    public ParseError(ErrorCode code, String message, Position position) {
        this.code = Objects.requireNonNull(code, "code");
        this.message = Objects.requireNonNull(message, "message");
        this.position = position;
    }

    public ErrorCode getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    @JsonIgnore
    public Optional<Position> getPosition() {
        return Optional.ofNullable(position);
    }

    /**
     * Message prefixed with the location, e.g. {@code "1:9: Unexpected end of query"}
     */
    public String format() {
        if (position == null) {
            return message;
        }
        return position + ": " + message;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ParseError)) return false;
        ParseError that = (ParseError) o;
        return code == that.code && message.equals(that.message) && Objects.equals(position, that.position);
    }

    @Override
    public int hashCode() {
        return Objects.hash(code, message, position);
    }

    @Override
    public String toString() {
        return code + ": " + format();
    }
}
