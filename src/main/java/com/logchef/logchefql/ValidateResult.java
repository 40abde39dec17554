package com.logchef.logchefql;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Optional;

@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ValidateResult {

    private static final ValidateResult VALID = new ValidateResult(true, null);

    @JsonProperty("valid")
    private final boolean valid;

    @JsonProperty("error")
    private final ParseError error;

    private ValidateResult(boolean valid, ParseError error) {
        this.valid = valid;
        this.error = error;
    }

    public static ValidateResult valid() {
        return VALID;
    }

    public static ValidateResult invalid(ParseError error) {
        return new ValidateResult(false, error);
    }

    public boolean isValid() {
        return valid;
    }

    @JsonIgnore
    public Optional<ParseError> getError() {
        return Optional.ofNullable(error);
    }
}
