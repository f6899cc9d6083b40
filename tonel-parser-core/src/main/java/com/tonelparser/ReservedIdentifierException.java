package com.tonelparser;

/**
 * Raised when a pseudo-variable is used as an assignment target, block
 * parameter or temporary.
 */
public class ReservedIdentifierException extends ParseException {
    private final String name;

    public ReservedIdentifierException(String name, Token token, String context) {
        super("ReservedIdentifierError", token, null, context,
              "Cannot use reserved identifier '" + name + "' as " + context);
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
