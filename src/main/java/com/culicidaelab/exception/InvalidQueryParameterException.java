package com.culicidaelab.exception;

/**
 * Request parameter that cannot be parsed, such as a malformed bbox or date
 */
public class InvalidQueryParameterException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String parameter;

    public InvalidQueryParameterException(String parameter, String message) {
        super(parameter + ": " + message);
        this.parameter = parameter;
    }

    public String getParameter() {
        return parameter;
    }
}
