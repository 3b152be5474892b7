package com.vertexcover;

/** A search parameter is out of range. Raised before any run state exists. */
public class InvalidParameterException extends IllegalArgumentException {
    public InvalidParameterException(String message) {
        super(message);
    }
}
