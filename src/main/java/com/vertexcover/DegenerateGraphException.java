package com.vertexcover;

/** The graph has no vertices, so there is nothing to search. */
public class DegenerateGraphException extends IllegalArgumentException {
    public DegenerateGraphException(String message) {
        super(message);
    }
}
