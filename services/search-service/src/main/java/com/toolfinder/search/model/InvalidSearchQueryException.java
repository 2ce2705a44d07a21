package com.toolfinder.search.model;

public class InvalidSearchQueryException extends IllegalArgumentException {
    public InvalidSearchQueryException(String message) {
        super(message);
    }
}
