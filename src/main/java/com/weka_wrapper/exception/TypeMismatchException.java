package com.weka_wrapper.exception;

import lombok.Getter;

@Getter
public class TypeMismatchException extends RuntimeException {

    private final String expectedType;
    private final String actualType;

    public TypeMismatchException(String expectedType, String actualType) {
        super("Object of type " + actualType + " is not an instance of " + expectedType);
        this.expectedType = expectedType;
        this.actualType = actualType;
    }
}
