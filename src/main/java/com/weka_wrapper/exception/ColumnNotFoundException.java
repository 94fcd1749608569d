package com.weka_wrapper.exception;

import lombok.Getter;

@Getter
public class ColumnNotFoundException extends RuntimeException {

    private final String columnName;

    public ColumnNotFoundException(String role, String columnName) {
        super(role + " column not found: " + columnName);
        this.columnName = columnName;
    }
}
