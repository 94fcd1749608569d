package com.weka_wrapper.enumeration;

public enum ColumnStateEnum {
    STALE,
    RESOLVED
}
