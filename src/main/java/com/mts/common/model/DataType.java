package com.mts.common.model;

public enum DataType {
    BOOL,
    INT8,
    INT16,
    INT32,
    INT64,
    FLOAT,
    DOUBLE,
    STRING,
    BINARY,
    TIMESTAMP
}
