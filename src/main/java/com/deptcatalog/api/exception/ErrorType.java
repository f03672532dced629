package com.deptcatalog.api.exception;

public enum ErrorType {

    INVALID_INPUT,
    NOT_FOUND,
    CONFLICT,
    PERSISTENCE_FAILURE
}
