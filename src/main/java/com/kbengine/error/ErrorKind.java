package com.kbengine.error;

public enum ErrorKind {
    VALIDATION,
    PROVIDER,
    VECTOR_STORE,
    PERMISSION,
    NOT_FOUND
}
