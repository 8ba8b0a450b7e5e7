package com.minisessiondb.storage;

public enum TransactionMode {
    READ_ONLY,
    READ_WRITE
}
