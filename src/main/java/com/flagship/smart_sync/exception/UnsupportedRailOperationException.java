package com.flagship.smart_sync.exception;

public class UnsupportedRailOperationException extends RuntimeException {

    public UnsupportedRailOperationException(String rail, String operation) {
        super("Rail " + rail + " does not support " + operation);
    }
}
