package com.signalgate.lifecycle.store;

/**
 * The backing store could not be read or written. Fatal for the current scheduler tick only.
 */
public class StoreUnavailableException extends IllegalStateException {
    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
