package com.hedgedata.data.exception;

/**
 * Base class for failures raised by data provider clients and the registry.
 */
public class DataProviderException extends Exception {

    public DataProviderException(String message) {
        super(message);
    }

    public DataProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
