package com.hedgedata.data.exception;

import com.hedgedata.core.model.DataProvider;

/**
 * A single provider call failed: transport error, non-success status or a
 * payload that cannot be read.
 */
public class FetchException extends DataProviderException {

    private final DataProvider provider;
    private final int statusCode;

    public FetchException(DataProvider provider, String message) {
        this(provider, -1, message, null);
    }

    public FetchException(DataProvider provider, String message, Throwable cause) {
        this(provider, -1, message, cause);
    }

    public FetchException(DataProvider provider, int statusCode, String message) {
        this(provider, statusCode, message, null);
    }

    public FetchException(DataProvider provider, int statusCode, String message, Throwable cause) {
        super(provider.getDisplayName() + ": " + message, cause);
        this.provider = provider;
        this.statusCode = statusCode;
    }

    public DataProvider getProvider() {
        return provider;
    }

    /**
     * HTTP status of the failed response, or -1 when no response was received.
     */
    public int getStatusCode() {
        return statusCode;
    }
}
