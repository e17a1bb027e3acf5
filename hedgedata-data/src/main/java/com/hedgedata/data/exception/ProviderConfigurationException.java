package com.hedgedata.data.exception;

/**
 * A provider cannot be used as configured: its credential is missing, the
 * identifier is unknown, or no default provider can be resolved.
 * Not retried.
 */
public class ProviderConfigurationException extends DataProviderException {

    public ProviderConfigurationException(String message) {
        super(message);
    }
}
