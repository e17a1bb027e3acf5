package com.hedgedata.data.exception;

import com.hedgedata.core.model.DataProvider;

/**
 * A provider payload does not have the shape the client translates from.
 */
public class NormalizationException extends FetchException {

    public NormalizationException(DataProvider provider, String message) {
        super(provider, message);
    }
}
