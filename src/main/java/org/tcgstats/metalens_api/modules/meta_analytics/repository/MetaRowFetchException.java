package org.tcgstats.metalens_api.modules.meta_analytics.repository;

/**
 * Tournament rows could not be read, even after retrying.
 */
public class MetaRowFetchException extends RuntimeException {

    public MetaRowFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
