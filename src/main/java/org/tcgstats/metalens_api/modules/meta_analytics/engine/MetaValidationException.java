package org.tcgstats.metalens_api.modules.meta_analytics.engine;

/**
 * A request the engine refuses to compute: malformed or overlapping periods, an unknown
 * grouping field, or a filter value outside its vocabulary.
 * <p>
 * Always raised before any row is fetched.
 */
public class MetaValidationException extends RuntimeException {

    public MetaValidationException(String message) {
        super(message);
    }
}
