package com.profitshare.config;

import com.profitshare.specification.Specification;

/**
 * Builds specification trees from configuration.
 */
public interface SpecificationFactory {

    /**
     * Create a Specification tree from configuration.
     *
     * @param config Root node configuration
     * @return Fully built specification, safe to share for evaluation
     */
    Specification create(SpecificationConfig config);
}
