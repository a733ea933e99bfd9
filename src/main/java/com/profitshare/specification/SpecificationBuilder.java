package com.profitshare.specification;

import com.profitshare.exception.InvalidCompositionException;
import com.profitshare.specification.impl.MultaryCompositeSpecification;

/**
 * Single-owner builder for specification trees.
 *
 * <p>The starting AND/OR node is copied, so in-place flattening only touches nodes this
 * builder created. Once {@link #build()} is called the builder rejects further use and the
 * returned tree is safe to share for read-only evaluation.
 */
public final class SpecificationBuilder {

    private Specification current;
    private boolean built;

    private SpecificationBuilder(Specification start) {
        this.current = start;
    }

    public static SpecificationBuilder from(Specification start) {
        if (start == null) {
            throw new InvalidCompositionException("Builder requires a starting specification");
        }
        if (start instanceof MultaryCompositeSpecification multary) {
            return new SpecificationBuilder(multary.copy());
        }
        return new SpecificationBuilder(start);
    }

    public SpecificationBuilder and(Specification other) {
        ensureOpen();
        current = current.and(other);
        return this;
    }

    public SpecificationBuilder or(Specification other) {
        ensureOpen();
        current = current.or(other);
        return this;
    }

    public SpecificationBuilder xor(Specification other) {
        ensureOpen();
        current = current.xor(other);
        return this;
    }

    public SpecificationBuilder not() {
        ensureOpen();
        current = current.not();
        return this;
    }

    public Specification build() {
        ensureOpen();
        built = true;
        return current;
    }

    private void ensureOpen() {
        if (built) {
            throw new InvalidCompositionException("Specification already built");
        }
    }
}
