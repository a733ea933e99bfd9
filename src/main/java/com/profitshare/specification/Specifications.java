package com.profitshare.specification;

import com.profitshare.specification.impl.FalseSpecification;
import com.profitshare.specification.impl.TrueSpecification;

/**
 * Static forms of the composition operations.
 */
public final class Specifications {

    private Specifications() {}

    public static Specification and(Specification left, Specification right) {
        return left.and(right);
    }

    public static Specification or(Specification left, Specification right) {
        return left.or(right);
    }

    public static Specification xor(Specification left, Specification right) {
        return left.xor(right);
    }

    public static Specification not(Specification specification) {
        return specification.not();
    }

    public static Specification alwaysTrue() {
        return TrueSpecification.INSTANCE;
    }

    public static Specification alwaysFalse() {
        return FalseSpecification.INSTANCE;
    }
}
