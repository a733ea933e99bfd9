package com.profitshare.specification.impl;

import com.profitshare.candidate.Candidate;
import com.profitshare.specification.Specification;
import com.profitshare.specification.SpecificationType;

/**
 * Specification that is never satisfied.
 */
public class FalseSpecification implements Specification {

    public static final FalseSpecification INSTANCE = new FalseSpecification();

    private FalseSpecification() {}

    @Override
    public boolean isSatisfiedBy(Candidate candidate) {
        return false;
    }

    @Override
    public SpecificationType getType() {
        return SpecificationType.FALSE;
    }

    @Override
    public String toString() {
        return "False";
    }
}
