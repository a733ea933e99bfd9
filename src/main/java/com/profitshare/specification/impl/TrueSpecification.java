package com.profitshare.specification.impl;

import com.profitshare.candidate.Candidate;
import com.profitshare.specification.Specification;
import com.profitshare.specification.SpecificationType;

/**
 * Specification that is always satisfied.
 * Identity for AND, placeholder for rules that accept everyone.
 */
public class TrueSpecification implements Specification {

    public static final TrueSpecification INSTANCE = new TrueSpecification();

    private TrueSpecification() {}

    @Override
    public boolean isSatisfiedBy(Candidate candidate) {
        return true;
    }

    @Override
    public SpecificationType getType() {
        return SpecificationType.TRUE;
    }

    @Override
    public String toString() {
        return "True";
    }
}
