package com.profitshare.specification.impl;

import com.profitshare.candidate.Candidate;
import com.profitshare.specification.Specification;
import com.profitshare.specification.SpecificationType;

/**
 * Logical NOT - negates the nested specification.
 */
public class NotSpecification implements Specification {

    private final Specification specification;

    public NotSpecification(Specification specification) {
        MultaryCompositeSpecification.requireOperand(specification);
        this.specification = specification;
    }

    @Override
    public boolean isSatisfiedBy(Candidate candidate) {
        return !specification.isSatisfiedBy(candidate);
    }

    public Specification getSpecification() {
        return specification;
    }

    @Override
    public SpecificationType getType() {
        return SpecificationType.NOT;
    }

    @Override
    public String toString() {
        return "Not(" + specification + ")";
    }
}
