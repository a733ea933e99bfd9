package com.profitshare.specification.impl;

import com.profitshare.candidate.Candidate;
import com.profitshare.specification.Specification;
import com.profitshare.specification.SpecificationType;

import java.util.Arrays;
import java.util.List;

/**
 * Logical OR - at least one operand must be satisfied.
 */
public class OrSpecification extends MultaryCompositeSpecification {

    public OrSpecification(Specification... specifications) {
        this(specifications == null ? null : Arrays.asList(specifications));
    }

    public OrSpecification(List<Specification> specifications) {
        super(specifications);
    }

    @Override
    public boolean isSatisfiedBy(Candidate candidate) {
        return operands().stream().anyMatch(s -> s.isSatisfiedBy(candidate));
    }

    @Override
    public Specification or(Specification other) {
        absorb(other);
        return this;
    }

    @Override
    public OrSpecification copy() {
        return new OrSpecification(getSpecifications());
    }

    @Override
    public SpecificationType getType() {
        return SpecificationType.OR;
    }

    @Override
    protected String operatorLabel() {
        return "Or";
    }
}
