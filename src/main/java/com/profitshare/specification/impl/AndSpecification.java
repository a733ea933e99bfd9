package com.profitshare.specification.impl;

import com.profitshare.candidate.Candidate;
import com.profitshare.specification.Specification;
import com.profitshare.specification.SpecificationType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;

/**
 * Logical AND - all operands must be satisfied.
 * The remainder narrows down to the operands that failed.
 */
public class AndSpecification extends MultaryCompositeSpecification {

    private static final Logger log = LoggerFactory.getLogger(AndSpecification.class);

    public AndSpecification(Specification... specifications) {
        this(specifications == null ? null : Arrays.asList(specifications));
    }

    public AndSpecification(List<Specification> specifications) {
        super(specifications);
    }

    @Override
    public boolean isSatisfiedBy(Candidate candidate) {
        return operands().stream().allMatch(s -> s.isSatisfiedBy(candidate));
    }

    @Override
    public Specification remainderUnsatisfiedBy(Candidate candidate) {
        List<Specification> operands = operands();
        List<Specification> unsatisfied = operands.stream()
                .filter(s -> !s.isSatisfiedBy(candidate))
                .toList();

        log.debug("{} of {} AND operands unsatisfied by {}", unsatisfied.size(), operands.size(), candidate);

        if (unsatisfied.isEmpty()) {
            return null;
        }
        if (unsatisfied.size() == 1) {
            return unsatisfied.get(0);
        }
        if (unsatisfied.size() == operands.size()) {
            return this;
        }
        return new AndSpecification(unsatisfied);
    }

    @Override
    public Specification and(Specification other) {
        absorb(other);
        return this;
    }

    @Override
    public AndSpecification copy() {
        return new AndSpecification(getSpecifications());
    }

    @Override
    public SpecificationType getType() {
        return SpecificationType.AND;
    }

    @Override
    protected String operatorLabel() {
        return "And";
    }
}
