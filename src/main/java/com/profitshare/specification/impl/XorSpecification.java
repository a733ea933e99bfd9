package com.profitshare.specification.impl;

import com.profitshare.candidate.Candidate;
import com.profitshare.specification.Specification;
import com.profitshare.specification.SpecificationType;

/**
 * Logical XOR - exactly one of the two operands must be satisfied.
 */
public class XorSpecification implements Specification {

    private final Specification left;
    private final Specification right;

    public XorSpecification(Specification left, Specification right) {
        MultaryCompositeSpecification.requireOperand(left);
        MultaryCompositeSpecification.requireOperand(right);
        this.left = left;
        this.right = right;
    }

    @Override
    public boolean isSatisfiedBy(Candidate candidate) {
        return left.isSatisfiedBy(candidate) ^ right.isSatisfiedBy(candidate);
    }

    public Specification getLeft() {
        return left;
    }

    public Specification getRight() {
        return right;
    }

    @Override
    public SpecificationType getType() {
        return SpecificationType.XOR;
    }

    @Override
    public String toString() {
        return wrap(left) + " Xor " + wrap(right);
    }

    private static String wrap(Specification s) {
        return s.getType().isComposite() && !(s instanceof NotSpecification) ? "(" + s + ")" : s.toString();
    }
}
