package com.profitshare.specification.impl;

import com.profitshare.exception.InvalidCompositionException;
import com.profitshare.specification.Specification;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Base for associative n-ary nodes (AND, OR) whose operand list can be widened
 * while the tree is being built.
 */
public abstract class MultaryCompositeSpecification implements Specification {

    private final List<Specification> specifications;

    protected MultaryCompositeSpecification(List<Specification> specifications) {
        if (specifications == null) {
            throw new InvalidCompositionException(getClass().getSimpleName() + " requires an operand list");
        }
        for (Specification specification : specifications) {
            requireOperand(specification);
        }
        this.specifications = new ArrayList<>(specifications);
    }

    /**
     * Operands in composition order.
     */
    public List<Specification> getSpecifications() {
        return Collections.unmodifiableList(specifications);
    }

    /**
     * Fresh node of the same kind over the same operands.
     */
    public abstract MultaryCompositeSpecification copy();

    /**
     * Label used between operands in {@link #toString()}.
     */
    protected abstract String operatorLabel();

    protected void absorb(Specification other) {
        requireOperand(other);
        if (getClass().isInstance(other)) {
            specifications.addAll(((MultaryCompositeSpecification) other).specifications);
        } else {
            specifications.add(other);
        }
    }

    protected List<Specification> operands() {
        if (specifications.isEmpty()) {
            throw new InvalidCompositionException(getType() + " specification has no operands");
        }
        return specifications;
    }

    static void requireOperand(Specification specification) {
        if (specification == null) {
            throw new InvalidCompositionException("Specification operand cannot be null");
        }
    }

    @Override
    public String toString() {
        return specifications.stream()
                .map(s -> s.getType().isComposite() && !(s instanceof NotSpecification)
                        ? "(" + s + ")"
                        : String.valueOf(s))
                .collect(Collectors.joining(" " + operatorLabel() + " "));
    }
}
