package com.profitshare.specification;

import com.profitshare.candidate.Candidate;
import com.profitshare.specification.impl.AndSpecification;
import com.profitshare.specification.impl.NotSpecification;
import com.profitshare.specification.impl.OrSpecification;
import com.profitshare.specification.impl.XorSpecification;

/**
 * Boolean predicate over a {@link Candidate}, composable into rule trees.
 *
 * <p>Evaluation never mutates the tree, so a fully built tree can be shared between threads.
 * Composition is different: {@link #and} on an AND node and {@link #or} on an OR node append
 * the operand to that node in place. Build a tree with a single owner (see
 * {@link SpecificationBuilder}) before publishing it.
 */
public interface Specification {

    /**
     * Evaluate this specification against the given candidate.
     *
     * @param candidate Candidate record
     * @return true if the candidate satisfies this specification
     */
    boolean isSatisfiedBy(Candidate candidate);

    /**
     * Describe why the candidate fails this specification.
     *
     * @param candidate Candidate record
     * @return null if satisfied, otherwise the part of this specification that failed
     */
    default Specification remainderUnsatisfiedBy(Candidate candidate) {
        return isSatisfiedBy(candidate) ? null : this;
    }

    /**
     * Get the specification type.
     */
    SpecificationType getType();

    /**
     * Conjunction with another specification. An AND receiver absorbs the operand in place.
     */
    default Specification and(Specification other) {
        return new AndSpecification(this, other);
    }

    /**
     * Disjunction with another specification. An OR receiver absorbs the operand in place.
     */
    default Specification or(Specification other) {
        return new OrSpecification(this, other);
    }

    /**
     * Exclusive-or with another specification. Always a new node.
     */
    default Specification xor(Specification other) {
        return new XorSpecification(this, other);
    }

    /**
     * Negation of this specification. Always a new node.
     */
    default Specification not() {
        return new NotSpecification(this);
    }
}
