package com.profitshare.specification;

import com.profitshare.candidate.Candidate;
import com.profitshare.exception.InvalidCompositionException;
import com.profitshare.specification.impl.AndSpecification;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for SpecificationBuilder.
 */
class SpecificationBuilderTest {

    @Test
    @DisplayName("Builder flattens without touching a shared starting node")
    void builderDoesNotMutateSharedStart() {
        Specification a = Specifications.alwaysTrue();
        Specification b = Specifications.alwaysTrue();
        AndSpecification shared = (AndSpecification) a.and(b);

        Specification built = SpecificationBuilder.from(shared)
                .and(Specifications.alwaysFalse())
                .and(Specifications.alwaysTrue())
                .build();

        assertEquals(2, shared.getSpecifications().size());
        assertEquals(4, ((AndSpecification) built).getSpecifications().size());
        assertTrue(shared.isSatisfiedBy(Candidate.builder().build()));
        assertFalse(built.isSatisfiedBy(Candidate.builder().build()));
    }

    @Test
    @DisplayName("Builder chains all operators")
    void builderChainsOperators() {
        Specification built = SpecificationBuilder.from(Specifications.alwaysFalse())
                .or(Specifications.alwaysFalse())
                .not()
                .xor(Specifications.alwaysFalse())
                .build();

        assertTrue(built.isSatisfiedBy(Candidate.builder().build()));
    }

    @Test
    @DisplayName("Builder cannot be reused after build")
    void builderRejectsUseAfterBuild() {
        SpecificationBuilder builder = SpecificationBuilder.from(Specifications.alwaysTrue());
        builder.build();

        assertThrows(InvalidCompositionException.class, () -> builder.and(Specifications.alwaysTrue()));
        assertThrows(InvalidCompositionException.class, builder::build);
        assertThrows(InvalidCompositionException.class, () -> SpecificationBuilder.from(null));
    }
}
