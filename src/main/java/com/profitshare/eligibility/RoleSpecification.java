package com.profitshare.eligibility;

import com.profitshare.candidate.Candidate;
import com.profitshare.candidate.CandidateField;
import com.profitshare.specification.Specification;
import com.profitshare.specification.SpecificationType;

import java.util.Objects;

/**
 * Satisfied when the candidate's {@code cargo} names the given role, ignoring case.
 */
public class RoleSpecification implements Specification {

    private final Role role;

    public RoleSpecification(Role role) {
        this.role = Objects.requireNonNull(role, "role");
    }

    @Override
    public boolean isSatisfiedBy(Candidate candidate) {
        return role.matches(candidate.getString(CandidateField.CARGO));
    }

    public Role getRole() {
        return role;
    }

    @Override
    public SpecificationType getType() {
        return SpecificationType.ROLE;
    }

    @Override
    public String toString() {
        return role.ruleName() + "()";
    }

    public static RoleSpecification trainee() {
        return new RoleSpecification(Role.ESTAGIARIO);
    }
}
