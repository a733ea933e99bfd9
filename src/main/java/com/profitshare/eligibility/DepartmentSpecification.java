package com.profitshare.eligibility;

import com.profitshare.candidate.Candidate;
import com.profitshare.candidate.CandidateField;
import com.profitshare.specification.Specification;
import com.profitshare.specification.SpecificationType;

import java.util.Objects;

/**
 * Satisfied when the candidate's {@code area} names the given department, ignoring case.
 */
public class DepartmentSpecification implements Specification {

    private final Department department;

    public DepartmentSpecification(Department department) {
        this.department = Objects.requireNonNull(department, "department");
    }

    @Override
    public boolean isSatisfiedBy(Candidate candidate) {
        return department.matches(candidate.getString(CandidateField.AREA));
    }

    public Department getDepartment() {
        return department;
    }

    @Override
    public SpecificationType getType() {
        return SpecificationType.DEPARTMENT;
    }

    @Override
    public String toString() {
        return department.ruleName() + "()";
    }

    // Factory methods
    public static DepartmentSpecification directorBoard() {
        return new DepartmentSpecification(Department.DIRETORIA);
    }

    public static DepartmentSpecification accountingDepartment() {
        return new DepartmentSpecification(Department.CONTABILIDADE);
    }

    public static DepartmentSpecification financialDepartment() {
        return new DepartmentSpecification(Department.FINANCEIRO);
    }

    public static DepartmentSpecification itDepartment() {
        return new DepartmentSpecification(Department.TECNOLOGIA);
    }

    public static DepartmentSpecification facilitiesDepartment() {
        return new DepartmentSpecification(Department.SERVICOS_GERAIS);
    }

    public static DepartmentSpecification customerExperienceDepartment() {
        return new DepartmentSpecification(Department.RELACIONAMENTO_COM_O_CLIENTE);
    }
}
