package com.profitshare.candidate;

import com.profitshare.exception.MalformedValueException;
import com.profitshare.exception.MissingFieldException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for DefaultCandidate typed field access.
 */
class DefaultCandidateTest {

    @Test
    @DisplayName("Should read string fields by case-sensitive key")
    void shouldReadStringByExactKey() {
        Candidate candidate = Candidate.builder()
                .field(CandidateField.AREA, "Tecnologia")
                .build();

        assertEquals("Tecnologia", candidate.getString("area"));
        assertThrows(MissingFieldException.class, () -> candidate.getString("AREA"));
    }

    @Test
    @DisplayName("Missing field reports the field name")
    void missingFieldReportsName() {
        Candidate candidate = Candidate.builder().build();

        MissingFieldException e = assertThrows(MissingFieldException.class,
                () -> candidate.getDecimal(CandidateField.SALARIO_BRUTO));
        assertEquals("salario_bruto", e.getField());
    }

    @Test
    @DisplayName("Should read decimals exactly from numbers and strings")
    void shouldReadDecimals() {
        Candidate candidate = Candidate.builder()
                .field("double", 5225.0)
                .field("int", 1045)
                .field("string", " 5225.00 ")
                .field("decimal", new BigDecimal("1.10"))
                .build();

        assertEquals(0, new BigDecimal("5225").compareTo(candidate.getDecimal("double")));
        assertEquals(0, new BigDecimal("1045").compareTo(candidate.getDecimal("int")));
        assertEquals(new BigDecimal("5225.00"), candidate.getDecimal("string"));
        assertEquals(new BigDecimal("1.10"), candidate.getDecimal("decimal"));
    }

    @Test
    @DisplayName("Non-numeric salary is malformed")
    void nonNumericSalaryIsMalformed() {
        Candidate candidate = Candidate.builder()
                .field(CandidateField.SALARIO_BRUTO, "cinco mil")
                .build();

        MalformedValueException e = assertThrows(MalformedValueException.class,
                () -> candidate.getDecimal(CandidateField.SALARIO_BRUTO));
        assertEquals("salario_bruto", e.getField());
        assertEquals("cinco mil", e.getValue());
    }

    @ParameterizedTest
    @DisplayName("Should read ISO dates and date-times as calendar dates")
    @ValueSource(strings = {"2019-01-01", "2019-01-01T10:15:30", "2019-01-01T10:15:30+02:00"})
    void shouldReadIsoDates(String raw) {
        Candidate candidate = Candidate.builder()
                .field(CandidateField.DATA_DE_ADMISSAO, raw)
                .build();

        assertEquals(LocalDate.of(2019, 1, 1), candidate.getDate(CandidateField.DATA_DE_ADMISSAO));
    }

    @ParameterizedTest
    @DisplayName("Unparseable dates are malformed")
    @ValueSource(strings = {"01/01/2019", "2019-13-01", "yesterday"})
    void unparseableDatesAreMalformed(String raw) {
        Candidate candidate = Candidate.builder()
                .field(CandidateField.DATA_DE_ADMISSAO, raw)
                .build();

        assertThrows(MalformedValueException.class, () -> candidate.getDate(CandidateField.DATA_DE_ADMISSAO));
    }

    @Test
    @DisplayName("Validate checks presence and type of each field")
    void validateChecksFields() {
        Candidate valid = Candidate.builder()
                .field(CandidateField.AREA, "Financeiro")
                .field(CandidateField.SALARIO_BRUTO, "2000")
                .field(CandidateField.DATA_DE_ADMISSAO, "2020-02-29")
                .build();
        Candidate badDate = Candidate.builder()
                .field(CandidateField.AREA, "Financeiro")
                .field(CandidateField.DATA_DE_ADMISSAO, 20200229)
                .build();

        assertSame(valid, valid.validate(CandidateField.AREA, CandidateField.SALARIO_BRUTO,
                CandidateField.DATA_DE_ADMISSAO));
        assertThrows(MissingFieldException.class, () -> valid.validate(CandidateField.CARGO));
        assertThrows(MalformedValueException.class, () -> badDate.validate(CandidateField.DATA_DE_ADMISSAO));
    }

    @Test
    @DisplayName("Candidate is a snapshot of the builder input")
    void candidateIsImmutableSnapshot() {
        Map<String, Object> source = new HashMap<>();
        source.put("area", "Contabilidade");
        source.put("cargo", null);

        Candidate candidate = Candidate.builder().fields(source).build();
        source.put("area", "Diretoria");

        assertEquals("Contabilidade", candidate.getString("area"));
        assertTrue(candidate.find("cargo").isEmpty());
        assertThrows(UnsupportedOperationException.class, () -> candidate.getFields().put("x", 1));
    }
}
