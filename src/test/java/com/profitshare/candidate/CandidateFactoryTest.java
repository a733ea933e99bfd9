package com.profitshare.candidate;

import com.profitshare.exception.MalformedValueException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for CandidateFactory.
 */
class CandidateFactoryTest {

    @Test
    @DisplayName("JSON numbers keep their exact decimal value")
    void jsonKeepsExactDecimals() {
        Candidate candidate = CandidateFactory.fromJson("""
                {"area": "Tecnologia", "cargo": "Analista", "salario_bruto": 5225.10, "data_de_admissao": "2019-01-01"}
                """);

        assertEquals(new BigDecimal("5225.10"), candidate.getDecimal(CandidateField.SALARIO_BRUTO));
        assertEquals(LocalDate.of(2019, 1, 1), candidate.getDate(CandidateField.DATA_DE_ADMISSAO));
        assertEquals("Analista", candidate.getString(CandidateField.CARGO));
    }

    @Test
    @DisplayName("Invalid JSON is reported as a malformed value")
    void invalidJsonIsMalformed() {
        assertThrows(MalformedValueException.class, () -> CandidateFactory.fromJson("{\"area\": "));
    }

    @Test
    @DisplayName("Blank JSON yields an empty candidate")
    void blankJsonYieldsEmptyCandidate() {
        assertTrue(CandidateFactory.fromJson("  ").getFields().isEmpty());
    }

    @Test
    @DisplayName("Map input is copied into the candidate")
    void mapInputIsCopied() {
        Candidate candidate = CandidateFactory.fromMap(Map.of("area", "Diretoria"));

        assertEquals("Diretoria", candidate.getString(CandidateField.AREA));
    }
}
