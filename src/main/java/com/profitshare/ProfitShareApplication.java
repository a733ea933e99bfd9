package com.profitshare;

import com.profitshare.candidate.Candidate;
import com.profitshare.candidate.CandidateFactory;
import com.profitshare.specification.Specification;
import com.profitshare.spring.EnableProfitShare;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

import java.util.List;

/**
 * Example Spring Boot application evaluating a few employees against the configured rule.
 */
@SpringBootApplication
@EnableProfitShare
public class ProfitShareApplication {

    private static final Logger log = LoggerFactory.getLogger(ProfitShareApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(ProfitShareApplication.class, args);
    }

    @Bean
    public CommandLineRunner demo(Specification eligibilityRule) {
        return args -> {
            log.info("=== Profit-share Demo Started ===");

            List<String> employees = List.of(
                    """
                    {"area": "Tecnologia", "cargo": "Analista", "salario_bruto": 5225.00, "data_de_admissao": "2019-01-01"}
                    """,
                    """
                    {"area": "Diretoria", "cargo": "Diretor", "salario_bruto": 25000.00, "data_de_admissao": "2015-03-10"}
                    """,
                    """
                    {"area": "Financeiro", "cargo": "Estagiario", "salario_bruto": 1200.00, "data_de_admissao": "2024-06-01"}
                    """);

            for (String json : employees) {
                Candidate candidate = CandidateFactory.fromJson(json);
                Specification remainder = eligibilityRule.remainderUnsatisfiedBy(candidate);
                if (remainder == null) {
                    log.info("Eligible: {}", candidate);
                } else {
                    log.info("Not eligible: {} (failed: {})", candidate, remainder);
                }
            }

            log.info("=== Profit-share Demo Completed ===");
        };
    }
}
