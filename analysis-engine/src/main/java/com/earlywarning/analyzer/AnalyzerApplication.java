package com.earlywarning.analyzer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Ransomware Early-Warning URL Analysis Engine.
 *
 * <p>
 * Spring Boot application that scores submitted URLs from lexical features,
 * a trained or heuristic classifier and external reputation services, and
 * keeps a bounded history of the verdicts it has issued.
 * </p>
 *
 * @author Naveed Gung
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class AnalyzerApplication {

    public static void main(String[] args) {
        SpringApplication.run(AnalyzerApplication.class, args);
    }
}
