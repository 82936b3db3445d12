package com.vidnyan.codesense;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * CodeSense - static code analysis and defect risk scoring engine.
 *
 * Parses snippets into a structural model, scans them against an anti-pattern catalog and fuses the
 * hits with a random forest probability into one risk score.
 */
@SpringBootApplication
public class CodeSenseApplication {

    public static void main(String[] args) {
        SpringApplication.run(CodeSenseApplication.class, args);
    }
}
