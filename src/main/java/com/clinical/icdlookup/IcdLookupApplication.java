package com.clinical.icdlookup;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * The main entry point for the ICD-11 lookup service.
 *
 * <p>This Spring Boot application exposes RESTful endpoints for:
 * <ul>
 *   <li>free-text diagnostic code search against the WHO ICD-11 registry,</li>
 *   <li>clearing the session result cache,</li>
 *   <li>inspecting the offline catalog used when the registry is unreachable.</li>
 * </ul>
 * It wires together the OAuth2 token manager, the registry search client,
 * the in-memory result cache and the locally seeded offline catalog.</p>
 *
 * <p>Usage:
 * <pre>{@code
 *   // From the command line (credentials in ./.env):
 *   mvn spring-boot:run
 *
 *   // Or run the JAR:
 *   java -jar target/icd-lookup-0.1.0-SNAPSHOT.jar
 * }</pre>
 *
 * <p>Once started, the application will listen on the configured port (default
 * 8080) and serve requests under <code>/api/icd/</code>.</p>
 */
@SpringBootApplication
public class IcdLookupApplication {

    /**
     * Bootstrap method to launch the Spring Boot application.
     *
     * @param args command-line arguments (ignored)
     */
    public static void main(final String[] args) {
        SpringApplication.run(IcdLookupApplication.class, args);
    }
}
