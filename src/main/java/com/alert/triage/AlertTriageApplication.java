package com.alert.triage;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point for the Alert Triage Engine. Enables:
 * <ul>
 *   <li>Keep/suppress decisions per alert (duplicates, business rules, ML suppression score)</li>
 *   <li>Scorer isolation with time limit and circuit breaker (Resilience4j)</li>
 *   <li>Kafka intake of raw alerts and publication of decisions</li>
 *   <li>Append-only audit log (PostgreSQL or in-memory) and REST API with OpenAPI docs at /swagger-ui.html</li>
 * </ul>
 */
@SpringBootApplication
public class AlertTriageApplication {

    public static void main(String[] args) {
        SpringApplication.run(AlertTriageApplication.class, args);
    }
}
