package com.ledgerlens.categorizer.health;

import java.util.Map;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Unauthenticated liveness probe for load balancers. Actuator health stays available separately.
 */
@RestController
public class HealthzController {

    @GetMapping(path = "/healthz", produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, String> healthz() {
        return Map.of("status", "UP", "service", "categorizer-svc");
    }
}
