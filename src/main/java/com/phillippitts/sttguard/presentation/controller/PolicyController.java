package com.phillippitts.sttguard.presentation.controller;

import com.phillippitts.sttguard.service.policy.PolicyConfig;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Read-only view of the integrity policy the server is running with.
 */
@RestController
class PolicyController {

    private static final Logger log = LogManager.getLogger(PolicyController.class);

    private final PolicyConfig policy;

    PolicyController(PolicyConfig policy) {
        this.policy = policy;
    }

    @GetMapping("/integrity/policy")
    ResponseEntity<Map<String, Object>> policy() {
        log.debug("Integrity policy requested");
        return ResponseEntity.ok(Map.of(
                "verifyEnabled", policy.verifyEnabled(),
                "rejectEnabled", policy.rejectEnabled(),
                "corruptionThreshold", policy.corruptionThreshold(),
                "extendedLogging", policy.extendedLogging()
        ));
    }
}
