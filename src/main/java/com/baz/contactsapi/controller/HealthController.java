package com.baz.contactsapi.controller;

import com.baz.contactsapi.model.dto.HealthResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;

@RestController
@CrossOrigin(origins = "*")
@Tag(name = "Health", description = "Liveness check")
public class HealthController {

    @GetMapping("/api/health")
    @Operation(summary = "Report that the API is up")
    public HealthResponse health() {
        return new HealthResponse(true, "API is running", Instant.now());
    }
}
