package com.efaktur.backend.controllers;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import com.efaktur.backend.dto.HealthResponseDTO;

@RestController
public class HealthController {

    static final String RUNNING_MESSAGE = "E-Faktur Validation Service is running";

    @GetMapping("/")
    public ResponseEntity<HealthResponseDTO> health() {
        return ResponseEntity.ok(new HealthResponseDTO(RUNNING_MESSAGE));
    }
}
