package com.example.jduel.controller;

import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
public class HealthController {

  /** Liveness check, no room state involved. */
  @GetMapping("/health")
  public Map<String, String> health() {
    return Map.of("status", "ok");
  }
}
