package com.ryuqq.provisioner.adapter.web.controller;

import com.ryuqq.provisioner.adapter.web.dto.CircuitBreakerView;
import com.ryuqq.provisioner.adapter.web.dto.RegistryHealthView;
import com.ryuqq.provisioner.core.protection.CircuitBreaker;
import com.ryuqq.provisioner.core.protection.CircuitBreakerRegistry;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

/**
 * 운영자용 서킷 브레이커 엔드포인트.
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
@RestController
@RequestMapping("/circuit-breakers")
public class CircuitBreakerController {

    private final CircuitBreakerRegistry registry;

    public CircuitBreakerController(CircuitBreakerRegistry registry) {
        this.registry = registry;
    }

    @GetMapping
    public RegistryHealthView health() {
        return RegistryHealthView.from(registry.healthStatus());
    }

    @PostMapping("/reset")
    public RegistryHealthView resetAll() {
        registry.resetAll();
        return RegistryHealthView.from(registry.healthStatus());
    }

    @PostMapping("/{name}/reset")
    public CircuitBreakerView reset(@PathVariable String name) {
        CircuitBreaker breaker = find(name);
        breaker.reset();
        return CircuitBreakerView.from(breaker.getMetrics());
    }

    @PostMapping("/{name}/force-open")
    public CircuitBreakerView forceOpen(@PathVariable String name) {
        CircuitBreaker breaker = find(name);
        breaker.forceOpen();
        return CircuitBreakerView.from(breaker.getMetrics());
    }

    private CircuitBreaker find(String name) {
        return registry.get(name)
            .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Unknown circuit breaker: " + name));
    }
}
