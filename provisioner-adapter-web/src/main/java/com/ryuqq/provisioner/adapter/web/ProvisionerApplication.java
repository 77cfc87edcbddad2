package com.ryuqq.provisioner.adapter.web;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * 네임스페이스 프로비저닝 REST 서비스 진입점.
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class ProvisionerApplication {

    public static void main(String[] args) {
        SpringApplication.run(ProvisionerApplication.class, args);
    }
}
