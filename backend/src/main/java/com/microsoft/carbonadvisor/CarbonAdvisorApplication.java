package com.microsoft.carbonadvisor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Carbon-aware deployment advisor.
 *
 * Detects cloud deployments from infrastructure and platform config files, maps their regions to
 * electricity grid zones and suggests lower-carbon regions within the same provider.
 */
@SpringBootApplication
public class CarbonAdvisorApplication {

    public static void main(String[] args) {
        SpringApplication.run(CarbonAdvisorApplication.class, args);
    }
}
