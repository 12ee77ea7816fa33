package com.company.decommissioning;

import com.company.decommissioning.config.DecommissioningProperties;
import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.enums.SecuritySchemeType;
import io.swagger.v3.oas.annotations.info.Info;
import io.swagger.v3.oas.annotations.security.SecurityScheme;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties(DecommissioningProperties.class)
@OpenAPIDefinition(
        info = @Info(
                title = "Database Decommissioning Monitor API",
                version = "1.0.0",
                description = "Inactivity-based database decommissioning alerting"
        )
)
@SecurityScheme(
        name = "bearer-jwt",
        type = SecuritySchemeType.HTTP,
        scheme = "bearer",
        bearerFormat = "JWT"
)
public class DecommissioningMonitorApplication {

    public static void main(String[] args) {
        SpringApplication.run(DecommissioningMonitorApplication.class, args);
    }
}
