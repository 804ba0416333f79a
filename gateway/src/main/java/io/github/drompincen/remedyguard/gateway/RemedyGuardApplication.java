package io.github.drompincen.remedyguard.gateway;

import io.github.drompincen.remedyguard.gateway.cli.BatchFileRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;

@SpringBootApplication(scanBasePackages = "io.github.drompincen.remedyguard")
public class RemedyGuardApplication {

    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(RemedyGuardApplication.class);
        boolean batch = BatchFileRunner.isBatchInvocation(args);
        if (batch) {
            // offline batch: no HTTP server, exit once the report is printed
            app.setWebApplicationType(WebApplicationType.NONE);
        }
        ConfigurableApplicationContext context = app.run(args);
        if (batch) {
            System.exit(SpringApplication.exit(context));
        }
    }
}
