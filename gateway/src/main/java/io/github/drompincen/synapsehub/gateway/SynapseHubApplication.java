package io.github.drompincen.synapsehub.gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication(scanBasePackages = "io.github.drompincen.synapsehub")
@EnableScheduling
public class SynapseHubApplication {

    public static void main(String[] args) {
        SpringApplication.run(SynapseHubApplication.class, args);
    }
}
