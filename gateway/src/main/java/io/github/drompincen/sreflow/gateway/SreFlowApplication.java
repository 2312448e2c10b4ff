package io.github.drompincen.sreflow.gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication(scanBasePackages = "io.github.drompincen.sreflow")
@EnableScheduling
public class SreFlowApplication {

    public static void main(String[] args) {
        SpringApplication.run(SreFlowApplication.class, args);
    }
}
