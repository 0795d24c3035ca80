package io.github.drompincen.clawfork.gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication(scanBasePackages = "io.github.drompincen.clawfork")
@EnableScheduling
public class ClawforkApplication {

    public static void main(String[] args) {
        SpringApplication.run(ClawforkApplication.class, args);
    }
}
