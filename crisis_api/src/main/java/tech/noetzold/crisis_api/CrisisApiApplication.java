package tech.noetzold.crisis_api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CrisisApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(CrisisApiApplication.class, args);
    }
}
