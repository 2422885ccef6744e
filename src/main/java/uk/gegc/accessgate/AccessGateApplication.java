package uk.gegc.accessgate;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AccessGateApplication {

    public static void main(String[] args) {
        SpringApplication.run(AccessGateApplication.class, args);
    }
}
