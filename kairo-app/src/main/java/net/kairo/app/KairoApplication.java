package net.kairo.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class KairoApplication {
    public static void main(String[] args) {
        SpringApplication.run(KairoApplication.class, args);
    }
}
