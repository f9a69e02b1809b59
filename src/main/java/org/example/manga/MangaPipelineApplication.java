package org.example.manga;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MangaPipelineApplication {

    public static void main(String[] args) {
        SpringApplication.run(MangaPipelineApplication.class, args);
    }
}
