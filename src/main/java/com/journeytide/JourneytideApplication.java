package com.journeytide;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class JourneytideApplication {

    public static void main(String[] args) {
        SpringApplication.run(JourneytideApplication.class, args);
    }
}
