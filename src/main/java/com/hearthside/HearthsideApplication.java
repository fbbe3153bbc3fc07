package com.hearthside;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the Hearthside AI gateway - rate limiting, budget control
 * and response caching in front of the family assistant's text-generation provider.
 */
@SpringBootApplication
public class HearthsideApplication {

    public static void main(String[] args) {
        SpringApplication.run(HearthsideApplication.class, args);
    }
}
