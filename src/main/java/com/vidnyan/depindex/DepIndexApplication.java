package com.vidnyan.depindex;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Dependency Graph Index
 *
 * Answers direct, reverse and transitive dependency queries over extracted fact records.
 */
@SpringBootApplication
public class DepIndexApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(DepIndexApplication.class, args)));
    }
}
