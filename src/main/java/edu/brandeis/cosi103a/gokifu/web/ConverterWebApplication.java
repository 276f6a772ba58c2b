package edu.brandeis.cosi103a.gokifu.web;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the conversion web service.
 * Accepts legacy game records over HTTP and returns SGF.
 */
@SpringBootApplication
public class ConverterWebApplication {

    public static void main(String[] args) {
        SpringApplication.run(ConverterWebApplication.class, args);
    }
}
