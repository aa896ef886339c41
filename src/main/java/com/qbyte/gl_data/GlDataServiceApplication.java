package com.qbyte.gl_data;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * QByte GL Data Service.
 *
 * Generates a deterministic oil and gas General Ledger history at startup,
 * keeps appending live records in the background, and serves both over HTTP.
 */
@SpringBootApplication
public class GlDataServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(GlDataServiceApplication.class, args);
    }
}
