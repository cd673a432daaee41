package org.tcgstats.metalens_api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MetaLensApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(MetaLensApiApplication.class, args);
    }
}
