package org.lime.caddie;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class CaddieApplication {

    public static void main(String[] args) {
        SpringApplication.run(CaddieApplication.class, args);
    }
}
