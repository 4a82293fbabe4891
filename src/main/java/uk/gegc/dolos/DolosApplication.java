package uk.gegc.dolos;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class DolosApplication {

    public static void main(String[] args) {
        SpringApplication.run(DolosApplication.class, args);
    }
}
