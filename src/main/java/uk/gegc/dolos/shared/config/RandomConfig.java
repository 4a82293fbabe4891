package uk.gegc.dolos.shared.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.security.SecureRandom;
import java.util.random.RandomGenerator;

/**
 * Random source for timeline intervals. Declared as a bean so tests can swap in a seeded generator.
 */
@Configuration
public class RandomConfig {

    @Bean
    public RandomGenerator timelineRandom() {
        return new SecureRandom();
    }
}
