package dev.careerpath.config;

import dev.careerpath.data.ReferenceDataLoader;
import dev.careerpath.data.ReferenceDataStore;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Loads the reference tables once at startup and exposes them as a shared, read-only bean.
 */
@Configuration
public class ReferenceDataConfig {

    @Bean
    public ReferenceDataStore referenceDataStore(ReferenceDataLoader loader) {
        return loader.load();
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
