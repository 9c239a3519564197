/**
 * Main application class for Release Tracker
 *
 * @author William Callahan
 *
 * Features:
 * - Non-web Spring Boot application hosting the release discovery engine
 * - Falls back to in-memory stores when no database URL is configured
 * - Enables scheduling for API counter resets and optional cache maintenance
 */

package com.williamcallahan.release_tracker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.time.Clock;

@SpringBootApplication
@EnableScheduling
public class ReleaseTrackerApplication {

    /**
     * Main method that starts the Spring Boot application
     *
     * @param args Command line arguments passed to the application
     */
    public static void main(String[] args) {
        SpringApplication.run(ReleaseTrackerApplication.class, args);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
