package com.williamcallahan.release_tracker.config;

import com.williamcallahan.release_tracker.repository.ArtistFetchLogRepository;
import com.williamcallahan.release_tracker.repository.InMemoryArtistFetchLogRepository;
import com.williamcallahan.release_tracker.repository.InMemoryIsrcRepository;
import com.williamcallahan.release_tracker.repository.InMemoryReleaseRepository;
import com.williamcallahan.release_tracker.repository.InMemoryRunHistoryRepository;
import com.williamcallahan.release_tracker.repository.IsrcRepository;
import com.williamcallahan.release_tracker.repository.ReleaseRepository;
import com.williamcallahan.release_tracker.repository.RunHistoryRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.EnableAutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.boot.autoconfigure.flyway.FlywayAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.JdbcTemplateAutoConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration to run without a database when no database URL is configured
 *
 * @author William Callahan
 *
 * Features:
 * - Activates only when no database URL is configured in properties
 * - Disables Spring's datasource, JdbcTemplate and Flyway auto-configuration
 * - Registers in-memory stores in place of the JDBC repositories
 * - Cached releases and ISRC lookups then last only as long as the process
 */
@Configuration
@Slf4j
@ConditionalOnExpression("'${spring.datasource.url:}'.length() == 0")
@EnableAutoConfiguration(exclude = {
        DataSourceAutoConfiguration.class,
        DataSourceTransactionManagerAutoConfiguration.class,
        JdbcTemplateAutoConfiguration.class,
        FlywayAutoConfiguration.class
})
public class NoDatabaseConfig {

    @Bean
    public ReleaseRepository releaseRepository() {
        log.info("No database URL provided. Using in-memory release cache.");
        return new InMemoryReleaseRepository();
    }

    @Bean
    public IsrcRepository isrcRepository() {
        return new InMemoryIsrcRepository();
    }

    @Bean
    public ArtistFetchLogRepository artistFetchLogRepository() {
        return new InMemoryArtistFetchLogRepository();
    }

    @Bean
    public RunHistoryRepository runHistoryRepository() {
        return new InMemoryRunHistoryRepository();
    }
}
