package co.fanki.codegraph.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.spi.JdbiPlugin;
import org.jdbi.v3.jackson2.Jackson2Config;
import org.jdbi.v3.jackson2.Jackson2Plugin;
import org.jdbi.v3.postgres.PostgresPlugin;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.util.List;

/**
 * Database configuration for JDBI3 with PostgreSQL.
 *
 * <p>Only active when the graph is stored in PostgreSQL.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Configuration
@ConditionalOnProperty(name = "graph.storage", havingValue = "postgres",
        matchIfMissing = true)
public class DatabaseConfiguration {

    /**
     * Creates and configures the JDBI instance.
     *
     * @param dataSource the data source to use
     * @param plugins list of JDBI plugins to install
     * @param objectMapper Jackson object mapper for JSON columns
     * @return configured JDBI instance
     */
    @Bean
    public Jdbi jdbi(
            final DataSource dataSource,
            final List<JdbiPlugin> plugins,
            final ObjectMapper objectMapper) {

        final Jdbi jdbi = Jdbi.create(dataSource);

        plugins.forEach(jdbi::installPlugin);

        jdbi.getConfig(Jackson2Config.class).setMapper(objectMapper);

        return jdbi;
    }

    /**
     * Provides the PostgreSQL plugin for JDBI.
     *
     * @return PostgreSQL plugin
     */
    @Bean
    public JdbiPlugin postgresPlugin() {
        return new PostgresPlugin();
    }

    /**
     * Provides the Jackson2 plugin for JDBI JSON handling.
     *
     * @return Jackson2 plugin
     */
    @Bean
    public JdbiPlugin jackson2Plugin() {
        return new Jackson2Plugin();
    }

}
