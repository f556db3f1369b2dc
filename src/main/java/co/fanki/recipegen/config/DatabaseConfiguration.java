package co.fanki.recipegen.config;

import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.mapper.RowMapper;
import org.jdbi.v3.core.spi.JdbiPlugin;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.util.List;

/**
 * Database configuration for JDBI3 over the SQLite archive.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Configuration
public class DatabaseConfiguration {

    /**
     * Creates and configures the JDBI instance.
     *
     * @param dataSource the data source to use
     * @param plugins list of JDBI plugins to install
     * @param rowMappers list of row mappers to register
     * @return configured JDBI instance
     */
    @Bean
    public Jdbi jdbi(
            final DataSource dataSource,
            final List<JdbiPlugin> plugins,
            final List<RowMapper<?>> rowMappers) {

        final Jdbi jdbi = Jdbi.create(dataSource);

        plugins.forEach(jdbi::installPlugin);
        rowMappers.forEach(jdbi::registerRowMapper);

        return jdbi;
    }

}
