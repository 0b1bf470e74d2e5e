package career.pulse.app.config;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import javax.sql.DataSource;
import java.net.URI;

/**
 * Builds the data source from {@code careerpulse.store.location}: a {@code postgres://}
 * URL (Fly/Heroku style), a {@code jdbc:} URL, or otherwise an H2 file path.
 */
@Slf4j
@Configuration
public class DataSourceConfig {

    @Bean
    @Primary
    public DataSource dataSource(CareerPulseProperties properties) {
        HikariConfig config = toHikariConfig(properties.getStore().getLocation());
        log.info("Application store: {}", config.getJdbcUrl().replaceAll("(?i)(password=)[^&;]*", "$1****"));
        return new HikariDataSource(config);
    }

    static HikariConfig toHikariConfig(String location) {
        String raw = location.trim();
        HikariConfig config = new HikariConfig();

        if (raw.startsWith("postgres://") || raw.startsWith("postgresql://")) {
            URI uri = URI.create(raw);
            String jdbcUrl = "jdbc:postgresql://" + uri.getHost() + (uri.getPort() > 0 ? ":" + uri.getPort() : "")
                    + uri.getPath();
            // Ensure sslmode=require exactly once
            String query = uri.getQuery();
            if (query == null || query.isEmpty()) {
                jdbcUrl = jdbcUrl + "?sslmode=require";
            } else {
                jdbcUrl = jdbcUrl + "?" + query + (query.contains("sslmode=") ? "" : "&sslmode=require");
            }
            if (uri.getUserInfo() != null) {
                String[] credentials = uri.getUserInfo().split(":", 2);
                config.setUsername(credentials[0]);
                if (credentials.length > 1) {
                    config.setPassword(credentials[1]);
                }
            }
            config.setJdbcUrl(jdbcUrl);
            config.setDriverClassName("org.postgresql.Driver");
        } else if (raw.startsWith("jdbc:")) {
            config.setJdbcUrl(raw);
        } else {
            config.setJdbcUrl("jdbc:h2:file:" + raw);
            config.setDriverClassName("org.h2.Driver");
            config.setUsername("sa");
        }
        return config;
    }
}
