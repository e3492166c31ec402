package com.mealscout.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.datasource.SimpleDriverDataSource;

import javax.sql.DataSource;

/**
 * Data source for {@code chat.store.storage=database}, bound from {@code spring.datasource.*}.
 * The in-memory store needs none.
 */
@Configuration
@ConditionalOnProperty(name = "chat.store.storage", havingValue = "database")
@EnableConfigurationProperties(DataSourceProperties.class)
public class JdbcConfig {

    @Bean
    @ConditionalOnMissingBean(DataSource.class)
    public DataSource chatStoreDataSource(DataSourceProperties properties) {
        // no pool on the classpath; the driver is resolved from the url when not set
        return properties.initializeDataSourceBuilder()
                .type(SimpleDriverDataSource.class)
                .build();
    }

    @Bean
    @ConditionalOnMissingBean(NamedParameterJdbcTemplate.class)
    public NamedParameterJdbcTemplate namedParameterJdbcTemplate(DataSource dataSource) {
        return new NamedParameterJdbcTemplate(dataSource);
    }
}
