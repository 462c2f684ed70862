package com.codefarm.shortlink.config;

import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.boot.autoconfigure.jdbc.DataSourceProperties;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.jdbc.DataSourceBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import javax.sql.DataSource;
import java.util.Map;

/**
 * Two pools behind one {@link DataSource}: writes and redirect lookups go to the primary, reporting
 * reads to {@code shortener.datasource.replica.*}. Without a replica URL both routes share the primary.
 * Both pools bind {@code spring.datasource.hikari.*}, including the driver properties that carry the
 * server-side statement timeout.
 */
@Configuration
public class DataSourceConfig {

    private static final Logger log = LoggerFactory.getLogger(DataSourceConfig.class);

    @Bean(destroyMethod = "close")
    @ConfigurationProperties("spring.datasource.hikari")
    public HikariDataSource primaryDataSource(DataSourceProperties properties) {
        HikariDataSource dataSource = properties.initializeDataSourceBuilder().type(HikariDataSource.class).build();
        dataSource.setPoolName("primary");
        return dataSource;
    }

    @Bean(destroyMethod = "close")
    @ConfigurationProperties("spring.datasource.hikari")
    @ConditionalOnExpression("!'${shortener.datasource.replica.url:}'.isBlank()")
    public HikariDataSource replicaDataSource(@Value("${shortener.datasource.replica.url}") String url,
                                              @Value("${shortener.datasource.replica.username:}") String username,
                                              @Value("${shortener.datasource.replica.password:}") String password) {
        HikariDataSource dataSource = DataSourceBuilder.create()
                .type(HikariDataSource.class)
                .url(url)
                .username(username)
                .password(password)
                .build();
        dataSource.setPoolName("replica");
        dataSource.setReadOnly(true);
        log.info("Reporting reads routed to replica {}", url);
        return dataSource;
    }

    @Bean
    @Primary
    public DataSource dataSource(@Qualifier("primaryDataSource") HikariDataSource primaryDataSource,
                                 @Qualifier("replicaDataSource") ObjectProvider<HikariDataSource> replicaDataSource) {
        DataSource replica = replicaDataSource.getIfAvailable();
        if (replica == null) {
            log.info("No replica configured; reporting reads use the primary pool");
            replica = primaryDataSource;
        }

        ReplicaRoutingDataSource routing = new ReplicaRoutingDataSource();
        routing.setTargetDataSources(Map.of(
                DataSourceRoute.Target.PRIMARY, primaryDataSource,
                DataSourceRoute.Target.REPLICA, replica));
        routing.setDefaultTargetDataSource(primaryDataSource);
        routing.afterPropertiesSet();
        return routing;
    }
}
