package org.iceforge.runa.olap.config;

import org.iceforge.runa.olap.service.HierarchyCatalog;
import org.iceforge.runa.olap.service.HierarchyCatalogLoader;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.web.reactive.function.client.WebClient;

import javax.sql.DataSource;

@Configuration
@EnableConfigurationProperties(OlapProperties.class)
public class AppConfig {

    @Bean
    public HierarchyCatalog hierarchyCatalog(HierarchyCatalogLoader loader) {
        return loader.load();
    }

    @Bean
    @ConditionalOnProperty(prefix = "runa.olap", name = "executor", havingValue = "jdbc", matchIfMissing = true)
    public DataSource warehouseDataSource(OlapProperties props) {
        OlapProperties.Warehouse wh = props.getWarehouse();
        // Connections are opened per call; the warehouse engine owns pooling.
        return new DriverManagerDataSource(wh.getJdbcUrl(), wh.getUsername(), wh.getPassword());
    }

    @Bean
    @ConditionalOnProperty(prefix = "runa.olap", name = "executor", havingValue = "jdbc", matchIfMissing = true)
    public JdbcTemplate warehouseJdbcTemplate(DataSource warehouseDataSource) {
        return new JdbcTemplate(warehouseDataSource);
    }

    @Bean
    @ConditionalOnProperty(prefix = "runa.olap", name = "executor", havingValue = "skadi")
    public WebClient skadiWebClient(OlapProperties props) {
        return WebClient.builder()
                .baseUrl(props.getSkadi().getBaseUrl())
                .build();
    }
}
