package org.iceforge.runa.olap.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.Duration;

@Validated
@ConfigurationProperties(prefix = "runa.olap")
public class OlapProperties {

    /**
     * Location of the hierarchy catalog YAML on the classpath.
     */
    @NotBlank
    private String catalogResource = "olap-catalog.yml";

    /**
     * Which engine runs aggregation requests: jdbc or skadi.
     */
    @NotNull
    private ExecutorType executor = ExecutorType.JDBC;

    /**
     * Allowed difference between revenue margins and the sum of their cells.
     */
    @NotNull
    @PositiveOrZero
    private BigDecimal revenueTolerance = new BigDecimal("0.01");

    /**
     * Sessions not used for this long are closed the next time any session is opened or looked up.
     */
    @NotNull
    private Duration sessionIdleTimeout = Duration.ofMinutes(30);

    @Valid
    private final Warehouse warehouse = new Warehouse();

    @Valid
    private final Skadi skadi = new Skadi();

    public String getCatalogResource() {
        return catalogResource;
    }

    public void setCatalogResource(String catalogResource) {
        this.catalogResource = catalogResource;
    }

    public ExecutorType getExecutor() {
        return executor;
    }

    public void setExecutor(ExecutorType executor) {
        this.executor = executor;
    }

    public BigDecimal getRevenueTolerance() {
        return revenueTolerance;
    }

    public void setRevenueTolerance(BigDecimal revenueTolerance) {
        this.revenueTolerance = revenueTolerance;
    }

    public Duration getSessionIdleTimeout() {
        return sessionIdleTimeout;
    }

    public void setSessionIdleTimeout(Duration sessionIdleTimeout) {
        this.sessionIdleTimeout = sessionIdleTimeout;
    }

    public Warehouse getWarehouse() {
        return warehouse;
    }

    public Skadi getSkadi() {
        return skadi;
    }

    public enum ExecutorType {
        JDBC,
        SKADI
    }

    public static class Warehouse {

        @NotBlank
        private String jdbcUrl = "jdbc:postgresql://localhost:5432/datawarehouse";

        private String username = "dwuser";

        private String password = "dwpassword";

        public String getJdbcUrl() {
            return jdbcUrl;
        }

        public void setJdbcUrl(String jdbcUrl) {
            this.jdbcUrl = jdbcUrl;
        }

        public String getUsername() {
            return username;
        }

        public void setUsername(String username) {
            this.username = username;
        }

        public String getPassword() {
            return password;
        }

        public void setPassword(String password) {
            this.password = password;
        }
    }

    public static class Skadi {

        /**
         * Base URL of the Skadi server, e.g. http://localhost:8080
         */
        @NotBlank
        private String baseUrl = "http://localhost:8080";

        /**
         * Path used to submit a query to Skadi.
         */
        @NotBlank
        private String submitPath = "/api/v1/queries";

        /**
         * Path template used to fetch JSON rows when submit only returns a query id.
         *
         * Use {queryId} token, e.g. /api/v1/queries/{queryId}/results
         */
        @NotBlank
        private String resultPathTemplate = "/api/v1/queries/{queryId}/results";

        /**
         * How long one aggregation may take before the request fails.
         */
        @NotNull
        private Duration timeout = Duration.ofSeconds(30);

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getSubmitPath() {
            return submitPath;
        }

        public void setSubmitPath(String submitPath) {
            this.submitPath = submitPath;
        }

        public String getResultPathTemplate() {
            return resultPathTemplate;
        }

        public void setResultPathTemplate(String resultPathTemplate) {
            this.resultPathTemplate = resultPathTemplate;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }
    }
}
