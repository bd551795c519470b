package org.iceforge.runa.olap.service;

import org.iceforge.runa.olap.model.StarSchemaDef;
import org.iceforge.runa.olap.model.WarehouseStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.sql.Date;
import java.time.LocalDate;
import java.util.Objects;

/**
 * Headline numbers of the warehouse, used to check that it is reachable and loaded.
 */
@Service
@ConditionalOnProperty(prefix = "runa.olap", name = "executor", havingValue = "jdbc", matchIfMissing = true)
public class WarehouseStatisticsService {

    private static final Logger log = LoggerFactory.getLogger(WarehouseStatisticsService.class);

    private final JdbcTemplate jdbc;
    private final AggregationSqlCompiler compiler;
    private final HierarchyCatalog catalog;

    public WarehouseStatisticsService(JdbcTemplate warehouseJdbcTemplate, AggregationSqlCompiler compiler, HierarchyCatalog catalog) {
        this.jdbc = Objects.requireNonNull(warehouseJdbcTemplate);
        this.compiler = Objects.requireNonNull(compiler);
        this.catalog = Objects.requireNonNull(catalog);
    }

    public WarehouseStatistics statistics() {
        StarSchemaDef schema = catalog.schema();
        String sql = "SELECT COALESCE(SUM(" + schema.getRevenueColumn() + "), 0) AS total_revenue,\n"
                + "       COUNT(*) AS total_transactions,\n"
                + "       MIN(" + schema.getDateColumn() + ") AS first_date,\n"
                + "       MAX(" + schema.getDateColumn() + ") AS last_date,\n"
                + "       COUNT(DISTINCT " + schema.getProductKeyColumn() + ") AS unique_products,\n"
                + "       COUNT(DISTINCT " + schema.getShopKeyColumn() + ") AS unique_shops\n"
                + compiler.fromClause(schema);
        try {
            WarehouseStatistics stats = jdbc.queryForObject(sql, (rs, n) -> new WarehouseStatistics(
                    decimal(rs.getObject("total_revenue")),
                    ((Number) rs.getObject("total_transactions")).longValue(),
                    date(rs.getObject("first_date")),
                    date(rs.getObject("last_date")),
                    ((Number) rs.getObject("unique_products")).longValue(),
                    ((Number) rs.getObject("unique_shops")).longValue()));
            log.info("Warehouse holds {} transactions", stats == null ? 0 : stats.totalTransactions());
            return stats;
        } catch (DataAccessException e) {
            throw new AggregationExecutionException("Warehouse statistics failed: " + e.getMostSpecificCause().getMessage(), e);
        }
    }

    private static BigDecimal decimal(Object v) {
        return v instanceof BigDecimal d ? d : new BigDecimal(v.toString());
    }

    private static LocalDate date(Object v) {
        if (v == null) {
            return null;
        }
        if (v instanceof LocalDate d) {
            return d;
        }
        if (v instanceof Date d) {
            return d.toLocalDate();
        }
        return LocalDate.parse(v.toString());
    }
}
