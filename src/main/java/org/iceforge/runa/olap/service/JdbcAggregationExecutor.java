package org.iceforge.runa.olap.service;

import org.iceforge.runa.olap.model.AggregateRow;
import org.iceforge.runa.olap.model.AggregationRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Objects;

/**
 * Runs aggregation requests on the warehouse database through JDBC.
 */
@Component
@ConditionalOnProperty(prefix = "runa.olap", name = "executor", havingValue = "jdbc", matchIfMissing = true)
public class JdbcAggregationExecutor implements AggregationExecutor {

    private static final Logger log = LoggerFactory.getLogger(JdbcAggregationExecutor.class);

    private final JdbcTemplate jdbc;
    private final AggregationSqlCompiler compiler;

    public JdbcAggregationExecutor(JdbcTemplate warehouseJdbcTemplate, AggregationSqlCompiler compiler) {
        this.jdbc = Objects.requireNonNull(warehouseJdbcTemplate);
        this.compiler = Objects.requireNonNull(compiler);
    }

    @Override
    public List<AggregateRow> execute(AggregationRequest request) {
        AggregationSqlCompiler.CompiledQuery cq = compiler.compile(request);
        long start = System.currentTimeMillis();
        try {
            List<AggregateRow> rows = jdbc.query(cq.sql(), (rs, rowNum) -> mapRow(rs), cq.parameters().toArray());
            log.info("Executed {} -> {} rows in {} ms", request, rows.size(), System.currentTimeMillis() - start);
            return rows;
        } catch (DataAccessException e) {
            throw new AggregationExecutionException("Aggregation " + request + " failed: " + e.getMostSpecificCause().getMessage(), e);
        }
    }

    private static AggregateRow mapRow(ResultSet rs) throws SQLException {
        try {
            return AggregationExecutor.toRow(column -> {
                try {
                    return rs.getObject(column);
                } catch (SQLException e) {
                    throw new ColumnReadException(e);
                }
            });
        } catch (ColumnReadException e) {
            throw e.getCause();
        }
    }

    /**
     * Carries a {@link SQLException} out of the column lambda so the template can translate it.
     */
    private static final class ColumnReadException extends RuntimeException {

        ColumnReadException(SQLException cause) {
            super(cause);
        }

        @Override
        public synchronized SQLException getCause() {
            return (SQLException) super.getCause();
        }
    }
}
