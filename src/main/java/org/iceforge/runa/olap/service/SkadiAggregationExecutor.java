package org.iceforge.runa.olap.service;

import org.iceforge.runa.olap.config.OlapProperties;
import org.iceforge.runa.olap.model.AggregateRow;
import org.iceforge.runa.olap.model.AggregationRequest;
import org.iceforge.runa.olap.web.SkadiQueryRequest;
import org.iceforge.runa.olap.web.SkadiQueryResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Runs aggregation requests through a remote Skadi query service, waiting for the answer on the caller's thread.
 */
@Component
@ConditionalOnProperty(prefix = "runa.olap", name = "executor", havingValue = "skadi")
public class SkadiAggregationExecutor implements AggregationExecutor {

    private static final Logger log = LoggerFactory.getLogger(SkadiAggregationExecutor.class);

    private final SkadiClient skadiClient;
    private final AggregationSqlCompiler compiler;
    private final OlapProperties props;

    public SkadiAggregationExecutor(SkadiClient skadiClient, AggregationSqlCompiler compiler, OlapProperties props) {
        this.skadiClient = Objects.requireNonNull(skadiClient);
        this.compiler = Objects.requireNonNull(compiler);
        this.props = Objects.requireNonNull(props);
    }

    @Override
    public List<AggregateRow> execute(AggregationRequest request) {
        AggregationSqlCompiler.CompiledQuery cq = compiler.compile(request);

        SkadiQueryRequest skadiReq = new SkadiQueryRequest();
        skadiReq.setJdbc(jdbcConfig());
        skadiReq.setSql(cq.sql());
        skadiReq.setParameters(cq.parameters());

        long start = System.currentTimeMillis();
        SkadiQueryResponse response;
        try {
            response = skadiClient.runQuery(skadiReq).block(props.getSkadi().getTimeout());
        } catch (RuntimeException e) {
            throw new AggregationExecutionException("Aggregation " + request + " failed on Skadi: " + e.getMessage(), e);
        }
        if (response == null) {
            throw new AggregationExecutionException("Skadi returned no answer for " + request);
        }

        List<AggregateRow> rows = toRows(response);
        log.info("Executed {} on Skadi -> {} rows in {} ms", request, rows.size(), System.currentTimeMillis() - start);
        return rows;
    }

    private SkadiQueryRequest.JdbcConfig jdbcConfig() {
        SkadiQueryRequest.JdbcConfig cfg = new SkadiQueryRequest.JdbcConfig();
        cfg.setJdbcUrl(props.getWarehouse().getJdbcUrl());
        cfg.setUsername(props.getWarehouse().getUsername());
        cfg.setPassword(props.getWarehouse().getPassword());
        return cfg;
    }

    static List<AggregateRow> toRows(SkadiQueryResponse response) {
        Map<String, Integer> index = new HashMap<>();
        List<String> columns = response.getColumns();
        if (columns == null) {
            throw new AggregationExecutionException("Skadi result has rows but no columns");
        }
        for (int i = 0; i < columns.size(); i++) {
            index.put(columns.get(i).toLowerCase(Locale.ROOT), i);
        }
        List<AggregateRow> rows = new ArrayList<>(response.getRows().size());
        for (List<Object> values : response.getRows()) {
            if (values == null || values.size() != columns.size()) {
                throw new AggregationExecutionException("Skadi result row " + rows.size() + " has "
                        + (values == null ? "no values" : values.size() + " values") + " for " + columns.size() + " columns");
            }
            rows.add(AggregationExecutor.toRow(column -> {
                Integer i = index.get(column);
                if (i == null) {
                    throw new AggregationExecutionException("Skadi result has no column '" + column + "', got " + columns);
                }
                return values.get(i);
            }));
        }
        return rows;
    }
}
