package org.iceforge.runa.olap.service;

import org.iceforge.runa.olap.model.AggregationMode;
import org.iceforge.runa.olap.model.AggregationRequest;
import org.iceforge.runa.olap.model.Dimension;
import org.iceforge.runa.olap.model.GroupingSet;
import org.iceforge.runa.olap.model.StarSchemaDef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Renders an {@link AggregationRequest} as SQL over the star schema (PostgreSQL / DuckDB dialect).
 *
 * <p>Every dimension gets its own {@code GROUPING(col)} column so rows can be classified by flag. Dimension values
 * are selected as-is; no placeholder text is substituted for collapsed columns. Filter values are bound as
 * parameters, column references only ever come from the catalog.
 */
@Service
public class AggregationSqlCompiler {

    private static final Logger log = LoggerFactory.getLogger(AggregationSqlCompiler.class);

    public static final String TOTAL_QUANTITY = "total_quantity";
    public static final String TOTAL_REVENUE = "total_revenue";
    public static final String TRANSACTION_COUNT = "transaction_count";
    public static final String AVG_UNIT_PRICE = "avg_unit_price";

    private final HierarchyCatalog catalog;

    public AggregationSqlCompiler(HierarchyCatalog catalog) {
        this.catalog = Objects.requireNonNull(catalog);
    }

    public static String valueColumn(Dimension d) {
        return d.shortName() + "_value";
    }

    public static String groupingColumn(Dimension d) {
        return d.shortName() + "_grouping";
    }

    public CompiledQuery compile(AggregationRequest req) {
        Objects.requireNonNull(req);
        StarSchemaDef schema = catalog.schema();

        List<String> selectCols = new ArrayList<>();
        for (Dimension d : Dimension.values()) {
            selectCols.add(req.level(d).columnRef() + " AS " + valueColumn(d));
        }
        for (Dimension d : Dimension.values()) {
            selectCols.add("GROUPING(" + req.level(d).columnRef() + ") AS " + groupingColumn(d));
        }
        selectCols.add("SUM(" + schema.getQuantityColumn() + ") AS " + TOTAL_QUANTITY);
        selectCols.add("SUM(" + schema.getRevenueColumn() + ") AS " + TOTAL_REVENUE);
        selectCols.add("COUNT(*) AS " + TRANSACTION_COUNT);
        selectCols.add("AVG(" + schema.getRevenueColumn() + " / NULLIF(" + schema.getQuantityColumn() + ", 0)) AS " + AVG_UNIT_PRICE);

        List<Object> params = new ArrayList<>();
        List<String> where = new ArrayList<>();
        if (req.hasFilter()) {
            where.add(req.filter().columnRef() + " = ?");
            params.add(req.filter().value());
        }

        StringBuilder sql = new StringBuilder();
        sql.append("SELECT ").append(String.join(",\n       ", selectCols)).append("\n")
           .append(fromClause(schema));

        if (!where.isEmpty()) {
            sql.append("WHERE ").append(String.join("\n  AND ", where)).append("\n");
        }

        sql.append("GROUP BY ").append(groupByClause(req)).append("\n");

        List<String> orderBy = new ArrayList<>();
        for (Dimension d : Dimension.values()) {
            orderBy.add(groupingColumn(d));
        }
        for (Dimension d : Dimension.values()) {
            orderBy.add(valueColumn(d) + " NULLS LAST");
        }
        sql.append("ORDER BY ").append(String.join(", ", orderBy));

        CompiledQuery cq = new CompiledQuery(req.mode(), sql.toString(), List.copyOf(params));
        log.debug("Compiled {} into\n{}\nparams {}", req, cq.sql(), cq.parameters());
        return cq;
    }

    String fromClause(StarSchemaDef schema) {
        StringBuilder from = new StringBuilder();
        from.append("FROM ").append(schema.getFactTable()).append(' ').append(schema.getFactAlias()).append("\n");
        for (Dimension d : Dimension.values()) {
            StarSchemaDef.JoinDef join = schema.getJoins() == null ? null : schema.getJoins().get(d.key());
            if (join == null) {
                throw new IllegalStateException("Star schema has no join for dimension '" + d.key() + "'");
            }
            from.append("JOIN ").append(join.getTable()).append(' ').append(join.getAlias())
                .append(" ON ").append(join.getOn()).append("\n");
        }
        return from.toString();
    }

    private static String groupByClause(AggregationRequest req) {
        if (req.mode() == AggregationMode.CUBE) {
            return "CUBE (" + String.join(", ", req.dimensionColumns()) + ")";
        }
        String sets = req.groupingSets().stream()
                .map(set -> groupingSetColumns(req, set))
                .collect(Collectors.joining(", "));
        return "GROUPING SETS (" + sets + ")";
    }

    private static String groupingSetColumns(AggregationRequest req, GroupingSet set) {
        return set.dimensions().stream()
                .map(d -> req.level(d).columnRef())
                .collect(Collectors.joining(", ", "(", ")"));
    }

    public record CompiledQuery(AggregationMode mode, String sql, List<Object> parameters) {}
}
