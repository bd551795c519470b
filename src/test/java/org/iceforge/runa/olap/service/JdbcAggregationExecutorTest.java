package org.iceforge.runa.olap.service;

import org.iceforge.runa.olap.config.OlapProperties;
import org.iceforge.runa.olap.model.AggregateRow;
import org.iceforge.runa.olap.model.AggregationRequest;
import org.iceforge.runa.olap.model.ClassifiedRow;
import org.iceforge.runa.olap.model.CrossTab;
import org.iceforge.runa.olap.model.CubeLevel;
import org.iceforge.runa.olap.model.Dimension;
import org.iceforge.runa.olap.model.GroupingSet;
import org.iceforge.runa.olap.model.Measure;
import org.iceforge.runa.olap.model.WarehouseStatistics;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Runs the compiled SQL on an in-memory DuckDB warehouse. DuckDB gives every new connection an empty database, so
 * the whole test shares one connection.
 */
class JdbcAggregationExecutorTest {

    private final HierarchyCatalog catalog = TestCatalogs.standard();
    private final AggregationRequestBuilder builder = new AggregationRequestBuilder(catalog);
    private final AggregationSqlCompiler compiler = new AggregationSqlCompiler(catalog);
    private final ResultClassifier classifier = new ResultClassifier();

    private SingleConnectionDataSource dataSource;
    private JdbcTemplate jdbc;
    private JdbcAggregationExecutor executor;

    @BeforeEach
    void setUp() {
        dataSource = new SingleConnectionDataSource("jdbc:duckdb:", true);
        jdbc = new JdbcTemplate(dataSource);
        executor = new JdbcAggregationExecutor(jdbc, compiler);

        jdbc.execute("CREATE TABLE DimShop (ShopKey INTEGER, ShopName VARCHAR, CityName VARCHAR, RegionName VARCHAR, CountryName VARCHAR)");
        jdbc.execute("CREATE TABLE DimDate (DateKey INTEGER, FullDate DATE, \"Day\" INTEGER, \"Month\" INTEGER, Quarter INTEGER, \"Year\" INTEGER)");
        jdbc.execute("CREATE TABLE DimProduct (ProductKey INTEGER, ArticleName VARCHAR, ProductGroupName VARCHAR, "
                + "ProductFamilyName VARCHAR, ProductCategoryName VARCHAR)");
        jdbc.execute("CREATE TABLE FactSales (DateKey INTEGER, ShopKey INTEGER, ProductKey INTEGER, QuantitySold INTEGER, Revenue DECIMAL(12,2))");

        jdbc.execute("INSERT INTO DimShop VALUES "
                + "(1, 'Shop A', 'Berlin', 'North', 'Germany'), "
                + "(2, 'Shop B', 'Munich', 'South', 'Germany'), "
                + "(3, 'Shop C', 'Hamburg', 'North', 'Germany')");
        jdbc.execute("INSERT INTO DimDate VALUES "
                + "(20190115, DATE '2019-01-15', 15, 1, 1, 2019), "
                + "(20190420, DATE '2019-04-20', 20, 4, 2, 2019), "
                + "(20200310, DATE '2020-03-10', 10, 3, 1, 2020)");
        jdbc.execute("INSERT INTO DimProduct VALUES "
                + "(1, 'Road Bike', 'Bikes', 'Cycling', 'Sports'), "
                + "(2, 'Helmet', 'Helmets', 'Cycling', 'Sports'), "
                + "(3, 'Tent', 'Tents', 'Camping', 'Outdoor')");
        jdbc.execute("INSERT INTO FactSales VALUES "
                + "(20190115, 1, 1, 2, 1000.00), "
                + "(20190115, 1, 2, 3, 150.00), "
                + "(20190420, 2, 1, 1, 520.50), "
                + "(20190420, 3, 3, 4, 800.00), "
                + "(20200310, 2, 2, 5, 249.95), "
                + "(20200310, 1, 1, 1, 480.00)");
    }

    @AfterEach
    void tearDown() {
        dataSource.destroy();
    }

    @Test
    void cubeProducesAllEightLevelsAndConsistentTotals() {
        AggregationRequest req = builder.cube(new NavigationState(catalog, 2, 2, 1), null);

        List<ClassifiedRow> rows = classifier.classify(req, executor.execute(req));
        var groups = classifier.group(req.mode(), rows);

        assertThat(groups.keySet()).containsExactly(CubeLevel.values());
        assertThat(groups.get(CubeLevel.GRAND_TOTAL)).hasSize(1);

        ClassifiedRow grand = groups.get(CubeLevel.GRAND_TOTAL).get(0);
        assertThat(grand.measures().quantity()).isEqualTo(16);
        assertThat(grand.measures().revenue()).isEqualByComparingTo("3200.45");
        assertThat(grand.measures().count()).isEqualTo(6);

        long detailQuantity = groups.get(CubeLevel.DETAIL).stream().mapToLong(r -> r.measures().quantity()).sum();
        assertThat(detailQuantity).isEqualTo(16);

        assertThat(groups.get(CubeLevel.BY_GEOGRAPHY_ONLY)).extracting(r -> r.value(Dimension.GEOGRAPHY))
                .containsExactly("North", "South");
        assertThat(groups.get(CubeLevel.BY_GEOGRAPHY_ONLY)).allSatisfy(r -> {
            assertThat(r.value(Dimension.TIME)).isNull();
            assertThat(r.value(Dimension.PRODUCT)).isNull();
        });
    }

    @Test
    void filterRestrictsTheFactsBeforeGrouping() {
        AggregationRequest req = builder.cube(new NavigationState(catalog, 3, 3, 3), builder.filter("Year", 2019));

        List<AggregateRow> rows = executor.execute(req);
        AggregateRow grand = rows.stream().filter(r -> r.flags().bitmask() == 0b111).findFirst().orElseThrow();

        assertThat(grand.measures().quantity()).isEqualTo(10);
        assertThat(grand.measures().count()).isEqualTo(4);
        assertThat(rows).filteredOn(r -> !r.isCollapsed(Dimension.TIME))
                .extracting(r -> ((Number) r.value(Dimension.TIME)).intValue())
                .containsOnly(2019);
    }

    @Test
    void groupingSetsReconcileIntoACrossTab() {
        AggregationRequest req = builder.groupingSets(new NavigationState(catalog, 2, 2, 1), null);

        List<ClassifiedRow> rows = classifier.classify(req, executor.execute(req));
        CrossTabFormatter formatter = new CrossTabFormatter(new OlapProperties());

        assertThat(rows).extracting(ClassifiedRow::level).containsOnly(GroupingSet.values());
        for (Measure m : Measure.values()) {
            formatter.format(rows, m);
        }

        CrossTab tab = formatter.format(rows, Measure.REVENUE);
        assertThat(tab.rowKeys()).containsExactlyInAnyOrder("North", "South");
        assertThat(tab.columnKeys()).containsExactlyInAnyOrder("Bikes", "Helmets", "Tents");
        assertThat(tab.grandTotal()).isEqualByComparingTo("3200.45");
        int south = tab.rowKeys().indexOf("South");
        int tents = tab.columnKeys().indexOf("Tents");
        assertThat(tab.cell(south, tents)).isEqualByComparingTo(BigDecimal.ZERO);
    }

    @Test
    void filteredGroupingSetsKeepGrandTotalEqualToTheDetailSum() {
        AggregationRequest req = builder.groupingSets(new NavigationState(catalog, 2, 2, 1), builder.filter("Year", 2019));

        List<ClassifiedRow> rows = classifier.classify(req, executor.execute(req));
        var groups = classifier.group(req.mode(), rows);

        long detailQuantity = groups.get(GroupingSet.DETAIL).stream().mapToLong(r -> r.measures().quantity()).sum();
        ClassifiedRow grand = groups.get(GroupingSet.GRAND_TOTAL).get(0);
        assertThat(groups.get(GroupingSet.GRAND_TOTAL)).hasSize(1);
        assertThat(grand.measures().quantity()).isEqualTo(detailQuantity).isEqualTo(10);
        assertThat(grand.measures().revenue()).isEqualByComparingTo("2470.50");

        CrossTab tab = new CrossTabFormatter(new OlapProperties()).format(rows, Measure.QUANTITY);
        assertThat(tab.grandTotal()).isEqualByComparingTo("10");
    }

    @Test
    void nullMemberIsDetailNotATotal() {
        jdbc.execute("INSERT INTO DimShop VALUES (4, 'Popup', 'Nowhere', NULL, 'Germany')");
        jdbc.execute("INSERT INTO FactSales VALUES (20190115, 4, 3, 7, 70.00)");
        AggregationRequest req = builder.cube(new NavigationState(catalog, 2, 3, 3), null);

        List<ClassifiedRow> rows = classifier.classify(req, executor.execute(req));

        assertThat(rows).filteredOn(r -> r.level() == CubeLevel.DETAIL)
                .anySatisfy(r -> {
                    assertThat(r.value(Dimension.GEOGRAPHY)).isNull();
                    assertThat(r.measures().quantity()).isEqualTo(7);
                });
        assertThat(rows).filteredOn(r -> r.level() == CubeLevel.GRAND_TOTAL)
                .singleElement()
                .satisfies(r -> assertThat(r.measures().quantity()).isEqualTo(23));
    }

    @Test
    void engineFailureIsWrapped() {
        jdbc.execute("DROP TABLE FactSales");
        AggregationRequest req = builder.cube(new NavigationState(catalog, 2, 2, 1), null);

        assertThatThrownBy(() -> executor.execute(req))
                .isInstanceOf(AggregationExecutionException.class)
                .hasMessageContaining("failed");
    }

    @Test
    void statisticsSummariseTheFactTable() {
        WarehouseStatistics stats = new WarehouseStatisticsService(jdbc, compiler, catalog).statistics();

        assertThat(stats.totalRevenue()).isEqualByComparingTo("3200.45");
        assertThat(stats.totalTransactions()).isEqualTo(6);
        assertThat(stats.firstDate()).isEqualTo(LocalDate.of(2019, 1, 15));
        assertThat(stats.lastDate()).isEqualTo(LocalDate.of(2020, 3, 10));
        assertThat(stats.uniqueProducts()).isEqualTo(3);
        assertThat(stats.uniqueShops()).isEqualTo(3);
        assertThat(stats.isEmpty()).isFalse();
    }
}
