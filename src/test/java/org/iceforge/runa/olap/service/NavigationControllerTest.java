package org.iceforge.runa.olap.service;

import org.iceforge.runa.olap.config.OlapProperties;
import org.iceforge.runa.olap.model.AggregateRow;
import org.iceforge.runa.olap.model.AggregationMode;
import org.iceforge.runa.olap.model.AggregationRequest;
import org.iceforge.runa.olap.model.AggregationResult;
import org.iceforge.runa.olap.model.CubeLevel;
import org.iceforge.runa.olap.model.Dimension;
import org.iceforge.runa.olap.model.EqualityFilter;
import org.iceforge.runa.olap.model.GroupingSet;
import org.iceforge.runa.olap.model.HierarchyLevel;
import org.iceforge.runa.olap.model.Measure;
import org.iceforge.runa.olap.model.NavigationResult;
import org.iceforge.runa.olap.service.NavigationBoundaryException.Boundary;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.iceforge.runa.olap.service.TestCatalogs.row;

class NavigationControllerTest {

    private final HierarchyCatalog catalog = TestCatalogs.standard();
    private final AggregationRequestBuilder builder = new AggregationRequestBuilder(catalog);
    private final RecordingExecutor executor = new RecordingExecutor();

    @Test
    void drillAndRollWalkTheHierarchiesAndStopAtTheTop() {
        NavigationController nav = controller(null);
        assertThat(nav.position().toString()).isEqualTo("[Region, Quarter, Group]");

        NavigationResult drilled = nav.drillDown(Dimension.GEOGRAPHY);
        assertThat(drilled.position().get(Dimension.GEOGRAPHY).levelName()).isEqualTo("City");
        assertThat(executor.lastLevels()).containsExactly("City", "Quarter", "Group");
        assertThat(drilled.detailRows()).hasSize(1)
                .allSatisfy(r -> assertThat(r.level()).isEqualTo(CubeLevel.DETAIL));

        nav.rollUp(Dimension.PRODUCT);
        assertThat(nav.position().toString()).isEqualTo("[City, Quarter, Family]");
        nav.rollUp(Dimension.PRODUCT);
        assertThat(nav.position().toString()).isEqualTo("[City, Quarter, Category]");
        assertThat(nav.canRollUp(Dimension.PRODUCT)).isFalse();
        assertThat(executor.requests).hasSize(3);

        assertThatThrownBy(() -> nav.rollUp(Dimension.PRODUCT))
                .isInstanceOfSatisfying(NavigationBoundaryException.class, e -> {
                    assertThat(e.getBoundary()).isEqualTo(Boundary.MOST_AGGREGATED);
                    assertThat(e.getDimension()).isEqualTo(Dimension.PRODUCT);
                });
        assertThat(executor.requests).hasSize(3);
        assertThat(nav.position().toString()).isEqualTo("[City, Quarter, Category]");
    }

    @Test
    void everyMoveIssuesACubeRequest() {
        NavigationController nav = controller(null);

        nav.drillDown(Dimension.TIME);
        nav.rollUp(Dimension.TIME);

        assertThat(executor.requests).extracting(AggregationRequest::mode)
                .containsExactly(AggregationMode.CUBE, AggregationMode.CUBE);
        assertThat(executor.requests.get(0).dimensionColumns()).containsExactly("s.RegionName", "d.Month", "p.ProductGroupName");
    }

    @Test
    void failedExecutionLeavesThePositionUnchanged() {
        NavigationController nav = controller(null);
        executor.failure = new AggregationExecutionException("warehouse unreachable");

        assertThatThrownBy(() -> nav.drillDown(Dimension.GEOGRAPHY))
                .isInstanceOf(AggregationExecutionException.class);
        assertThat(nav.position().toString()).isEqualTo("[Region, Quarter, Group]");

        executor.failure = null;
        nav.drillDown(Dimension.GEOGRAPHY);
        assertThat(nav.position().get(Dimension.GEOGRAPHY).levelName()).isEqualTo("City");
    }

    @Test
    void sessionFilterIsAppliedUnlessOverridden() {
        EqualityFilter year = builder.filter("Year", 2019);
        NavigationController nav = controller(year);

        nav.drillDown(Dimension.PRODUCT);
        assertThat(executor.requests.get(0).filter()).isEqualTo(year);

        EqualityFilter north = builder.filter("Region", "North");
        AggregationResult cube = nav.runCube(north);
        assertThat(cube.request().filter()).isEqualTo(north);

        nav.runCube(null);
        assertThat(executor.requests.get(2).filter()).isEqualTo(year);
    }

    @Test
    void cubeRunDoesNotMove() {
        NavigationController nav = controller(null);

        AggregationResult result = nav.runCube(null);

        assertThat(result.groups().keySet()).containsExactly(CubeLevel.DETAIL, CubeLevel.GRAND_TOTAL);
        assertThat(result.crossTab()).isNull();
        assertThat(nav.position().toString()).isEqualTo("[Region, Quarter, Group]");
    }

    @Test
    void groupingSetsRunCarriesTheCrossTab() {
        NavigationController nav = controller(null);

        AggregationResult result = nav.runGroupingSets(null, Measure.REVENUE);

        assertThat(executor.requests.get(0).mode()).isEqualTo(AggregationMode.GROUPING_SETS);
        assertThat(result.groups().keySet()).containsExactly(GroupingSet.values());
        assertThat(result.crossTab().measure()).isEqualTo(Measure.REVENUE);
        assertThat(result.crossTab().grandTotal()).isEqualByComparingTo("100.00");
    }

    private NavigationController controller(EqualityFilter filter) {
        return new NavigationController(catalog, builder, executor, new ResultClassifier(),
                new CrossTabFormatter(new OlapProperties()), new NavigationState(catalog, 2, 2, 1), filter);
    }

    /**
     * Answers cube requests with one detail row and a grand total, grouping-sets requests with a reconciling
     * two-by-two sample.
     */
    private static final class RecordingExecutor implements AggregationExecutor {

        final List<AggregationRequest> requests = new ArrayList<>();
        RuntimeException failure;

        @Override
        public List<AggregateRow> execute(AggregationRequest request) {
            requests.add(request);
            if (failure != null) {
                throw failure;
            }
            if (request.mode() == AggregationMode.GROUPING_SETS) {
                return CrossTabFormatterTest.sales();
            }
            return List.of(
                    row(request.level(Dimension.GEOGRAPHY).name() + "-1",
                            request.level(Dimension.TIME).name() + "-1",
                            request.level(Dimension.PRODUCT).name() + "-1", "000", 3, "30.00", 2),
                    row(null, null, null, "111", 3, "30.00", 2));
        }

        List<String> lastLevels() {
            return requests.get(requests.size() - 1).levels().stream().map(HierarchyLevel::name).toList();
        }
    }
}
