package org.iceforge.runa.olap.service;

import org.iceforge.runa.olap.model.AggregateRow;
import org.iceforge.runa.olap.model.AggregationLevel;
import org.iceforge.runa.olap.model.AggregationRequest;
import org.iceforge.runa.olap.model.AggregationResult;
import org.iceforge.runa.olap.model.ClassifiedRow;
import org.iceforge.runa.olap.model.CrossTab;
import org.iceforge.runa.olap.model.Dimension;
import org.iceforge.runa.olap.model.EqualityFilter;
import org.iceforge.runa.olap.model.Measure;
import org.iceforge.runa.olap.model.NavigationResult;
import org.iceforge.runa.olap.model.Position;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Drives one analysis session over the three hierarchies.
 *
 * <p>Each call issues at most one aggregation request and waits for it. A move is tried on a copy of the state and
 * committed only once its request came back, so a boundary hit or an engine failure leaves the position as it was.
 * Instances are owned by a single session and are not thread-safe.
 */
public class NavigationController {

    private static final Logger log = LoggerFactory.getLogger(NavigationController.class);

    private final HierarchyCatalog catalog;
    private final AggregationRequestBuilder requestBuilder;
    private final AggregationExecutor executor;
    private final ResultClassifier classifier;
    private final CrossTabFormatter crossTabFormatter;
    private final NavigationState state;
    private final EqualityFilter sessionFilter;

    public NavigationController(HierarchyCatalog catalog,
                                AggregationRequestBuilder requestBuilder,
                                AggregationExecutor executor,
                                ResultClassifier classifier,
                                CrossTabFormatter crossTabFormatter,
                                NavigationState initialState,
                                EqualityFilter sessionFilter) {
        this.catalog = Objects.requireNonNull(catalog);
        this.requestBuilder = Objects.requireNonNull(requestBuilder);
        this.executor = Objects.requireNonNull(executor);
        this.classifier = Objects.requireNonNull(classifier);
        this.crossTabFormatter = Objects.requireNonNull(crossTabFormatter);
        this.state = Objects.requireNonNull(initialState);
        this.sessionFilter = sessionFilter;
    }

    public Position position() {
        List<Position.DimensionPosition> dims = new ArrayList<>(3);
        for (Dimension d : Dimension.values()) {
            dims.add(new Position.DimensionPosition(d, state.levelName(d), state.rank(d), catalog.maxRank(d)));
        }
        return new Position(dims);
    }

    public EqualityFilter sessionFilter() {
        return sessionFilter;
    }

    public boolean canDrillDown(Dimension dimension) {
        return state.canDrillDown(dimension);
    }

    public boolean canRollUp(Dimension dimension) {
        return state.canRollUp(dimension);
    }

    /**
     * @throws NavigationBoundaryException at the most detailed level; no request is issued
     * @throws AggregationExecutionException if the engine fails; the position is unchanged
     */
    public NavigationResult drillDown(Dimension dimension) {
        return move(dimension, "Drill down", s -> s.drillDown(dimension));
    }

    /**
     * @throws NavigationBoundaryException at the most aggregated level; no request is issued
     * @throws AggregationExecutionException if the engine fails; the position is unchanged
     */
    public NavigationResult rollUp(Dimension dimension) {
        return move(dimension, "Roll up", s -> s.rollUp(dimension));
    }

    /**
     * Detail rows at the current position, without moving.
     */
    public NavigationResult current() {
        AggregationResult result = aggregate(requestBuilder.cube(state, sessionFilter));
        return new NavigationResult(position(), result.detailRows());
    }

    private NavigationResult move(Dimension dimension, String what, Consumer<NavigationState> transition) {
        Objects.requireNonNull(dimension);
        NavigationState moved = state.copy();
        try {
            transition.accept(moved);
        } catch (NavigationBoundaryException e) {
            log.warn("{} refused: {}", what, e.getMessage());
            throw e;
        }
        AggregationResult result = aggregate(requestBuilder.cube(moved, sessionFilter));

        String from = state.levelName(dimension);
        state.commit(moved);
        log.info("{} {}: {} -> {}", what, dimension.key(), from, state.levelName(dimension));
        return new NavigationResult(position(), result.detailRows());
    }

    /**
     * All eight cube levels at the current position.
     *
     * @param filter overrides the session filter when not {@code null}
     */
    public AggregationResult runCube(EqualityFilter filter) {
        return aggregate(requestBuilder.cube(state, filter != null ? filter : sessionFilter));
    }

    /**
     * The five cross-tab grouping sets at the current position, plus the cross-tab of the given measure.
     *
     * @param filter overrides the session filter when not {@code null}
     * @throws ReconciliationException if the margins do not add up
     */
    public AggregationResult runGroupingSets(EqualityFilter filter, Measure measure) {
        AggregationRequest request = requestBuilder.groupingSets(state, filter != null ? filter : sessionFilter);
        List<ClassifiedRow> rows = classifier.classify(request, executor.execute(request));
        CrossTab crossTab = crossTabFormatter.format(rows, measure);
        return new AggregationResult(request, classifier.group(request.mode(), rows), crossTab);
    }

    private AggregationResult aggregate(AggregationRequest request) {
        List<AggregateRow> rows = executor.execute(request);
        List<ClassifiedRow> classified = classifier.classify(request, rows);
        Map<AggregationLevel, List<ClassifiedRow>> groups = classifier.group(request.mode(), classified);
        if (log.isDebugEnabled()) {
            groups.forEach((level, r) -> log.debug("  {}: {} records", level.label(), r.size()));
        }
        return new AggregationResult(request, groups, null);
    }
}
