package org.iceforge.runa.olap.web;

import jakarta.validation.Valid;
import org.iceforge.runa.olap.model.Dimension;
import org.iceforge.runa.olap.model.EqualityFilter;
import org.iceforge.runa.olap.model.Measure;
import org.iceforge.runa.olap.model.WarehouseStatistics;
import org.iceforge.runa.olap.service.AggregationExecutionException;
import org.iceforge.runa.olap.service.AggregationRequestBuilder;
import org.iceforge.runa.olap.service.HierarchyCatalog;
import org.iceforge.runa.olap.service.NavigationBoundaryException;
import org.iceforge.runa.olap.service.OlapSessionService;
import org.iceforge.runa.olap.service.ReconciliationException;
import org.iceforge.runa.olap.service.SessionNotFoundException;
import org.iceforge.runa.olap.service.UnknownLevelException;
import org.iceforge.runa.olap.service.WarehouseStatisticsService;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.bind.support.WebExchangeBindException;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.Objects;
import java.util.concurrent.Callable;

@RestController
@RequestMapping("/api/olap")
public class OlapController {

    private final OlapSessionService sessions;
    private final AggregationRequestBuilder requestBuilder;
    private final HierarchyCatalog catalog;

    /**
     * Only present with the JDBC executor.
     */
    private final ObjectProvider<WarehouseStatisticsService> statistics;

    public OlapController(OlapSessionService sessions,
                          AggregationRequestBuilder requestBuilder,
                          HierarchyCatalog catalog,
                          ObjectProvider<WarehouseStatisticsService> statistics) {
        this.sessions = Objects.requireNonNull(sessions);
        this.requestBuilder = Objects.requireNonNull(requestBuilder);
        this.catalog = Objects.requireNonNull(catalog);
        this.statistics = Objects.requireNonNull(statistics);
    }

    @PostMapping("/sessions")
    public Mono<ResponseEntity<OlapResponses.SessionView>> createSession(@Valid @RequestBody CreateSessionRequest req) {
        return blocking(() -> {
            String id = sessions.create(req.getGeo(), req.getTime(), req.getProduct(), filterOf(req.getFilter()));
            return ResponseEntity.status(HttpStatus.CREATED).body(OlapResponses.SessionView.of(id, sessions.find(id)));
        });
    }

    @GetMapping("/sessions/{id}")
    public Mono<OlapResponses.SessionView> position(@PathVariable String id) {
        return blocking(() -> sessions.withSession(id, s -> OlapResponses.SessionView.of(id, s)));
    }

    /**
     * Detail rows at the current position without moving.
     */
    @GetMapping("/sessions/{id}/rows")
    public Mono<OlapResponses.NavigationView> current(@PathVariable String id) {
        return blocking(() -> sessions.withSession(id, s -> OlapResponses.NavigationView.of(s.current())));
    }

    @PostMapping("/sessions/{id}/drill-down/{dimension}")
    public Mono<OlapResponses.NavigationView> drillDown(@PathVariable String id, @PathVariable String dimension) {
        return blocking(() -> {
            Dimension d = catalog.dimension(dimension);
            return sessions.withSession(id, s -> OlapResponses.NavigationView.of(s.drillDown(d)));
        });
    }

    @PostMapping("/sessions/{id}/roll-up/{dimension}")
    public Mono<OlapResponses.NavigationView> rollUp(@PathVariable String id, @PathVariable String dimension) {
        return blocking(() -> {
            Dimension d = catalog.dimension(dimension);
            return sessions.withSession(id, s -> OlapResponses.NavigationView.of(s.rollUp(d)));
        });
    }

    @PostMapping("/sessions/{id}/cube")
    public Mono<OlapResponses.AnalysisView> cube(@PathVariable String id,
                                                 @Valid @RequestBody(required = false) AnalysisRequest req) {
        return blocking(() -> {
            EqualityFilter filter = req == null ? null : filterOf(req.getFilter());
            return sessions.withSession(id, s -> OlapResponses.AnalysisView.of(s.runCube(filter)));
        });
    }

    @PostMapping("/sessions/{id}/grouping-sets")
    public Mono<OlapResponses.AnalysisView> groupingSets(@PathVariable String id,
                                                         @RequestParam(defaultValue = "QUANTITY") Measure measure,
                                                         @Valid @RequestBody(required = false) AnalysisRequest req) {
        return blocking(() -> {
            EqualityFilter filter = req == null ? null : filterOf(req.getFilter());
            return sessions.withSession(id, s -> OlapResponses.AnalysisView.of(s.runGroupingSets(filter, measure)));
        });
    }

    @DeleteMapping("/sessions/{id}")
    public Mono<ResponseEntity<Void>> close(@PathVariable String id) {
        return blocking(() -> {
            sessions.close(id);
            return ResponseEntity.noContent().<Void>build();
        });
    }

    @GetMapping("/statistics")
    public Mono<ResponseEntity<WarehouseStatistics>> statistics() {
        WarehouseStatisticsService service = statistics.getIfAvailable();
        if (service == null) {
            return Mono.just(ResponseEntity.notFound().build());
        }
        return blocking(() -> ResponseEntity.ok(service.statistics()));
    }

    private EqualityFilter filterOf(FilterRequest f) {
        return f == null ? null : requestBuilder.filter(f.getLevel(), f.getValue());
    }

    /**
     * Aggregations block on the engine; keep them off the event loop.
     */
    private static <T> Mono<T> blocking(Callable<T> work) {
        return Mono.fromCallable(work).subscribeOn(Schedulers.boundedElastic());
    }

    @ExceptionHandler(NavigationBoundaryException.class)
    public ResponseEntity<ErrorResponse> boundary(NavigationBoundaryException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT).contentType(MediaType.APPLICATION_JSON)
                .body(new ErrorResponse("BOUNDARY_" + e.getBoundary().name(), e.getMessage(), e.getDimension().key()));
    }

    @ExceptionHandler(UnknownLevelException.class)
    public ResponseEntity<ErrorResponse> unknownLevel(RuntimeException e) {
        return ResponseEntity.badRequest().contentType(MediaType.APPLICATION_JSON)
                .body(new ErrorResponse("UNKNOWN_LEVEL", e.getMessage()));
    }

    @ExceptionHandler({WebExchangeBindException.class, IllegalArgumentException.class})
    public ResponseEntity<ErrorResponse> badRequest(Exception e) {
        return ResponseEntity.badRequest().contentType(MediaType.APPLICATION_JSON)
                .body(new ErrorResponse("VALIDATION_ERROR", e.getMessage()));
    }

    @ExceptionHandler(SessionNotFoundException.class)
    public ResponseEntity<ErrorResponse> notFound(RuntimeException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).contentType(MediaType.APPLICATION_JSON)
                .body(new ErrorResponse("SESSION_NOT_FOUND", e.getMessage()));
    }

    @ExceptionHandler(ReconciliationException.class)
    public ResponseEntity<ErrorResponse> reconciliation(RuntimeException e) {
        return ResponseEntity.unprocessableEntity().contentType(MediaType.APPLICATION_JSON)
                .body(new ErrorResponse("RECONCILIATION_ERROR", e.getMessage()));
    }

    @ExceptionHandler(AggregationExecutionException.class)
    public ResponseEntity<ErrorResponse> executionError(RuntimeException e) {
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).contentType(MediaType.APPLICATION_JSON)
                .body(new ErrorResponse("EXECUTION_ERROR", e.getMessage()));
    }
}
