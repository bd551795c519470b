package org.iceforge.runa.olap.service;

import org.iceforge.runa.olap.config.OlapProperties;
import org.iceforge.runa.olap.model.Dimension;
import org.iceforge.runa.olap.model.EqualityFilter;
import org.iceforge.runa.olap.model.HierarchyLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Keeps the live navigation sessions. Sessions are held in memory only and vanish on restart. A session left unused
 * for longer than {@code runa.olap.session-idle-timeout} is dropped the next time sessions are opened or looked up.
 */
@Service
public class OlapSessionService {

    private static final Logger log = LoggerFactory.getLogger(OlapSessionService.class);

    public static final String DEFAULT_GEO_LEVEL = "Region";
    public static final String DEFAULT_TIME_LEVEL = "Quarter";
    public static final String DEFAULT_PRODUCT_LEVEL = "Group";

    private final HierarchyCatalog catalog;
    private final AggregationRequestBuilder requestBuilder;
    private final AggregationExecutor executor;
    private final ResultClassifier classifier;
    private final CrossTabFormatter crossTabFormatter;

    private final Duration idleTimeout;
    private final Clock clock;

    private final Map<String, Session> sessions = new ConcurrentHashMap<>();

    @Autowired
    public OlapSessionService(HierarchyCatalog catalog,
                              AggregationRequestBuilder requestBuilder,
                              AggregationExecutor executor,
                              ResultClassifier classifier,
                              CrossTabFormatter crossTabFormatter,
                              OlapProperties props) {
        this(catalog, requestBuilder, executor, classifier, crossTabFormatter, props, Clock.systemUTC());
    }

    OlapSessionService(HierarchyCatalog catalog,
                       AggregationRequestBuilder requestBuilder,
                       AggregationExecutor executor,
                       ResultClassifier classifier,
                       CrossTabFormatter crossTabFormatter,
                       OlapProperties props,
                       Clock clock) {
        this.catalog = Objects.requireNonNull(catalog);
        this.requestBuilder = Objects.requireNonNull(requestBuilder);
        this.executor = Objects.requireNonNull(executor);
        this.classifier = Objects.requireNonNull(classifier);
        this.crossTabFormatter = Objects.requireNonNull(crossTabFormatter);
        this.idleTimeout = Objects.requireNonNull(props.getSessionIdleTimeout());
        this.clock = Objects.requireNonNull(clock);
    }

    /**
     * Opens a session at the given levels. {@code null} level names fall back to Region / Quarter / Group.
     *
     * @param filter optional filter applied to every request of the session
     * @return the new session id
     * @throws UnknownLevelException if a level name is not in the catalog
     */
    public String create(String geoLevel, String timeLevel, String productLevel, EqualityFilter filter) {
        List<HierarchyLevel> levels = requestBuilder.levels(
                geoLevel == null ? DEFAULT_GEO_LEVEL : geoLevel,
                timeLevel == null ? DEFAULT_TIME_LEVEL : timeLevel,
                productLevel == null ? DEFAULT_PRODUCT_LEVEL : productLevel);
        NavigationState state = new NavigationState(catalog,
                levels.get(Dimension.GEOGRAPHY.ordinal()).rank(),
                levels.get(Dimension.TIME.ordinal()).rank(),
                levels.get(Dimension.PRODUCT.ordinal()).rank());

        evictIdle();
        String id = UUID.randomUUID().toString();
        NavigationController controller =
                new NavigationController(catalog, requestBuilder, executor, classifier, crossTabFormatter, state, filter);
        sessions.put(id, new Session(controller, clock.instant()));
        log.info("Opened session {} at {}{}", id, levels.stream().map(HierarchyLevel::name).toList(),
                filter == null ? "" : " filtered on " + filter);
        return id;
    }

    /**
     * @throws SessionNotFoundException if no such session is open
     */
    public NavigationController find(String sessionId) {
        evictIdle();
        Session s = sessions.get(sessionId);
        if (s == null) {
            throw new SessionNotFoundException(sessionId);
        }
        s.lastUsed = clock.instant();
        return s.controller;
    }

    /**
     * Runs {@code work} on the session with no other call of the same session running.
     */
    public <T> T withSession(String sessionId, Function<NavigationController, T> work) {
        NavigationController c = find(sessionId);
        synchronized (c) {
            return work.apply(c);
        }
    }

    public void close(String sessionId) {
        if (sessions.remove(sessionId) == null) {
            throw new SessionNotFoundException(sessionId);
        }
        log.info("Closed session {}", sessionId);
    }

    public int openSessions() {
        return sessions.size();
    }

    private void evictIdle() {
        Instant cutoff = clock.instant().minus(idleTimeout);
        sessions.entrySet().removeIf(e -> {
            if (e.getValue().lastUsed.isBefore(cutoff)) {
                log.info("Closed session {} after {} idle", e.getKey(), idleTimeout);
                return true;
            }
            return false;
        });
    }

    private static final class Session {
        final NavigationController controller;
        volatile Instant lastUsed;

        Session(NavigationController controller, Instant lastUsed) {
            this.controller = controller;
            this.lastUsed = lastUsed;
        }
    }
}
