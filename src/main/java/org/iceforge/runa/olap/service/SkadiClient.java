package org.iceforge.runa.olap.service;

import org.iceforge.runa.olap.config.OlapProperties;
import org.iceforge.runa.olap.web.SkadiQueryRequest;
import org.iceforge.runa.olap.web.SkadiQueryResponse;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.Objects;

@Component
@ConditionalOnProperty(prefix = "runa.olap", name = "executor", havingValue = "skadi")
public class SkadiClient {

    private final WebClient webClient;
    private final OlapProperties props;

    public SkadiClient(WebClient skadiWebClient, OlapProperties props) {
        this.webClient = Objects.requireNonNull(skadiWebClient);
        this.props = Objects.requireNonNull(props);
    }

    /**
     * Submit query to Skadi.
     * If Skadi answers with the rows inline, this returns them.
     * Otherwise it extracts queryId from the answer and fetches the rows from the results endpoint.
     */
    public Mono<SkadiQueryResponse> runQuery(SkadiQueryRequest submitBody) {
        return webClient.post()
                .uri(props.getSkadi().getSubmitPath())
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .body(BodyInserters.fromValue(submitBody))
                .retrieve()
                .bodyToMono(SkadiQueryResponse.class)
                .flatMap(this::handleSubmitResponse);
    }

    private Mono<SkadiQueryResponse> handleSubmitResponse(SkadiQueryResponse r) {
        if (r.hasRows()) {
            return Mono.just(r);
        }
        if (!StringUtils.hasText(r.getQueryId())) {
            return Mono.error(new IllegalStateException("Skadi submit returned neither rows nor a queryId."));
        }
        String path = props.getSkadi().getResultPathTemplate().replace("{queryId}", r.getQueryId());
        return fetchResults(path);
    }

    private Mono<SkadiQueryResponse> fetchResults(String uriPath) {
        return webClient.get()
                .uri(uriPath)
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .bodyToMono(SkadiQueryResponse.class)
                .flatMap(r -> r.hasRows()
                        ? Mono.just(r)
                        : Mono.error(new IllegalStateException("Skadi results for query " + r.getQueryId() + " carried no rows.")));
    }
}
