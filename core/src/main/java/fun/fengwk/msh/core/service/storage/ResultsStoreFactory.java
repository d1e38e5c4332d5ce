package fun.fengwk.msh.core.service.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Opens one {@link ResultsStore} per query session, each with its own circuit breaker.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class ResultsStoreFactory {

    private final DirectoryProperties directoryProperties;
    private final CircuitBreakerConfig circuitBreakerConfig;
    private final ObjectMapper objectMapper;
    private final ArtifactWriter artifactWriter;
    private final Clock clock;

    @Autowired
    public ResultsStoreFactory(DirectoryProperties directoryProperties,
                               CircuitBreakerProperties circuitBreakerProperties,
                               ObjectMapper objectMapper) {
        this(directoryProperties, circuitBreakerProperties, objectMapper, new AtomicArtifactWriter(), Clock.systemDefaultZone());
    }

    ResultsStoreFactory(DirectoryProperties directoryProperties,
                        CircuitBreakerProperties circuitBreakerProperties,
                        ObjectMapper objectMapper,
                        ArtifactWriter artifactWriter,
                        Clock clock) {
        directoryProperties.validate();
        circuitBreakerProperties.validate();
        this.directoryProperties = directoryProperties;
        this.circuitBreakerConfig = toCircuitBreakerConfig(circuitBreakerProperties);
        this.objectMapper = objectMapper;
        this.artifactWriter = artifactWriter;
        this.clock = clock;
    }

    /**
     * Start a new session for the query. Directories are created lazily on first write.
     */
    public ResultsStore open(String query) {
        SearchSession session = SearchSession.create(query, LocalDateTime.now(clock), directoryProperties);
        log.info("search session opened, query={}, root={}", query, session.getRoot());
        return newStore(session);
    }

    /**
     * Re-open an existing session directory, e.g. to load results of an earlier run.
     */
    public ResultsStore attach(Path sessionRoot) {
        if (!Files.isDirectory(sessionRoot)) {
            throw new IllegalArgumentException("session directory does not exist: " + sessionRoot);
        }
        return newStore(SearchSession.attach(sessionRoot, null, directoryProperties));
    }

    private ResultsStore newStore(SearchSession session) {
        CircuitBreaker circuitBreaker = CircuitBreaker.of(
            "results-store-" + session.getRoot().getFileName(), circuitBreakerConfig);
        circuitBreaker.getEventPublisher().onStateTransition(event -> log.warn(
            "storage circuit transition, session={}, transition={}",
            session.getRoot(),
            event.getStateTransition()
        ));
        return new ResultsStore(session, artifactWriter, circuitBreaker, objectMapper, clock);
    }

    /**
     * A count window of failMax calls at a 100% threshold opens only after failMax
     * consecutive failures.
     */
    static CircuitBreakerConfig toCircuitBreakerConfig(CircuitBreakerProperties properties) {
        return CircuitBreakerConfig.custom()
            .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
            .slidingWindowSize(properties.getFailMax())
            .minimumNumberOfCalls(properties.getFailMax())
            .failureRateThreshold(100f)
            .permittedNumberOfCallsInHalfOpenState(1)
            .waitDurationInOpenState(Duration.ofMillis(properties.getResetTimeoutMs()))
            .recordException(ex -> true)
            .build();
    }

}
