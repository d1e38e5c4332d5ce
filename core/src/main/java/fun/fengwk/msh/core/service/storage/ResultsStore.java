package fun.fengwk.msh.core.service.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;
import java.util.zip.CRC32;

/**
 * Persists one session's artifacts. Every filesystem operation goes through a circuit breaker
 * scoped to this store; while it is open writes return a not-saved result without touching
 * the disk.
 *
 * @author fengwk
 */
@Slf4j
public class ResultsStore {

    static final String RESULTS_FILE_PREFIX = "query_results_";

    static final String RESULTS_FILE_SUFFIX = ".json";

    static final DateTimeFormatter RESULTS_TIME_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss_SSS");

    static final int MAX_FILE_NAME_LENGTH = 120;

    private static final int TRUNCATED_PREFIX_LENGTH = 111;

    private final SearchSession session;
    private final ArtifactWriter writer;
    private final CircuitBreaker circuitBreaker;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Object resultsFileLock = new Object();

    ResultsStore(SearchSession session, ArtifactWriter writer, CircuitBreaker circuitBreaker,
                 ObjectMapper objectMapper, Clock clock) {
        this.session = session;
        this.writer = writer;
        this.circuitBreaker = circuitBreaker;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public SearchSession getSession() {
        return session;
    }

    public CircuitBreaker.State getCircuitState() {
        return circuitBreaker.getState();
    }

    /**
     * Create the session directory tree. Safe to call repeatedly.
     *
     * @throws IllegalStateException when a directory cannot be created
     */
    public void ensureDirectoriesReady() {
        try {
            for (Path dir : allDirectories()) {
                Files.createDirectories(dir);
            }
        } catch (IOException ex) {
            throw new IllegalStateException("failed to create session directories: " + ex.getMessage(), ex);
        }
    }

    /**
     * Check every directory accepts a write, not only that it exists.
     */
    public boolean isReady() {
        if (circuitBreaker.getState() == CircuitBreaker.State.OPEN) {
            return false;
        }
        for (Path dir : allDirectories()) {
            Path probe = dir.resolve(".probe-" + UUID.randomUUID());
            try {
                Files.write(probe, new byte[0], StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
                Files.delete(probe);
            } catch (IOException ex) {
                log.warn("storage probe failed, dir={}, error={}", dir, ex.getMessage());
                return false;
            }
        }
        return true;
    }

    /**
     * Persist a url list as {@code Search_Results/query_results_{timestamp}.json}.
     *
     * @throws IllegalArgumentException when an entry is not an absolute http(s) url
     */
    public SaveResult saveSearchResults(List<String> urls, Map<String, Object> metadata) {
        if (urls == null) {
            throw new IllegalArgumentException("urls must not be null");
        }
        for (String url : urls) {
            if (!isHttpUrl(url)) {
                throw new IllegalArgumentException("invalid url: " + url);
            }
        }

        Instant now = clock.instant();
        SearchResultsRecord record = SearchResultsRecord.builder()
            .query(session.getQuery())
            .urls(List.copyOf(urls))
            .timestamp(now.toString())
            .metadata(metadata == null ? null : new LinkedHashMap<>(metadata))
            .build();

        byte[] content;
        try {
            content = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(record);
        } catch (IOException ex) {
            throw new IllegalArgumentException("search results are not serializable: " + ex.getMessage(), ex);
        }

        return guarded(ArtifactKind.METADATA, () -> {
            synchronized (resultsFileLock) {
                Path target = nextResultsFile(LocalDateTime.ofInstant(now, clock.getZone()));
                writer.write(target, content);
                log.info("search results saved, file={}, urls={}", target, urls.size());
                return SaveResult.saved(ArtifactKind.METADATA, target, null);
            }
        });
    }

    public SaveResult saveScrapedContent(String url, ArtifactKind kind, byte[] content, Map<String, Object> metadata) {
        return saveScrapedContent(ScrapedArtifact.builder()
            .url(url)
            .kind(kind)
            .content(content)
            .metadata(metadata)
            .build());
    }

    /**
     * Persist one artifact plus its {@code _metadata.json} sidecar. Metadata artifacts are
     * their own record and get no sidecar.
     */
    public SaveResult saveScrapedContent(ScrapedArtifact artifact) {
        if (artifact == null || artifact.getKind() == null || artifact.getContent() == null) {
            throw new IllegalArgumentException("artifact kind and content must not be null");
        }
        if (!StringUtils.hasText(artifact.getUrl())) {
            throw new IllegalArgumentException("artifact url must not be blank");
        }

        ArtifactKind kind = artifact.getKind();
        String baseName = safeFileName(artifact.getUrl())
            + (StringUtils.hasText(artifact.getVariant()) ? "_" + safeFileName(artifact.getVariant()) : "");
        String extension = normalizeExtension(artifact.getExtension(), kind);
        String contentType = StringUtils.hasText(artifact.getContentType())
            ? artifact.getContentType()
            : kind.getDefaultContentType();

        return guarded(kind, () -> {
            Path target = session.artifactDir(kind).resolve(baseName + extension);
            writer.write(target, artifact.getContent());

            Path metadataPath = null;
            if (kind != ArtifactKind.METADATA) {
                Map<String, Object> sidecar = new LinkedHashMap<>();
                sidecar.put("url", artifact.getUrl());
                sidecar.put("timestamp", clock.instant().toString());
                sidecar.put("contentType", contentType);
                sidecar.put("kind", kind.name().toLowerCase(Locale.ROOT));
                sidecar.put("file", session.getRoot().relativize(target).toString());
                sidecar.put("size", artifact.getContent().length);
                if (artifact.getMetadata() != null && !artifact.getMetadata().isEmpty()) {
                    sidecar.put("metadata", artifact.getMetadata());
                }
                metadataPath = session.artifactDir(ArtifactKind.METADATA)
                    .resolve(baseName + "_" + extension.substring(1) + "_metadata.json");
                writer.write(metadataPath, objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(sidecar));
            }
            log.debug("artifact saved, url={}, kind={}, file={}", artifact.getUrl(), kind, target);
            return SaveResult.saved(kind, target, metadataPath);
        });
    }

    /**
     * Most recently created results file of this session.
     *
     * @return the record, or empty when none exists, the latest file is malformed or storage is
     * unavailable
     */
    public Optional<SearchResultsRecord> loadLatestResults() {
        Path dir = session.getSearchResultsDir();
        if (!circuitBreaker.tryAcquirePermission()) {
            log.warn("storage unavailable, skip loading results, session={}", session.getRoot());
            return Optional.empty();
        }
        long start = System.nanoTime();
        try {
            Optional<SearchResultsRecord> record = readLatest(dir);
            circuitBreaker.onSuccess(System.nanoTime() - start, TimeUnit.NANOSECONDS);
            return record;
        } catch (IOException ex) {
            circuitBreaker.onError(System.nanoTime() - start, TimeUnit.NANOSECONDS, ex);
            throw new IllegalStateException("failed to load latest results: " + ex.getMessage(), ex);
        }
    }

    private Optional<SearchResultsRecord> readLatest(Path dir) throws IOException {
        if (!Files.isDirectory(dir)) {
            return Optional.empty();
        }
        List<ResultsFile> files = new ArrayList<>();
        try (Stream<Path> stream = Files.list(dir)) {
            for (Path path : (Iterable<Path>) stream::iterator) {
                String name = path.getFileName().toString();
                if (name.startsWith(RESULTS_FILE_PREFIX) && name.endsWith(RESULTS_FILE_SUFFIX) && Files.isRegularFile(path)) {
                    files.add(new ResultsFile(path, createdAt(path)));
                }
            }
        }
        Optional<ResultsFile> latest = files.stream()
            .max(Comparator.comparing(ResultsFile::createdAt)
                .thenComparing(file -> file.path().getFileName().toString()));
        if (latest.isEmpty()) {
            return Optional.empty();
        }
        Path path = latest.get().path();
        try {
            return Optional.of(objectMapper.readValue(path.toFile(), SearchResultsRecord.class));
        } catch (JsonProcessingException ex) {
            // a malformed record is not a storage failure
            log.warn("results file unreadable, file={}, error={}", path, ex.getOriginalMessage());
            return Optional.empty();
        }
    }

    private FileTime createdAt(Path path) throws IOException {
        BasicFileAttributes attributes = Files.readAttributes(path, BasicFileAttributes.class);
        FileTime creationTime = attributes.creationTime();
        // some filesystems report the epoch when creation time is not tracked
        if (creationTime == null || creationTime.toMillis() <= 0) {
            return attributes.lastModifiedTime();
        }
        return creationTime;
    }

    private SaveResult guarded(ArtifactKind kind, GuardedWrite write) {
        if (!circuitBreaker.tryAcquirePermission()) {
            log.warn("storage unavailable, write skipped, session={}, kind={}", session.getRoot(), kind);
            return SaveResult.failed(kind, SaveFailure.STORAGE_UNAVAILABLE, "storage unavailable");
        }
        long start = System.nanoTime();
        try {
            ensureDirectoriesReady();
            SaveResult result = write.run();
            circuitBreaker.onSuccess(System.nanoTime() - start, TimeUnit.NANOSECONDS);
            return result;
        } catch (IOException | RuntimeException ex) {
            circuitBreaker.onError(System.nanoTime() - start, TimeUnit.NANOSECONDS, ex);
            log.warn("write failed, session={}, kind={}, circuitState={}, error={}",
                session.getRoot(), kind, circuitBreaker.getState(), ex.getMessage());
            return SaveResult.failed(kind, SaveFailure.IO_ERROR, ex.getMessage());
        }
    }

    private Path nextResultsFile(LocalDateTime now) {
        String stem = RESULTS_FILE_PREFIX + RESULTS_TIME_FORMAT.format(now);
        Path candidate = session.getSearchResultsDir().resolve(stem + RESULTS_FILE_SUFFIX);
        int suffix = 1;
        while (Files.exists(candidate)) {
            candidate = session.getSearchResultsDir().resolve(stem + "_" + suffix++ + RESULTS_FILE_SUFFIX);
        }
        return candidate;
    }

    private List<Path> allDirectories() {
        List<Path> dirs = new ArrayList<>();
        dirs.add(session.getRoot());
        dirs.add(session.getSearchResultsDir());
        dirs.add(session.getScrapedResultsDir());
        for (ArtifactKind kind : ArtifactKind.values()) {
            dirs.add(session.artifactDir(kind));
        }
        return dirs;
    }

    /**
     * Characters outside {@code [A-Za-z0-9_.-]} become underscores; long names are cut and
     * suffixed with a checksum of the full input so distinct urls stay distinct.
     */
    public static String safeFileName(String value) {
        String name = value.replaceAll("[^A-Za-z0-9_.-]", "_");
        if (name.length() <= MAX_FILE_NAME_LENGTH) {
            return name;
        }
        CRC32 crc32 = new CRC32();
        crc32.update(value.getBytes(StandardCharsets.UTF_8));
        return name.substring(0, TRUNCATED_PREFIX_LENGTH) + "_" + String.format("%08x", crc32.getValue());
    }

    public static boolean isHttpUrl(String url) {
        if (!StringUtils.hasText(url)) {
            return false;
        }
        try {
            URI uri = new URI(url.trim());
            String scheme = uri.getScheme();
            return ("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme))
                && StringUtils.hasText(uri.getHost());
        } catch (URISyntaxException ex) {
            return false;
        }
    }

    private static String normalizeExtension(String extension, ArtifactKind kind) {
        if (!StringUtils.hasText(extension)) {
            return kind.getDefaultExtension();
        }
        String value = extension.trim().toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9.]", "");
        value = value.startsWith(".") ? value : "." + value;
        return value.length() > 1 ? value : kind.getDefaultExtension();
    }

    @FunctionalInterface
    private interface GuardedWrite {

        SaveResult run() throws IOException;

    }

    private record ResultsFile(Path path, FileTime createdAt) {
    }

}
