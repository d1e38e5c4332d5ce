package fun.fengwk.msh.core.service.storage;

import lombok.Getter;
import lombok.ToString;
import org.springframework.util.StringUtils;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * One query's root directory, {@code {base}/{yyyyMMdd_HHmmss}_{sanitizedQuery}}.
 *
 * @author fengwk
 */
@Getter
@ToString
public class SearchSession {

    static final DateTimeFormatter DIRECTORY_TIME_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    static final int MAX_QUERY_LENGTH = 50;

    private final String query;
    private final Path root;
    private final Path searchResultsDir;
    private final Path scrapedResultsDir;

    private SearchSession(String query, Path root, DirectoryProperties directories) {
        this.query = query;
        this.root = root;
        this.searchResultsDir = root.resolve(directories.getSearchResults());
        this.scrapedResultsDir = root.resolve(directories.getScrapedResults());
    }

    public static SearchSession create(String query, LocalDateTime now, DirectoryProperties directories) {
        String name = DIRECTORY_TIME_FORMAT.format(now) + "_" + sanitizeQuery(query);
        Path root = Path.of(directories.getBase()).toAbsolutePath().normalize().resolve(name);
        return new SearchSession(query, root, directories);
    }

    public static SearchSession attach(Path root, String query, DirectoryProperties directories) {
        return new SearchSession(query, root.toAbsolutePath().normalize(), directories);
    }

    public Path artifactDir(ArtifactKind kind) {
        return scrapedResultsDir.resolve(kind.getDirectory());
    }

    /**
     * Lower case, non-alphanumeric runs collapsed to a single underscore, capped in length.
     */
    public static String sanitizeQuery(String query) {
        if (!StringUtils.hasText(query)) {
            return "query";
        }
        String sanitized = query.toLowerCase(Locale.ROOT)
            .replaceAll("[^a-z0-9]+", "_")
            .replaceAll("^_+|_+$", "");
        if (sanitized.length() > MAX_QUERY_LENGTH) {
            sanitized = sanitized.substring(0, MAX_QUERY_LENGTH).replaceAll("_+$", "");
        }
        return sanitized.isEmpty() ? "query" : sanitized;
    }

}
