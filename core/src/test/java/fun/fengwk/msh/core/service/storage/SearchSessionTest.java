package fun.fengwk.msh.core.service.storage;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * @author fengwk
 */
class SearchSessionTest {

    @Test
    void shouldSanitizeQuery() {
        assertThat(SearchSession.sanitizeQuery("  Hello, World!! ")).isEqualTo("hello_world");
        assertThat(SearchSession.sanitizeQuery("C++ & Java")).isEqualTo("c_java");
        assertThat(SearchSession.sanitizeQuery("???")).isEqualTo("query");
        assertThat(SearchSession.sanitizeQuery(null)).isEqualTo("query");
        assertThat(SearchSession.sanitizeQuery("a".repeat(80))).hasSize(SearchSession.MAX_QUERY_LENGTH);
        assertThat(SearchSession.sanitizeQuery("a".repeat(49) + " b")).isEqualTo("a".repeat(49));
    }

    @Test
    void shouldLayOutDirectories() {
        DirectoryProperties directories = new DirectoryProperties();
        directories.setBase("/tmp/msh");

        SearchSession session = SearchSession.create("java", LocalDateTime.of(2024, 1, 2, 3, 4, 5), directories);

        assertThat(session.getRoot()).isEqualTo(Path.of("/tmp/msh/20240102_030405_java"));
        assertThat(session.getSearchResultsDir()).isEqualTo(session.getRoot().resolve("Search_Results"));
        assertThat(session.artifactDir(ArtifactKind.PDF))
            .isEqualTo(session.getRoot().resolve("Scraped_Results").resolve("pdfs"));
        assertThat(session.getQuery()).isEqualTo("java");
    }

}
