package fun.fengwk.msh.core.service.storage;

import lombok.Getter;

/**
 * Scraped artifact types and their sub directory under {@code Scraped_Results}.
 *
 * @author fengwk
 */
@Getter
public enum ArtifactKind {

    HTML("html", ".html", "text/html"),
    TEXT("text", ".txt", "text/plain"),
    IMAGE("images", ".img", "application/octet-stream"),
    PDF("pdfs", ".pdf", "application/pdf"),
    FORMULA("formulas", ".png", "image/png"),
    METADATA("metadata", ".json", "application/json");

    private final String directory;
    private final String defaultExtension;
    private final String defaultContentType;

    ArtifactKind(String directory, String defaultExtension, String defaultContentType) {
        this.directory = directory;
        this.defaultExtension = defaultExtension;
        this.defaultContentType = defaultContentType;
    }

}
