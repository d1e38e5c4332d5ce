package fun.fengwk.msh.core.service.scrape.model;

import lombok.Getter;

import java.util.Locale;

/**
 * Extraction depth presets, each overridable through {@code msh.scraping.modes.<value>}.
 *
 * @author fengwk
 */
@Getter
public enum ScrapeMode {

    STANDARD("standard", ScrapeToggles.builder()
        .saveHtml(true)
        .saveText(true)
        .saveImages(true)
        .saveFormulas(true)
        .savePdfs(true)
        .followPdfLinks(false)
        .maxImages(20)
        .maxPdfLinks(0)
        .build()),
    DEEP("deep", ScrapeToggles.builder()
        .saveHtml(true)
        .saveText(true)
        .saveImages(true)
        .saveFormulas(true)
        .savePdfs(true)
        .followPdfLinks(true)
        .maxImages(50)
        .maxPdfLinks(5)
        .build()),
    TEXT_ONLY("text_only", ScrapeToggles.builder()
        .saveHtml(false)
        .saveText(true)
        .saveImages(false)
        .saveFormulas(false)
        .savePdfs(false)
        .followPdfLinks(false)
        .maxImages(0)
        .maxPdfLinks(0)
        .build());

    private final String value;
    private final ScrapeToggles defaults;

    ScrapeMode(String value, ScrapeToggles defaults) {
        this.value = value;
        this.defaults = defaults;
    }

    public static ScrapeMode fromValue(String value) {
        if (value == null || value.isBlank()) {
            return STANDARD;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (ScrapeMode mode : values()) {
            if (mode.value.equals(normalized)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("unsupported scrape mode: " + value);
    }

}
