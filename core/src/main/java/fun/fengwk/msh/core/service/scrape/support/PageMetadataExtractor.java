package fun.fengwk.msh.core.service.scrape.support;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Reads title, description and resource links from a rendered page.
 *
 * @author fengwk
 */
public final class PageMetadataExtractor {

    private static final String NO_TITLE = "No title found";

    private static final String NO_DESCRIPTION = "No description found";

    private PageMetadataExtractor() {
    }

    public static String title(Document document) {
        String title = document.title();
        return StringUtils.hasText(title) ? title.trim() : NO_TITLE;
    }

    /**
     * Meta description, then og:description, then the first paragraph of a reasonable length.
     */
    public static String description(Document document) {
        Element meta = document.selectFirst("meta[name=description]");
        if (meta != null && StringUtils.hasText(meta.attr("content"))) {
            return meta.attr("content").trim();
        }
        Element ogMeta = document.selectFirst("meta[property=og:description]");
        if (ogMeta != null && StringUtils.hasText(ogMeta.attr("content"))) {
            return ogMeta.attr("content").trim();
        }
        Element paragraph = document.selectFirst("p");
        if (paragraph != null) {
            String text = paragraph.text().trim();
            if (text.length() > 50 && text.length() < 300) {
                return text;
            }
        }
        return NO_DESCRIPTION;
    }

    /**
     * Absolute outgoing links, fragments and javascript links excluded.
     */
    public static List<String> links(Document document) {
        Set<String> links = new LinkedHashSet<>();
        for (Element anchor : document.select("a[href]")) {
            String href = anchor.attr("href").trim();
            if (href.isEmpty() || href.startsWith("#") || href.toLowerCase(Locale.ROOT).startsWith("javascript:")) {
                continue;
            }
            String absolute = anchor.absUrl("href");
            if (isHttp(absolute)) {
                links.add(absolute);
            }
        }
        return new ArrayList<>(links);
    }

    public static List<String> imageSources(Document document, int limit) {
        Set<String> sources = new LinkedHashSet<>();
        for (Element image : document.select("img[src]")) {
            if (sources.size() >= limit) {
                break;
            }
            String absolute = image.absUrl("src");
            if (isHttp(absolute)) {
                sources.add(absolute);
            }
        }
        return new ArrayList<>(sources);
    }

    public static List<String> pdfLinks(Document document, int limit) {
        List<String> pdfs = new ArrayList<>();
        for (String link : links(document)) {
            if (pdfs.size() >= limit) {
                break;
            }
            if (ScrapeMediaUtils.hasPdfExtension(link)) {
                pdfs.add(link);
            }
        }
        return pdfs;
    }

    private static boolean isHttp(String url) {
        String lower = url == null ? "" : url.toLowerCase(Locale.ROOT);
        return lower.startsWith("http://") || lower.startsWith("https://");
    }

}
