package fun.fengwk.msh.core.service.scrape.support;

import org.springframework.util.StringUtils;

import java.util.Locale;
import java.util.Map;

/**
 * Shared media detection helper for scrape runtime.
 *
 * @author fengwk
 */
public final class ScrapeMediaUtils {

    private ScrapeMediaUtils() {
    }

    public static String resolveMime(Map<String, String> headers) {
        String contentType = findHeader(headers, "content-type");
        if (!StringUtils.hasText(contentType)) {
            return "application/octet-stream";
        }

        String normalized = contentType.trim().toLowerCase(Locale.ROOT);
        int semicolonIndex = normalized.indexOf(';');
        if (semicolonIndex >= 0) {
            normalized = normalized.substring(0, semicolonIndex).trim();
        }
        return StringUtils.hasText(normalized) ? normalized : "application/octet-stream";
    }

    public static String findHeader(Map<String, String> headers, String name) {
        if (headers == null || headers.isEmpty() || !StringUtils.hasText(name)) {
            return "";
        }

        for (Map.Entry<String, String> entry : headers.entrySet()) {
            if (name.equalsIgnoreCase(entry.getKey())) {
                return entry.getValue() == null ? "" : entry.getValue();
            }
        }
        return "";
    }

    public static boolean isPdf(String mime) {
        return "application/pdf".equals(mime) || "application/x-pdf".equals(mime);
    }

    public static boolean hasPdfExtension(String url) {
        return stripQueryAndFragment(url).endsWith(".pdf");
    }

    /**
     * File extension for an image mime type, falling back to the url suffix.
     */
    public static String imageExtension(String mime, String url) {
        switch (mime == null ? "" : mime) {
            case "image/png":
                return ".png";
            case "image/jpeg":
            case "image/jpg":
                return ".jpg";
            case "image/gif":
                return ".gif";
            case "image/webp":
                return ".webp";
            case "image/svg+xml":
                return ".svg";
            case "image/bmp":
                return ".bmp";
            case "image/x-icon":
            case "image/vnd.microsoft.icon":
                return ".ico";
            default:
                break;
        }
        String path = stripQueryAndFragment(url);
        int slashIndex = path.lastIndexOf('/');
        int dotIndex = path.lastIndexOf('.');
        if (dotIndex > slashIndex && path.length() - dotIndex <= 5) {
            return path.substring(dotIndex);
        }
        return ".img";
    }

    private static String stripQueryAndFragment(String url) {
        if (!StringUtils.hasText(url)) {
            return "";
        }
        String lowerUrl = url.toLowerCase(Locale.ROOT);
        int fragmentIndex = lowerUrl.indexOf('#');
        if (fragmentIndex >= 0) {
            lowerUrl = lowerUrl.substring(0, fragmentIndex);
        }
        int queryIndex = lowerUrl.indexOf('?');
        if (queryIndex >= 0) {
            lowerUrl = lowerUrl.substring(0, queryIndex);
        }
        return lowerUrl;
    }

}
