package fun.fengwk.msh.core.service.validation;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Pure predicate deciding which candidate urls may be fetched. First failing rule wins:
 * allow-list, block-list, blocked extension, embedded credentials.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class UrlAdmissionFilter {

    private final List<String> allowedDomains;
    private final List<String> blockedDomains;
    private final List<String> blockedExtensions;
    private final boolean allowAuthRequired;

    public UrlAdmissionFilter(UrlValidationProperties properties) {
        this.allowedDomains = normalizeDomains(properties.getAllowedDomains());
        this.blockedDomains = normalizeDomains(properties.getBlockedDomains());
        this.blockedExtensions = normalizeExtensions(properties.getBlockedExtensions());
        this.allowAuthRequired = properties.isAllowAuthRequired();
    }

    public boolean isAccepted(String url) {
        if (!StringUtils.hasText(url)) {
            log.warn("url rejected, reason=blank");
            return false;
        }

        URI uri;
        try {
            uri = new URI(url.trim());
        } catch (URISyntaxException ex) {
            log.warn("url rejected, reason=malformed, url={}, error={}", url, ex.getMessage());
            return false;
        }
        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        if (!"http".equals(scheme) && !"https".equals(scheme)) {
            log.warn("url rejected, reason=unsupported scheme, url={}", url);
            return false;
        }
        String host = uri.getHost();
        if (!StringUtils.hasText(host)) {
            log.warn("url rejected, reason=missing host, url={}", url);
            return false;
        }
        host = host.toLowerCase(Locale.ROOT);

        if (!allowedDomains.isEmpty() && !matchesAny(host, allowedDomains)) {
            log.warn("url rejected, reason=not in allowed domains, url={}", url);
            return false;
        }
        if (matchesAny(host, blockedDomains)) {
            log.warn("url rejected, reason=blocked domain, url={}", url);
            return false;
        }
        String path = uri.getPath() == null ? "" : uri.getPath().toLowerCase(Locale.ROOT);
        for (String extension : blockedExtensions) {
            if (path.endsWith(extension)) {
                log.warn("url rejected, reason=blocked extension, url={}, extension={}", url, extension);
                return false;
            }
        }
        if (!allowAuthRequired && uri.getRawUserInfo() != null) {
            log.warn("url rejected, reason=embedded credentials, host={}", host);
            return false;
        }
        return true;
    }

    /**
     * Accepted urls in input order.
     */
    public List<String> validateMany(List<String> urls) {
        if (urls == null || urls.isEmpty()) {
            return List.of();
        }
        List<String> accepted = new ArrayList<>(urls.size());
        for (String url : urls) {
            if (isAccepted(url)) {
                accepted.add(url);
            }
        }
        log.info("urls validated, input={}, accepted={}", urls.size(), accepted.size());
        return accepted;
    }

    static boolean matchesDomain(String host, String pattern) {
        if (pattern.startsWith("*.")) {
            return host.endsWith(pattern.substring(1));
        }
        return host.equals(pattern);
    }

    private static boolean matchesAny(String host, List<String> patterns) {
        for (String pattern : patterns) {
            if (matchesDomain(host, pattern)) {
                return true;
            }
        }
        return false;
    }

    private static List<String> normalizeDomains(List<String> domains) {
        List<String> normalized = new ArrayList<>();
        if (domains != null) {
            for (String domain : domains) {
                if (StringUtils.hasText(domain)) {
                    normalized.add(domain.trim().toLowerCase(Locale.ROOT));
                }
            }
        }
        return List.copyOf(normalized);
    }

    private static List<String> normalizeExtensions(List<String> extensions) {
        List<String> normalized = new ArrayList<>();
        if (extensions != null) {
            for (String extension : extensions) {
                if (!StringUtils.hasText(extension)) {
                    continue;
                }
                String value = extension.trim().toLowerCase(Locale.ROOT);
                normalized.add(value.startsWith(".") ? value : "." + value);
            }
        }
        return List.copyOf(normalized);
    }

}
