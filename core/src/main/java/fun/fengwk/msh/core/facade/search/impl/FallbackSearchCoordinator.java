package fun.fengwk.msh.core.facade.search.impl;

import fun.fengwk.msh.core.configuration.ConfigurationException;
import fun.fengwk.msh.core.facade.search.SearchFacade;
import fun.fengwk.msh.core.facade.search.SearchProperties;
import fun.fengwk.msh.core.facade.search.SearchProvider;
import fun.fengwk.msh.core.facade.search.SearchProviderException;
import fun.fengwk.msh.core.facade.search.model.AggregatedSearchResult;
import fun.fengwk.msh.core.facade.search.model.CandidateUrl;
import fun.fengwk.msh.core.facade.search.model.ProviderReport;
import fun.fengwk.msh.core.facade.search.model.ProviderStatus;
import fun.fengwk.msh.core.resilience.RetryExecutor;
import fun.fengwk.msh.core.resilience.RetryPolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Consults providers one by one in the configured order, retrying transient failures.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class FallbackSearchCoordinator implements SearchFacade {

    private final List<SearchProvider> orderedProviders;
    private final RetryPolicy retryPolicy;
    private final RetryExecutor retryExecutor;

    public FallbackSearchCoordinator(List<SearchProvider> providers,
                                     SearchProperties searchProperties,
                                     RetryExecutor retryExecutor) {
        searchProperties.validate();
        this.orderedProviders = resolveOrder(providers, searchProperties.getFallbackOrder());
        this.retryPolicy = searchProperties.toRetryPolicy();
        this.retryExecutor = retryExecutor;
    }

    @Override
    public AggregatedSearchResult search(String query, int maxResults) {
        if (!StringUtils.hasText(query)) {
            throw new IllegalArgumentException("query must not be blank");
        }
        if (maxResults <= 0) {
            throw new IllegalArgumentException("maxResults must be > 0");
        }

        int enough = maxResults * 2;
        List<CandidateUrl> candidates = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        List<ProviderReport> reports = new ArrayList<>();

        for (SearchProvider provider : orderedProviders) {
            if (candidates.size() >= enough) {
                reports.add(ProviderReport.builder()
                    .provider(provider.name())
                    .status(ProviderStatus.NOT_CONSULTED)
                    .build());
                continue;
            }

            ProviderReport report = consult(provider, query, maxResults, candidates, seen);
            reports.add(report);
        }

        if (candidates.isEmpty()) {
            log.warn("no provider produced results, query={}, reports={}", query, reports);
        } else {
            log.info("search aggregated, query={}, candidates={}", query, candidates.size());
        }
        return AggregatedSearchResult.builder()
            .query(query)
            .candidates(candidates)
            .providerReports(reports)
            .build();
    }

    private ProviderReport consult(SearchProvider provider, String query, int maxResults,
                                   List<CandidateUrl> candidates, Set<String> seen) {
        String name = provider.name();
        AtomicInteger attempts = new AtomicInteger();
        try {
            List<String> urls = retryExecutor.execute(
                "search-" + name,
                retryPolicy,
                SearchProviderException::isTransient,
                () -> {
                    attempts.incrementAndGet();
                    return provider.search(query, maxResults);
                }
            );

            int added = 0;
            List<String> limited = urls == null ? List.of() : urls.subList(0, Math.min(urls.size(), maxResults));
            for (String url : limited) {
                // first provider to contribute a url keeps its provenance
                if (url != null && seen.add(url)) {
                    candidates.add(CandidateUrl.builder().url(url).provider(name).build());
                    added++;
                }
            }
            log.info("provider consulted, provider={}, attempts={}, returned={}, added={}",
                name, attempts.get(), limited.size(), added);
            return ProviderReport.builder()
                .provider(name)
                .status(ProviderStatus.SUCCEEDED)
                .attempts(attempts.get())
                .resultCount(added)
                .build();
        } catch (Exception ex) {
            boolean permanent = ex instanceof SearchProviderException spe && !spe.isTransientFailure();
            ProviderStatus status = permanent ? ProviderStatus.SKIPPED : ProviderStatus.FAILED;
            log.warn("provider failed, provider={}, status={}, attempts={}, error={}",
                name, status, attempts.get(), ex.getMessage());
            return ProviderReport.builder()
                .provider(name)
                .status(status)
                .attempts(attempts.get())
                .error(ex.getMessage())
                .build();
        }
    }

    private static List<SearchProvider> resolveOrder(List<SearchProvider> providers, List<String> fallbackOrder) {
        Map<String, SearchProvider> byName = new LinkedHashMap<>();
        for (SearchProvider provider : providers) {
            byName.put(provider.name().toLowerCase(Locale.ROOT), provider);
        }

        List<SearchProvider> ordered = new ArrayList<>();
        Set<String> used = new HashSet<>();
        for (String name : fallbackOrder) {
            String key = name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
            SearchProvider provider = byName.get(key);
            ConfigurationException.check(provider != null,
                "unknown provider in search.fallback-order: %s, known=%s", name, byName.keySet());
            ConfigurationException.check(used.add(key), "duplicate provider in search.fallback-order: %s", name);
            ordered.add(provider);
        }
        return List.copyOf(ordered);
    }

}
