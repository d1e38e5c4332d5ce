package fun.fengwk.msh.core.facade.search.model;

import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Candidates collected across providers, in encounter order.
 *
 * @author fengwk
 */
@Data
@Builder
public class AggregatedSearchResult {

    private String query;
    private List<CandidateUrl> candidates;
    private List<ProviderReport> providerReports;

    public List<String> urls() {
        return candidates.stream().map(CandidateUrl::getUrl).collect(Collectors.toList());
    }

    public boolean isEmpty() {
        return candidates == null || candidates.isEmpty();
    }

}
