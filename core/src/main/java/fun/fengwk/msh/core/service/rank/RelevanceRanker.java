package fun.fengwk.msh.core.service.rank;

import java.util.List;

/**
 * Batch relevance scoring of fetched documents against a query.
 *
 * @author fengwk
 */
public interface RelevanceRanker {

    /**
     * Score every document, normalized so the best one scores 1.0.
     *
     * @param query search query
     * @param documents document texts, entries may be empty
     * @return one score per document within [0, 1], all zeros for an empty or degenerate corpus
     */
    List<Double> score(String query, List<String> documents);

    /**
     * Pair urls with the scores of their documents and sort by descending score. Equal scores
     * keep the input order.
     *
     * @param query search query
     * @param urls candidate urls
     * @param documents documents aligned with {@code urls}
     * @return ranked results
     */
    List<RankedResult> rank(String query, List<String> urls, List<String> documents);

}
