package fun.fengwk.msh.core.service.rank.impl;

import fun.fengwk.msh.core.service.rank.Bm25Properties;
import fun.fengwk.msh.core.service.rank.RankedResult;
import fun.fengwk.msh.core.service.rank.RelevanceRanker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Okapi BM25 over the whole candidate corpus.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class Bm25RelevanceRanker implements RelevanceRanker {

    private static final double EPSILON = 1e-10;

    /**
     * Word tokens of two or more characters.
     */
    private static final Pattern TOKEN_PATTERN = Pattern.compile("\\b\\w\\w+\\b", Pattern.UNICODE_CHARACTER_CLASS);

    private final double k1;
    private final double b;

    public Bm25RelevanceRanker(Bm25Properties properties) {
        properties.validate();
        this.k1 = properties.getK1();
        this.b = properties.getB();
    }

    @Override
    public List<Double> score(String query, List<String> documents) {
        if (documents == null || documents.isEmpty()) {
            return List.of();
        }
        int n = documents.size();
        List<Double> zeros = Collections.nCopies(n, 0.0);

        Set<String> queryTerms = new LinkedHashSet<>(tokenize(query));
        if (queryTerms.isEmpty()) {
            return zeros;
        }

        List<Map<String, Integer>> termFrequencies = new ArrayList<>(n);
        int[] docLengths = new int[n];
        long totalLength = 0;
        for (int i = 0; i < n; i++) {
            List<String> tokens = tokenize(documents.get(i));
            Map<String, Integer> tf = new HashMap<>();
            for (String token : tokens) {
                tf.merge(token, 1, Integer::sum);
            }
            termFrequencies.add(tf);
            docLengths[i] = tokens.size();
            totalLength += tokens.size();
        }
        if (totalLength == 0) {
            return zeros;
        }
        double avgDocLength = (double) totalLength / n;

        Map<String, Double> idf = new HashMap<>();
        for (String term : queryTerms) {
            int df = 0;
            for (Map<String, Integer> tf : termFrequencies) {
                if (tf.containsKey(term)) {
                    df++;
                }
            }
            double value = Math.log(1.0 + (n - df + 0.5) / (df + 0.5 + EPSILON));
            // negative weights would invert the ranking of common terms
            idf.put(term, Math.max(0.0, value));
        }

        double[] scores = new double[n];
        double max = 0.0;
        for (int i = 0; i < n; i++) {
            Map<String, Integer> tf = termFrequencies.get(i);
            double lengthNorm = k1 * (1 - b + b * (docLengths[i] / (avgDocLength + EPSILON)));
            double score = 0.0;
            for (String term : queryTerms) {
                Integer frequency = tf.get(term);
                if (frequency == null) {
                    continue;
                }
                score += idf.get(term) * (frequency * (k1 + 1)) / (frequency + lengthNorm);
            }
            scores[i] = Double.isFinite(score) ? score : 0.0;
            max = Math.max(max, scores[i]);
        }

        List<Double> normalized = new ArrayList<>(n);
        for (double score : scores) {
            double value = max > 0 ? score / max : 0.0;
            normalized.add(Math.min(1.0, Math.max(0.0, value)));
        }
        return normalized;
    }

    @Override
    public List<RankedResult> rank(String query, List<String> urls, List<String> documents) {
        if (urls == null || urls.isEmpty()) {
            return List.of();
        }
        if (documents == null || documents.size() != urls.size()) {
            throw new IllegalArgumentException("documents must be aligned with urls");
        }

        List<Double> scores = score(query, documents);
        List<RankedResult> ranked = new ArrayList<>(urls.size());
        for (int i = 0; i < urls.size(); i++) {
            ranked.add(RankedResult.builder().url(urls.get(i)).score(scores.get(i)).build());
        }
        // List.sort is stable, ties keep aggregation order
        ranked.sort(Comparator.comparingDouble(RankedResult::getScore).reversed());
        log.debug("ranked urls, query={}, size={}", query, ranked.size());
        return ranked;
    }

    static List<String> tokenize(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        List<String> tokens = new ArrayList<>();
        Matcher matcher = TOKEN_PATTERN.matcher(text.toLowerCase(Locale.ROOT));
        while (matcher.find()) {
            tokens.add(matcher.group());
        }
        return tokens;
    }

}
