package io.medpack.integrator.resolve;

import io.medpack.integrator.config.IntegrationSettings;
import jakarta.enterprise.context.ApplicationScoped;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.Set;

/**
 * Similarity between two normalized entity names.
 *
 * Combines three complementary metrics, weighted by the run settings:
 * - Jaccard similarity (token overlap)
 * - Token containment (share of the smaller token set found in the other)
 * - Levenshtein distance (edit distance)
 */
@ApplicationScoped
public class NameSimilarityCalculator {

    private static final Logger logger = LoggerFactory.getLogger(NameSimilarityCalculator.class);

    /**
     * Computes the weighted similarity of two normalized names.
     *
     * @param name1    first normalized name (must not be null)
     * @param name2    second normalized name (must not be null)
     * @param settings supplies the metric weights
     * @return similarity score [0.0, 1.0]
     */
    public double computeSimilarity(String name1, String name2, IntegrationSettings settings) {
        if (name1 == null) {
            throw new IllegalArgumentException("name1 cannot be null");
        }
        if (name2 == null) {
            throw new IllegalArgumentException("name2 cannot be null");
        }
        if (name1.isEmpty() || name2.isEmpty()) {
            return 0.0;
        }
        if (name1.equals(name2)) {
            return 1.0;
        }

        double jaccard = computeJaccardSimilarity(name1, name2);
        double containment = computeContainmentScore(name1, name2);
        double levenshtein = computeLevenshteinSimilarity(name1, name2);

        double finalScore = settings.jaccardWeight() * jaccard
                          + settings.containmentWeight() * containment
                          + settings.editWeight() * levenshtein;
        double weightSum = settings.jaccardWeight() + settings.containmentWeight() + settings.editWeight();
        if (weightSum > 0) {
            finalScore = finalScore / weightSum;
        }

        if (finalScore > 0.3) {
            logger.debug("Similarity '{}' vs '{}': jaccard={}, containment={}, edit={}, final={}",
                name1, name2, jaccard, containment, levenshtein, finalScore);
        }
        return finalScore;
    }

    /**
     * Jaccard similarity: |intersection| / |union| of token sets.
     */
    public double computeJaccardSimilarity(String name1, String name2) {
        Set<String> tokens1 = tokenize(name1);
        Set<String> tokens2 = tokenize(name2);
        if (tokens1.isEmpty() || tokens2.isEmpty()) {
            return 0.0;
        }

        Set<String> intersection = new HashSet<>(tokens1);
        intersection.retainAll(tokens2);
        Set<String> union = new HashSet<>(tokens1);
        union.addAll(tokens2);
        return (double) intersection.size() / union.size();
    }

    /**
     * Token containment: |intersection| / size of the smaller token set.
     * 1.0 when every token of one name appears in the other.
     */
    public double computeContainmentScore(String name1, String name2) {
        Set<String> tokens1 = tokenize(name1);
        Set<String> tokens2 = tokenize(name2);
        if (tokens1.isEmpty() || tokens2.isEmpty()) {
            return 0.0;
        }

        Set<String> intersection = new HashSet<>(tokens1);
        intersection.retainAll(tokens2);
        return (double) intersection.size() / Math.min(tokens1.size(), tokens2.size());
    }

    /**
     * Normalized Levenshtein similarity: 1 - (editDistance / maxLength).
     */
    public double computeLevenshteinSimilarity(String name1, String name2) {
        if (name1.equals(name2)) {
            return 1.0;
        }
        int maxLength = Math.max(name1.length(), name2.length());
        if (maxLength == 0) {
            return 1.0;
        }
        int distance = computeLevenshteinDistance(name1, name2);
        return 1.0 - ((double) distance / maxLength);
    }

    private int computeLevenshteinDistance(String s1, String s2) {
        int len1 = s1.length();
        int len2 = s2.length();

        if (len1 == 0) return len2;
        if (len2 == 0) return len1;

        int[] previous = new int[len2 + 1];
        int[] current = new int[len2 + 1];
        for (int j = 0; j <= len2; j++) {
            previous[j] = j;
        }

        for (int i = 1; i <= len1; i++) {
            current[0] = i;
            for (int j = 1; j <= len2; j++) {
                int cost = (s1.charAt(i - 1) == s2.charAt(j - 1)) ? 0 : 1;
                current[j] = Math.min(Math.min(previous[j] + 1, current[j - 1] + 1), previous[j - 1] + cost);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[len2];
    }

    private Set<String> tokenize(String name) {
        Set<String> result = new HashSet<>();
        for (String token : name.split("[\\s\\-_/]+")) {
            if (!token.isEmpty()) {
                result.add(token);
            }
        }
        return result;
    }
}
