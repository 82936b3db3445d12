package com.vidnyan.codesense.adapter.out.ml;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Word n-gram TF-IDF vectorizer.
 *
 * Tokens are lower-cased runs of two or more word characters. The vocabulary keeps the
 * {@code maxFeatures} most frequent n-grams of the training corpus (ties broken alphabetically),
 * indexed alphabetically. IDF is smoothed, {@code ln((1 + n) / (1 + df)) + 1}, and every vector is
 * L2-normalized. Read-only once fitted.
 */
public class TfidfVectorizer {

    private static final Pattern TOKEN = Pattern.compile("\\b\\w\\w+\\b", Pattern.UNICODE_CHARACTER_CLASS);

    private final int maxFeatures;
    private final int maxNgram;

    private Map<String, Integer> vocabulary = Map.of();
    private double[] idf = new double[0];

    public TfidfVectorizer(int maxFeatures, int maxNgram) {
        if (maxFeatures < 1 || maxNgram < 1) {
            throw new IllegalArgumentException("maxFeatures and maxNgram must be positive");
        }
        this.maxFeatures = maxFeatures;
        this.maxNgram = maxNgram;
    }

    /**
     * Learn vocabulary and IDF weights, then return the vectors of the training documents.
     */
    public double[][] fitTransform(List<String> documents) {
        if (documents.isEmpty()) {
            throw new IllegalArgumentException("cannot fit on an empty corpus");
        }
        List<List<String>> analyzed = new ArrayList<>(documents.size());
        Map<String, Long> frequency = new HashMap<>();
        for (String document : documents) {
            List<String> terms = analyze(document);
            analyzed.add(terms);
            terms.forEach(term -> frequency.merge(term, 1L, Long::sum));
        }
        if (frequency.isEmpty()) {
            throw new IllegalStateException("empty vocabulary; documents contain only stop characters");
        }

        List<String> selected = frequency.keySet().stream()
                .sorted(Comparator.<String>comparingLong(frequency::get).reversed()
                        .thenComparing(Comparator.naturalOrder()))
                .limit(maxFeatures)
                .sorted()
                .toList();
        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < selected.size(); i++) {
            index.put(selected.get(i), i);
        }

        int[] documentFrequency = new int[selected.size()];
        for (List<String> terms : analyzed) {
            Set<Integer> seen = new HashSet<>();
            for (String term : terms) {
                Integer column = index.get(term);
                if (column != null && seen.add(column)) {
                    documentFrequency[column]++;
                }
            }
        }
        double[] weights = new double[selected.size()];
        int n = documents.size();
        for (int i = 0; i < weights.length; i++) {
            weights[i] = Math.log((1.0 + n) / (1.0 + documentFrequency[i])) + 1.0;
        }

        this.vocabulary = Map.copyOf(index);
        this.idf = weights;

        double[][] matrix = new double[analyzed.size()][];
        for (int i = 0; i < analyzed.size(); i++) {
            matrix[i] = vectorize(analyzed.get(i));
        }
        return matrix;
    }

    /**
     * Vector of a document over the fitted vocabulary. Unknown terms are ignored.
     */
    public double[] transform(String document) {
        if (vocabulary.isEmpty()) {
            throw new IllegalStateException("vectorizer is not fitted");
        }
        return vectorize(analyze(document));
    }

    public int vocabularySize() {
        return vocabulary.size();
    }

    /**
     * Fitted vocabulary in column order.
     */
    public List<String> features() {
        Map<Integer, String> byColumn = new TreeMap<>();
        vocabulary.forEach((term, column) -> byColumn.put(column, term));
        return List.copyOf(byColumn.values());
    }

    private double[] vectorize(List<String> terms) {
        double[] vector = new double[idf.length];
        for (String term : terms) {
            Integer column = vocabulary.get(term);
            if (column != null) {
                vector[column] += 1.0;
            }
        }
        double norm = 0.0;
        for (int i = 0; i < vector.length; i++) {
            vector[i] *= idf[i];
            norm += vector[i] * vector[i];
        }
        if (norm > 0.0) {
            double length = Math.sqrt(norm);
            for (int i = 0; i < vector.length; i++) {
                vector[i] /= length;
            }
        }
        return vector;
    }

    /**
     * All n-grams of the document, 1 to {@code maxNgram} tokens, in order of appearance.
     */
    List<String> analyze(String document) {
        List<String> tokens = new ArrayList<>();
        Matcher matcher = TOKEN.matcher(document.toLowerCase(Locale.ROOT));
        while (matcher.find()) {
            tokens.add(matcher.group());
        }
        List<String> terms = new ArrayList<>(tokens);
        for (int n = 2; n <= maxNgram; n++) {
            for (int i = 0; i + n <= tokens.size(); i++) {
                terms.add(String.join(" ", tokens.subList(i, i + n)));
            }
        }
        return terms;
    }
}
