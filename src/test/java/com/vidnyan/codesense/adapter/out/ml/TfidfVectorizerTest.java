package com.vidnyan.codesense.adapter.out.ml;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TfidfVectorizerTest {

    @Test
    void analyze_ShouldLowerCaseAndDropSingleCharacterTokens() {
        TfidfVectorizer vectorizer = new TfidfVectorizer(10, 2);

        assertEquals(List.of("bb", "cc", "bb cc"), vectorizer.analyze("a BB(cc)"));
    }

    @Test
    void fitTransform_ShouldBuildAlphabeticalVocabularyAndUnitVectors() {
        // Arrange
        TfidfVectorizer vectorizer = new TfidfVectorizer(10, 2);

        // Act
        double[][] matrix = vectorizer.fitTransform(List.of("alpha beta", "alpha gamma"));

        // Assert
        assertEquals(List.of("alpha", "alpha beta", "alpha gamma", "beta", "gamma"), vectorizer.features());
        assertEquals(2, matrix.length);
        for (double[] row : matrix) {
            assertEquals(5, row.length);
            assertEquals(1.0, norm(row), 1e-9);
        }
        // shared term gets the lowest idf
        assertTrue(matrix[0][0] < matrix[0][3]);
        assertEquals(0.0, matrix[0][4]);
    }

    @Test
    void fitTransform_ShouldKeepMostFrequentTermsWhenCapped() {
        TfidfVectorizer vectorizer = new TfidfVectorizer(2, 2);

        vectorizer.fitTransform(List.of("alpha beta", "alpha gamma"));

        assertEquals(List.of("alpha", "alpha beta"), vectorizer.features());
        assertEquals(2, vectorizer.vocabularySize());
    }

    @Test
    void transform_ShouldIgnoreUnknownTerms() {
        TfidfVectorizer vectorizer = new TfidfVectorizer(10, 1);
        vectorizer.fitTransform(List.of("eval input", "return result"));

        double[] vector = vectorizer.transform("completely unrelated");

        assertEquals(0.0, norm(vector));
    }

    @Test
    void transform_ShouldRequireFit() {
        TfidfVectorizer vectorizer = new TfidfVectorizer(10, 1);

        assertThrows(IllegalStateException.class, () -> vectorizer.transform("x = 1"));
        assertThrows(IllegalArgumentException.class, () -> vectorizer.fitTransform(List.of()));
        assertThrows(IllegalArgumentException.class, () -> new TfidfVectorizer(0, 1));
    }

    private static double norm(double[] vector) {
        double sum = 0.0;
        for (double v : vector) {
            sum += v * v;
        }
        return Math.sqrt(sum);
    }
}
