package com.vidnyan.codesense.adapter.out.ml;

import com.vidnyan.codesense.application.port.out.DefectClassifier;
import com.vidnyan.codesense.config.AnalysisProperties;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * TF-IDF + random forest defect classifier trained on the synthetic corpus.
 *
 * Training runs once, at start-up or on first use. If it fails the classifier stays untrained and
 * every call returns the neutral 0.5.
 */
@Slf4j
@Component
public class RandomForestDefectClassifier implements DefectClassifier {

    static final double NEUTRAL = 0.5;

    private final AnalysisProperties.Classifier settings;
    private final AtomicInteger trainingRuns = new AtomicInteger();

    private volatile boolean ready;
    private volatile boolean trained;
    private TfidfVectorizer vectorizer;
    private RandomForest forest;

    public RandomForestDefectClassifier(AnalysisProperties properties) {
        this.settings = properties.getClassifier();
    }

    @PostConstruct
    @Override
    public void initialize() {
        if (ready) {
            return;
        }
        synchronized (this) {
            if (ready) {
                return;
            }
            long start = System.currentTimeMillis();
            trainingRuns.incrementAndGet();
            try {
                List<TrainingSample> corpus = new SyntheticCorpusGenerator(settings.getSamplesPerClass())
                        .generate(settings.getSeed());
                TfidfVectorizer fittedVectorizer = new TfidfVectorizer(settings.getMaxFeatures(), settings.getMaxNgram());
                double[][] matrix = fittedVectorizer.fitTransform(corpus.stream().map(TrainingSample::code).toList());
                int[] labels = corpus.stream().mapToInt(TrainingSample::label).toArray();

                this.forest = RandomForest.fit(matrix, labels, settings.getTrees(), settings.getSeed());
                this.vectorizer = fittedVectorizer;
                this.trained = true;
                log.info("Defect classifier trained: {} samples, {} features, {} trees (max depth {}) in {}ms",
                        corpus.size(), fittedVectorizer.vocabularySize(), forest.size(), forest.maxDepth(),
                        System.currentTimeMillis() - start);
            } catch (RuntimeException e) {
                log.warn("Defect classifier training failed, using neutral score: {}", e.getMessage());
                this.trained = false;
            } finally {
                this.ready = true;
            }
        }
    }

    /** Number of times training has started; at most one. */
    int trainingRuns() {
        return trainingRuns.get();
    }

    @Override
    public boolean isReady() {
        return ready;
    }

    @Override
    public boolean isTrained() {
        return trained;
    }

    @Override
    public double classify(String code) {
        Objects.requireNonNull(code, "code");
        if (!ready) {
            initialize();
        }
        if (!trained) {
            return NEUTRAL;
        }
        try {
            double probability = forest.predictProbability(vectorizer.transform(code));
            log.debug("Classifier probability {}", probability);
            return probability;
        } catch (RuntimeException e) {
            log.warn("Classification failed, using neutral score: {}", e.getMessage());
            return NEUTRAL;
        }
    }
}
