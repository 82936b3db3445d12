package com.vidnyan.codesense;

import com.vidnyan.codesense.application.port.in.AnalyzeCodeUseCase;
import com.vidnyan.codesense.application.port.out.DefectClassifier;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class CodeSenseApplicationTest {

    @Autowired
    private AnalyzeCodeUseCase analyzeCodeUseCase;

    @Autowired
    private DefectClassifier defectClassifier;

    @Test
    void contextLoads_ShouldTrainClassifierAtStartup() {
        assertTrue(defectClassifier.isReady());
        assertTrue(defectClassifier.isTrained());
    }

    @Test
    void analyze_ShouldRunThroughWiredComponents() {
        var prediction = analyzeCodeUseCase.analyze("try:\n    x = 1\nexcept:\n    pass", "python");

        assertEquals(2, prediction.flaggedSections().size());
        assertEquals(0.8, prediction.confidence());
    }
}
