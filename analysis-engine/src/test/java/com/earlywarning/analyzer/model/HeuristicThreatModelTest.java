package com.earlywarning.analyzer.model;

import com.earlywarning.analyzer.feature.UrlFeatureExtractor;
import com.earlywarning.analyzer.feature.UrlFeatures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class HeuristicThreatModelTest {

    private UrlFeatureExtractor extractor;
    private HeuristicThreatModel model;

    @BeforeEach
    void setUp() {
        extractor = new UrlFeatureExtractor();
        model = new HeuristicThreatModel();
    }

    @Test
    void shouldScoreBenignUrlAtZero() {
        assertEquals(0.0, model.predict(extractor.extract("https://google.com")), 1e-9);
    }

    @Test
    void shouldWeighIpHostAndMissingHttps() {
        assertEquals(0.55, model.predict(extractor.extract("http://192.168.1.1/pay")), 1e-9);
    }

    @Test
    void shouldWeighKeywordsTldAndEntropy() {
        assertEquals(0.65, model.predict(extractor.extract("https://update.microsoft.xyz/verify")), 1e-9);
    }

    @Test
    void shouldCapKeywordContribution() {
        UrlFeatures manyKeywords = new UrlFeatures(40, 1, false, 10, 500, 0.0, true, 0, 3.0);

        assertEquals(HeuristicThreatModel.KEYWORD_CAP, model.predict(manyKeywords), 1e-9);
    }

    @Test
    void shouldAddSmallBumpForYoungDomain() {
        UrlFeatures young = new UrlFeatures(20, 1, false, 0, 3, 0.0, true, 0, 3.0);
        UrlFeatures unknownAge = new UrlFeatures(20, 1, true, 0, UrlFeatures.UNKNOWN_DOMAIN_AGE, 0.0, true, 0, 3.0);

        assertEquals(HeuristicThreatModel.YOUNG_DOMAIN_WEIGHT, model.predict(young), 1e-9);
        assertEquals(0.40, model.predict(unknownAge), 1e-9);
    }

    @Test
    void shouldClampToOne() {
        UrlFeatures everything = new UrlFeatures(200, 9, true, 5, 1, 1.0, false, 6, 5.0);

        assertEquals(1.0, model.predict(everything));
    }
}
