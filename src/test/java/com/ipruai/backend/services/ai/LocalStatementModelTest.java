package com.ipruai.backend.services.ai;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.offset;

import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.Test;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.core.io.ClassPathResource;

import com.ipruai.backend.services.emails.parsers.NormalizedText;
import com.ipruai.backend.services.emails.parsers.TextNormalizer;
import com.ipruai.backend.support.ParserFixtures;

class LocalStatementModelTest {

    private final TextNormalizer normalizer = new TextNormalizer();

    private static LocalStatementModel shipped() {
        return LocalStatementModel.load(new ClassPathResource("model/statement-model.json"), ParserFixtures.mapper());
    }

    @Test
    void load_shippedArtifact() {
        LocalStatementModel model = shipped();

        assertThat(model.isAvailable()).isTrue();
        assertThat(model.version()).isEqualTo("sample-1.0");
    }

    @Test
    void load_missingOrBrokenArtifactIsUnavailable() {
        LocalStatementModel missing = LocalStatementModel.load(
                new ClassPathResource("model/does-not-exist.json"), ParserFixtures.mapper());
        LocalStatementModel broken = LocalStatementModel.load(
                new ByteArrayResource("{not json".getBytes()), ParserFixtures.mapper());

        assertThat(missing.isAvailable()).isFalse();
        assertThat(broken.isAvailable()).isFalse();
        assertThatThrownBy(() -> missing.predict(NormalizedText.EMPTY))
                .isInstanceOf(StatementModelException.class);
    }

    @Test
    void predict_vagueStatementRequest() {
        ModelPrediction prediction = shipped().predict(normalizer.normalize(null, "please send statement"));

        assertThat(prediction.labels()).extracting(ModelPrediction.PredictedLabel::type)
                .containsExactly("Portfolio_Appraisal");
        assertThat(prediction.confidence()).isBetween(54.0, 56.0);
        assertThat(prediction.hasDateRange()).isFalse();
    }

    @Test
    void predict_nothingAboveThreshold() {
        ModelPrediction prediction = shipped().predict(normalizer.normalize(null, "hello team, thanks"));

        assertThat(prediction.labels()).isEmpty();
        assertThat(prediction.confidence()).isZero();
    }

    @Test
    void features_unigramsAndBigrams() {
        assertThat(LocalStatementModel.features("send capital register, now"))
                .containsExactly("send", "send capital", "capital", "capital register", "register", "register now", "now");
    }

    @Test
    void probability_isSigmoidOfBiasPlusHits() {
        LocalStatementModel.Label label = new LocalStatementModel.Label("PMS", "Bank_Book", 0.0, Map.of("bank", 2.0));

        assertThat(LocalStatementModel.probability(label, Set.of())).isEqualTo(0.5);
        assertThat(LocalStatementModel.probability(label, Set.of("bank")))
                .isCloseTo(1.0 / (1.0 + Math.exp(-2.0)), offset(1e-12));
    }

    @Test
    void predict_customArtifactThreshold() {
        LocalStatementModel model = new LocalStatementModel(new LocalStatementModel.Artifact("t", 0.9, List.of(
                new LocalStatementModel.Label("PMS", "Bank_Book", 0.0, Map.of("bank", 2.0)))));

        assertThat(model.predict(normalizer.normalize(null, "bank")).labels()).isEmpty();
    }
}
