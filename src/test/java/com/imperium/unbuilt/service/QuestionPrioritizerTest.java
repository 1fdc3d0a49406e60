package com.imperium.unbuilt.service;

import com.imperium.unbuilt.model.entity.Message;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.imperium.unbuilt.service.QuestionGeneratorTest.summary;
import static com.imperium.unbuilt.service.QuestionGeneratorTest.userMessage;
import static org.assertj.core.api.Assertions.assertThat;

class QuestionPrioritizerTest {

    private final QuestionPrioritizer prioritizer = new QuestionPrioritizer();

    private final GeneratedQuestion riskQuestion = new GeneratedQuestion(
            "What are the biggest risks in pursuing Reptile coverage?", QuestionCategory.RISK_ASSESSMENT, 60);
    private final GeneratedQuestion marketQuestion = new GeneratedQuestion(
            "Who are the first customers most likely to pay for Reptile coverage?", QuestionCategory.MARKET_VALIDATION, 80);

    @Test
    void scoresEachFactorAndWeightsTheTotal() {
        QuestionPrioritizer.PriorityScore score = prioritizer.score(riskQuestion, summary(78, "low"), List.of());

        assertThat(score.relevance()).isEqualTo(80);
        assertThat(score.userConcerns()).isEqualTo(50);
        assertThat(score.knowledgeGaps()).isEqualTo(75);
        assertThat(score.actionability()).isEqualTo(70);
        assertThat(score.total()).isEqualTo(69);
    }

    @Test
    void lowFeasibilityRaisesRiskRelevance() {
        int low = prioritizer.score(riskQuestion, summary(78, "low"), List.of()).relevance();
        int medium = prioritizer.score(riskQuestion, summary(78, "medium"), List.of()).relevance();

        assertThat(low - medium).isEqualTo(20);
    }

    @Test
    void userFocusFavoursMatchingCategory() {
        List<Message> history = List.of(userMessage("what is the market demand here?"));

        int market = prioritizer.score(marketQuestion, summary(78, "medium"), history).userConcerns();
        int risk = prioritizer.score(riskQuestion, summary(78, "medium"), history).userConcerns();

        assertThat(market).isEqualTo(50);
        assertThat(risk).isEqualTo(40);
    }

    @Test
    void prioritizeSortsAndLimitsUsingTotals() {
        GeneratedQuestion vague = new GeneratedQuestion("Thoughts?", QuestionCategory.COMPETITIVE_ANALYSIS, 99);

        List<GeneratedQuestion> ranked = prioritizer.prioritize(
                List.of(vague, riskQuestion, marketQuestion), summary(78, "medium"), null, 2);

        assertThat(ranked).hasSize(2);
        assertThat(ranked).extracting(GeneratedQuestion::text).doesNotContain("Thoughts?");
        assertThat(ranked.get(0).priority()).isGreaterThanOrEqualTo(ranked.get(1).priority());
        assertThat(ranked).allSatisfy(q -> assertThat(q.priority())
                .isEqualTo(prioritizer.score(q, summary(78, "medium"), List.of()).total()));
    }
}
