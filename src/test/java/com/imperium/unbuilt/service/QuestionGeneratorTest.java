package com.imperium.unbuilt.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.imperium.unbuilt.model.dto.analysis.AnalysisSummary;
import com.imperium.unbuilt.model.dto.analysis.GapSummary;
import com.imperium.unbuilt.model.entity.Message;
import org.junit.jupiter.api.Test;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.RETURNS_DEEP_STUBS;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class QuestionGeneratorTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void initialQuestionsMixCategoriesAroundTopGap() {
        QuestionGenerator generator = new QuestionGenerator(null, objectMapper);

        List<GeneratedQuestion> questions = generator.initialQuestions(summary(78, "medium"));

        assertThat(questions).hasSize(QuestionGenerator.INITIAL_LIMIT);
        assertThat(questions).extracting(GeneratedQuestion::category).containsExactly(
                QuestionCategory.MARKET_VALIDATION,
                QuestionCategory.MARKET_VALIDATION,
                QuestionCategory.COMPETITIVE_ANALYSIS,
                QuestionCategory.EXECUTION_STRATEGY,
                QuestionCategory.RISK_ASSESSMENT);
        assertThat(questions).extracting(GeneratedQuestion::priority).containsExactly(80, 75, 70, 65, 60);
        assertThat(questions).allSatisfy(q -> assertThat(q.text()).contains("Reptile coverage"));
    }

    @Test
    void lowFeasibilityPromotesRiskQuestions() {
        QuestionGenerator generator = new QuestionGenerator(null, objectMapper);

        List<GeneratedQuestion> questions = generator.initialQuestions(summary(85, "low"));

        assertThat(questions).extracting(GeneratedQuestion::priority).containsExactly(90, 85, 75, 70, 70);
        assertThat(questions).filteredOn(q -> q.category() == QuestionCategory.RISK_ASSESSMENT).hasSize(2);
        assertThat(questions).noneMatch(q -> q.category() == QuestionCategory.EXECUTION_STRATEGY);
    }

    @Test
    void fallsBackToGenericTopicWithoutSummary() {
        QuestionGenerator generator = new QuestionGenerator(null, objectMapper);

        assertThat(generator.initialQuestions(null))
                .allSatisfy(q -> assertThat(q.text()).contains("this opportunity"));
    }

    @Test
    void followUpsSkipQuestionsAlreadyAsked() {
        QuestionGenerator generator = new QuestionGenerator(null, objectMapper);
        String asked = "What would a minimum viable product for Reptile coverage look like?";

        List<GeneratedQuestion> followUps = generator.followUpQuestions(summary(78, "medium"),
                List.of(userMessage(asked)));

        assertThat(followUps).isNotEmpty();
        assertThat(followUps).extracting(GeneratedQuestion::text).doesNotContain(asked);
        assertThat(followUps).extracting(GeneratedQuestion::text).doesNotHaveDuplicates();
    }

    @Test
    void parsesModelOutputAndDropsInvalidItems() {
        QuestionGenerator generator = new QuestionGenerator(null, objectMapper);
        String content = "Here you go:\n```json\n["
                + "{\"text\":\" Which vets would refer customers? \",\"category\":\"market_validation\",\"priority\":140},"
                + "{\"text\":\"\",\"category\":\"risk_assessment\"},"
                + "{\"text\":\"Is this legal?\",\"category\":\"legal\"},"
                + "{\"text\":\"What should the MVP include?\",\"category\":\"execution_strategy\"}"
                + "]\n```";

        List<GeneratedQuestion> questions = generator.parseQuestions(content);

        assertThat(questions).containsExactly(
                new GeneratedQuestion("Which vets would refer customers?", QuestionCategory.MARKET_VALIDATION, 100),
                new GeneratedQuestion("What should the MVP include?", QuestionCategory.EXECUTION_STRATEGY, 65));
        assertThat(generator.parseQuestions("no json here")).isEmpty();
        assertThat(generator.parseQuestions("[{broken")).isEmpty();
    }

    @Test
    void usesModelWhenEnabled() {
        ChatClient chatClient = mock(ChatClient.class, RETURNS_DEEP_STUBS);
        when(chatClient.prompt().system(anyString()).user(anyString()).call().content())
                .thenReturn("[{\"text\":\"How do reptile owners buy insurance today?\",\"category\":\"market_validation\",\"priority\":88}]");
        QuestionGenerator generator = new QuestionGenerator(chatClient, objectMapper);
        ReflectionTestUtils.setField(generator, "aiEnabled", true);

        List<GeneratedQuestion> followUps = generator.followUpQuestions(summary(78, "medium"), List.of());

        assertThat(followUps).containsExactly(new GeneratedQuestion(
                "How do reptile owners buy insurance today?", QuestionCategory.MARKET_VALIDATION, 88));
    }

    @Test
    void modelFailureFallsBackToTemplates() {
        ChatClient chatClient = mock(ChatClient.class, RETURNS_DEEP_STUBS);
        when(chatClient.prompt().system(anyString()).user(anyString()).call().content())
                .thenThrow(new IllegalStateException("rate limited"));
        QuestionGenerator generator = new QuestionGenerator(chatClient, objectMapper);
        ReflectionTestUtils.setField(generator, "aiEnabled", true);

        List<GeneratedQuestion> followUps = generator.followUpQuestions(summary(78, "medium"), List.of());

        assertThat(followUps).isNotEmpty();
        assertThat(followUps).extracting(GeneratedQuestion::category).contains(QuestionCategory.RISK_ASSESSMENT);
    }

    static AnalysisSummary summary(int innovation, String feasibility) {
        return AnalysisSummary.builder()
                .analysisId("a1")
                .searchQuery("pet insurance for exotic animals")
                .innovationScore(innovation)
                .feasibilityRating(feasibility)
                .topGaps(List.of(GapSummary.builder().title("Reptile coverage").score(82).build()))
                .build();
    }

    static Message userMessage(String content) {
        Message m = new Message();
        m.setRole(Message.ROLE_USER);
        m.setContent(content);
        m.setStatus(Message.STATUS_DONE);
        return m;
    }
}
