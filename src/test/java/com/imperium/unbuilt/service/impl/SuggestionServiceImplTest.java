package com.imperium.unbuilt.service.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.imperium.unbuilt.config.ConversationProperties;
import com.imperium.unbuilt.exception.ResourceNotFoundException;
import com.imperium.unbuilt.exception.UnauthorizedAccessException;
import com.imperium.unbuilt.model.dto.analysis.AnalysisSummary;
import com.imperium.unbuilt.model.dto.analysis.GapSummary;
import com.imperium.unbuilt.model.dto.response.SuggestionDto;
import com.imperium.unbuilt.model.entity.Analysis;
import com.imperium.unbuilt.model.entity.Message;
import com.imperium.unbuilt.service.AnalysisService;
import com.imperium.unbuilt.service.ConversationAccess;
import com.imperium.unbuilt.service.QuestionGenerator;
import com.imperium.unbuilt.service.QuestionPrioritizer;
import com.imperium.unbuilt.support.InMemoryConversationStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class SuggestionServiceImplTest {

    private InMemoryConversationStore store;
    private SuggestionServiceImpl service;
    private AnalysisSummary summary;
    private String conversationId;

    @BeforeEach
    void setUp() {
        store = new InMemoryConversationStore();
        AnalysisService analysisService = mock(AnalysisService.class);
        Analysis analysis = new Analysis("a1", "u1", "pet insurance for exotic animals", 12, null, LocalDateTime.now());
        summary = AnalysisSummary.builder()
                .analysisId("a1")
                .searchQuery("pet insurance for exotic animals")
                .innovationScore(78)
                .feasibilityRating("medium")
                .topGaps(List.of(
                        GapSummary.builder().title("Reptile coverage").score(82).build(),
                        GapSummary.builder().title("Bird wellness plans").score(75).build()))
                .build();
        when(analysisService.getAnalysis("a1")).thenReturn(analysis);
        when(analysisService.loadSummary(any(Analysis.class), anyInt())).thenReturn(summary);

        service = new SuggestionServiceImpl(store, new ConversationAccess(store), analysisService,
                new QuestionGenerator(null, new ObjectMapper()), new QuestionPrioritizer(), new ConversationProperties());
        conversationId = store.getOrCreateConversation("a1", "u1").conversation().getId();
    }

    @Test
    void initialSuggestionsArePersistedHighestPriorityFirst() {
        service.initialSuggestions(conversationId, summary);

        List<SuggestionDto> stored = service.getSuggestedQuestions(conversationId, "u1");
        assertThat(stored).hasSize(5);
        assertThat(stored.get(0).getPriority()).isEqualTo(80);
        assertThat(stored.get(0).getCategory()).isEqualTo("market_validation");
        assertThat(stored).noneMatch(SuggestionDto::isUsed);
    }

    @Test
    void refreshReplacesUnusedSuggestionsWithRankedFollowUps() {
        List<SuggestionDto> initial = service.initialSuggestions(conversationId, summary);
        service.markUsed(initial.get(0).getId(), "u1");
        Message asked = new Message();
        asked.setConversationId(conversationId);
        asked.setRole(Message.ROLE_USER);
        asked.setContent(initial.get(0).getText());
        asked.setStatus(Message.STATUS_DONE);
        store.appendMessage(asked);

        List<SuggestionDto> refreshed = service.refreshSuggestedQuestions(conversationId, "u1");

        assertThat(refreshed).hasSize(QuestionPrioritizer.DEFAULT_LIMIT);
        assertThat(refreshed).extracting(SuggestionDto::getText).doesNotContain(initial.get(0).getText());
        assertThat(refreshed).extracting(SuggestionDto::getPriority).isSortedAccordingTo((a, b) -> b - a);
        assertThat(service.getSuggestedQuestions(conversationId, "u1"))
                .extracting(SuggestionDto::getId)
                .containsExactlyInAnyOrderElementsOf(refreshed.stream().map(SuggestionDto::getId).toList());
        assertThat(store.getSuggestedQuestion(initial.get(0).getId()).getUsed()).isTrue();
    }

    @Test
    void markUsedHidesTheSuggestion() {
        List<SuggestionDto> initial = service.initialSuggestions(conversationId, summary);

        service.markUsed(initial.get(1).getId(), "u1");

        assertThat(service.getSuggestedQuestions(conversationId, "u1"))
                .extracting(SuggestionDto::getId)
                .hasSize(4)
                .doesNotContain(initial.get(1).getId());
    }

    @Test
    void markUsedChecksExistenceAndOwnership() {
        List<SuggestionDto> initial = service.initialSuggestions(conversationId, summary);

        assertThatThrownBy(() -> service.markUsed("sq_missing", "u1")).isInstanceOf(ResourceNotFoundException.class);
        assertThatThrownBy(() -> service.markUsed(initial.get(0).getId(), "u2")).isInstanceOf(UnauthorizedAccessException.class);
        assertThatThrownBy(() -> service.getSuggestedQuestions(conversationId, "u2")).isInstanceOf(UnauthorizedAccessException.class);
    }
}
