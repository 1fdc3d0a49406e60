package com.imperium.unbuilt.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.imperium.unbuilt.ai.orchestrator.ConversationLockRegistry;
import com.imperium.unbuilt.config.ConversationProperties;
import com.imperium.unbuilt.exception.UnauthorizedAccessException;
import com.imperium.unbuilt.exception.ValidationFailedException;
import com.imperium.unbuilt.model.dto.response.ConversationDetailResponse;
import com.imperium.unbuilt.model.dto.response.MessageHistoryResponse;
import com.imperium.unbuilt.model.dto.response.SuggestionDto;
import com.imperium.unbuilt.model.entity.Analysis;
import com.imperium.unbuilt.model.entity.Message;
import com.imperium.unbuilt.policy.ConversationRateLimiter;
import com.imperium.unbuilt.policy.SubscriptionTier;
import com.imperium.unbuilt.service.impl.SuggestionServiceImpl;
import com.imperium.unbuilt.support.InMemoryConversationStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ConversationLifecycleServiceTest {

    private InMemoryConversationStore store;
    private ConversationRateLimiter rateLimiter;
    private QueryDeduplicationCache dedupCache;
    private ConversationLifecycleService service;

    @BeforeEach
    void setUp() {
        ConversationProperties properties = new ConversationProperties();
        store = new InMemoryConversationStore();
        ConversationAccess access = new ConversationAccess(store);
        AnalysisService analysisService = mock(AnalysisService.class);
        Analysis analysis = new Analysis("a1", "u1", "pet insurance for exotic animals", 12, null, LocalDateTime.now());
        when(analysisService.requireOwnedAnalysis("a1", "u1")).thenReturn(analysis);
        when(analysisService.getAnalysis("a1")).thenReturn(analysis);
        when(analysisService.loadSummary(any(Analysis.class), anyInt()))
                .thenReturn(QuestionGeneratorTest.summary(78, "medium"));

        rateLimiter = new ConversationRateLimiter(properties,
                Clock.fixed(Instant.parse("2026-03-10T10:00:00Z"), ZoneOffset.UTC));
        dedupCache = new QueryDeduplicationCache(properties);
        SuggestionService suggestionService = new SuggestionServiceImpl(store, access, analysisService,
                new QuestionGenerator(null, new ObjectMapper()), new QuestionPrioritizer(), properties);
        service = new ConversationLifecycleService(store, access, analysisService, suggestionService,
                rateLimiter, dedupCache, new ConversationLockRegistry(properties), properties);
    }

    @Test
    void openingCreatesConversationWithInitialSuggestions() {
        ConversationDetailResponse first = service.openConversation("a1", "u1", SubscriptionTier.FREE);

        assertThat(first.getConversation().getAnalysisId()).isEqualTo("a1");
        assertThat(first.getMessages()).isEmpty();
        assertThat(first.getTotalMessages()).isZero();
        assertThat(first.getSuggestions()).hasSize(5);
        assertThat(first.getRateLimit().getRemaining()).isEqualTo(5);

        ConversationDetailResponse second = service.openConversation("a1", "u1", SubscriptionTier.FREE);
        assertThat(second.getConversation().getId()).isEqualTo(first.getConversation().getId());
        assertThat(second.getSuggestions()).extracting(SuggestionDto::getId)
                .containsExactlyInAnyOrderElementsOf(first.getSuggestions().stream().map(SuggestionDto::getId).toList());
    }

    @Test
    void usedSuggestionsAreNotRegenerated() {
        ConversationDetailResponse first = service.openConversation("a1", "u1", SubscriptionTier.FREE);
        first.getSuggestions().forEach(s -> store.markSuggestionUsed(s.getId()));

        ConversationDetailResponse second = service.openConversation("a1", "u1", SubscriptionTier.FREE);

        assertThat(second.getSuggestions()).isEmpty();
    }

    @Test
    void historyIsPagedInSequenceOrder() {
        String conversationId = openConversation();
        for (int i = 1; i <= 5; i++) {
            append(conversationId, "message " + i);
        }

        MessageHistoryResponse page = service.getHistory(conversationId, "u1", 2, 0);
        assertThat(page.getMessages()).extracting(m -> m.getContent()).containsExactly("message 1", "message 2");
        assertThat(page.getTotal()).isEqualTo(5);
        assertThat(page.isHasMore()).isTrue();

        MessageHistoryResponse last = service.getHistory(conversationId, "u1", 2, 4);
        assertThat(last.getMessages()).extracting(m -> m.getContent()).containsExactly("message 5");
        assertThat(last.isHasMore()).isFalse();

        assertThat(service.getHistory(conversationId, "u1", null, null).getLimit())
                .isEqualTo(ConversationLifecycleService.DEFAULT_PAGE_SIZE);
    }

    @Test
    void historyRejectsBadPagingAndForeignUsers() {
        String conversationId = openConversation();

        assertThatThrownBy(() -> service.getHistory(conversationId, "u1", 0, 0)).isInstanceOf(ValidationFailedException.class);
        assertThatThrownBy(() -> service.getHistory(conversationId, "u1", 101, 0)).isInstanceOf(ValidationFailedException.class);
        assertThatThrownBy(() -> service.getHistory(conversationId, "u1", 10, -1)).isInstanceOf(ValidationFailedException.class);
        assertThatThrownBy(() -> service.getHistory(conversationId, "u2", 10, 0)).isInstanceOf(UnauthorizedAccessException.class);
    }

    @Test
    void clearRequiresConfirmation() {
        String conversationId = openConversation();
        append(conversationId, "keep me");

        assertThatThrownBy(() -> service.clearConversation(conversationId, "u1", false))
                .isInstanceOf(ValidationFailedException.class)
                .hasMessage("Clearing a conversation requires confirm=true");
        assertThat(store.countMessages(conversationId)).isEqualTo(1);
    }

    @Test
    void clearRemovesMessagesCacheAndConversationQuota() {
        String conversationId = openConversation();
        append(conversationId, "How big is the market?");
        dedupCache.cacheQueryResponse("How big is the market?", "About $2B.", conversationId);
        rateLimiter.checkAndReserve("u1", conversationId, SubscriptionTier.FREE);
        rateLimiter.checkAndReserve("u1", conversationId, SubscriptionTier.FREE);

        service.clearConversation(conversationId, "u1", true);

        assertThat(store.countMessages(conversationId)).isZero();
        assertThat(store.getSuggestedQuestions(conversationId, true)).isEmpty();
        assertThat(dedupCache.findSimilarQuery(conversationId, "How big is the market?", List.of(), 0.9).similar()).isFalse();
        assertThat(rateLimiter.peek("u1", conversationId, SubscriptionTier.FREE).getRemaining()).isEqualTo(5);
    }

    private String openConversation() {
        return service.openConversation("a1", "u1", SubscriptionTier.FREE).getConversation().getId();
    }

    private void append(String conversationId, String content) {
        Message m = new Message();
        m.setConversationId(conversationId);
        m.setRole(Message.ROLE_USER);
        m.setContent(content);
        m.setStatus(Message.STATUS_DONE);
        store.appendMessage(m);
    }
}
