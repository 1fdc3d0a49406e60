package com.imperium.unbuilt.service.impl;

import com.imperium.unbuilt.config.ConversationProperties;
import com.imperium.unbuilt.exception.ResourceNotFoundException;
import com.imperium.unbuilt.model.dto.analysis.AnalysisSummary;
import com.imperium.unbuilt.model.dto.response.SuggestionDto;
import com.imperium.unbuilt.model.entity.Analysis;
import com.imperium.unbuilt.model.entity.Conversation;
import com.imperium.unbuilt.model.entity.Message;
import com.imperium.unbuilt.model.entity.SuggestedQuestion;
import com.imperium.unbuilt.service.AnalysisService;
import com.imperium.unbuilt.service.ConversationAccess;
import com.imperium.unbuilt.service.ConversationStore;
import com.imperium.unbuilt.service.GeneratedQuestion;
import com.imperium.unbuilt.service.QuestionGenerator;
import com.imperium.unbuilt.service.QuestionPrioritizer;
import com.imperium.unbuilt.service.SuggestionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class SuggestionServiceImpl implements SuggestionService {

    private static final Logger log = LoggerFactory.getLogger(SuggestionServiceImpl.class);

    private final ConversationStore store;
    private final ConversationAccess access;
    private final AnalysisService analysisService;
    private final QuestionGenerator generator;
    private final QuestionPrioritizer prioritizer;
    private final ConversationProperties properties;

    public SuggestionServiceImpl(ConversationStore store,
                                 ConversationAccess access,
                                 AnalysisService analysisService,
                                 QuestionGenerator generator,
                                 QuestionPrioritizer prioritizer,
                                 ConversationProperties properties) {
        this.store = store;
        this.access = access;
        this.analysisService = analysisService;
        this.generator = generator;
        this.prioritizer = prioritizer;
        this.properties = properties;
    }

    @Override
    public List<SuggestionDto> initialSuggestions(String conversationId, AnalysisSummary summary) {
        List<GeneratedQuestion> questions = generator.initialQuestions(summary);
        return save(conversationId, questions);
    }

    @Override
    public List<SuggestionDto> getSuggestedQuestions(String conversationId, String userId) {
        access.requireOwned(conversationId, userId);
        return store.getSuggestedQuestions(conversationId, false).stream()
                .map(SuggestionDto::from)
                .toList();
    }

    @Override
    public List<SuggestionDto> refreshSuggestedQuestions(String conversationId, String userId) {
        Conversation conversation = access.requireOwned(conversationId, userId);
        Analysis analysis = analysisService.getAnalysis(conversation.getAnalysisId());
        AnalysisSummary summary = analysis == null
                ? null
                : analysisService.loadSummary(analysis, properties.getContext().getSummaryGapLimit());
        List<Message> history = store.getRecentMessages(conversationId, properties.getContext().getHistoryLimit());

        List<GeneratedQuestion> candidates = generator.followUpQuestions(summary, history);
        List<GeneratedQuestion> ranked = prioritizer.prioritize(candidates, summary, history, QuestionPrioritizer.DEFAULT_LIMIT);
        log.info("Suggestions refreshed: conversationId={}, candidates={}, kept={}",
                conversationId, candidates.size(), ranked.size());
        return save(conversationId, ranked);
    }

    @Override
    public void markUsed(String questionId, String userId) {
        SuggestedQuestion question = store.getSuggestedQuestion(questionId);
        if (question == null) {
            throw new ResourceNotFoundException("Suggested question not found");
        }
        access.requireOwned(question.getConversationId(), userId);
        store.markSuggestionUsed(questionId);
    }

    private List<SuggestionDto> save(String conversationId, List<GeneratedQuestion> questions) {
        List<SuggestedQuestion> entities = questions.stream()
                .map(q -> new SuggestedQuestion(null, conversationId, q.text(), q.category().code(), q.priority(), false, null))
                .toList();
        return store.replaceSuggestedQuestions(conversationId, entities).stream()
                .map(SuggestionDto::from)
                .toList();
    }
}
