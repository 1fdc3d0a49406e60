package com.imperium.unbuilt.service.impl;

import com.imperium.unbuilt.exception.AnalysisNotFoundException;
import com.imperium.unbuilt.exception.ValidationFailedException;
import com.imperium.unbuilt.model.dto.response.VariantComparisonResponse;
import com.imperium.unbuilt.model.entity.Analysis;
import com.imperium.unbuilt.model.entity.Conversation;
import com.imperium.unbuilt.model.entity.ConversationVariant;
import com.imperium.unbuilt.service.AnalysisService;
import com.imperium.unbuilt.service.ConversationAccess;
import com.imperium.unbuilt.service.ConversationStore;
import com.imperium.unbuilt.service.VariantComparator;
import com.imperium.unbuilt.service.VariantService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
public class VariantServiceImpl implements VariantService {

    private static final Logger log = LoggerFactory.getLogger(VariantServiceImpl.class);

    static final int MAX_QUERY_LENGTH = 500;
    private static final int COMPARISON_GAP_LIMIT = 10;

    private final ConversationStore store;
    private final ConversationAccess access;
    private final AnalysisService analysisService;
    private final VariantComparator comparator;

    public VariantServiceImpl(ConversationStore store,
                              ConversationAccess access,
                              AnalysisService analysisService,
                              VariantComparator comparator) {
        this.store = store;
        this.access = access;
        this.analysisService = analysisService;
        this.comparator = comparator;
    }

    @Override
    public ConversationVariant createVariant(String conversationId, String userId, String modifiedQuery,
                                             Map<String, String> parameters) {
        if (modifiedQuery == null || modifiedQuery.isBlank()) {
            throw new ValidationFailedException("Modified query must not be empty");
        }
        if (modifiedQuery.length() > MAX_QUERY_LENGTH) {
            throw new ValidationFailedException("Modified query must be at most " + MAX_QUERY_LENGTH + " characters");
        }
        Conversation conversation = access.requireOwned(conversationId, userId);
        Analysis parent = analysisService.getAnalysis(conversation.getAnalysisId());
        if (parent == null) {
            throw new AnalysisNotFoundException("Analysis not found");
        }

        Analysis variantAnalysis = analysisService.createVariantAnalysis(parent, userId, modifiedQuery.trim());
        Conversation variantConversation = store.getOrCreateConversation(variantAnalysis.getId(), userId).conversation();

        Map<String, String> params = parameters == null ? Map.of() : new LinkedHashMap<>(parameters);
        ConversationVariant variant = store.addVariant(new ConversationVariant(null, conversationId,
                variantAnalysis.getId(), variantConversation.getId(), modifiedQuery.trim(), params, null));
        log.info("Variant created: conversationId={}, variantAnalysisId={}, parameters={}",
                conversationId, variantAnalysis.getId(), params.keySet());
        return variant;
    }

    @Override
    public List<ConversationVariant> listVariants(String conversationId, String userId) {
        access.requireOwned(conversationId, userId);
        return store.getVariants(conversationId);
    }

    @Override
    public VariantComparisonResponse compareVariants(String conversationId, String variantId, String userId) {
        Conversation conversation = access.requireOwned(conversationId, userId);
        ConversationVariant variant = store.getVariants(conversationId).stream()
                .filter(v -> variantId.equals(v.getId()) || variantId.equals(v.getVariantAnalysisId()))
                .findFirst()
                .orElseThrow(() -> new ValidationFailedException("Variant does not belong to this conversation"));

        Analysis original = analysisService.getAnalysis(conversation.getAnalysisId());
        Analysis variantAnalysis = analysisService.getAnalysis(variant.getVariantAnalysisId());
        if (original == null || variantAnalysis == null) {
            throw new AnalysisNotFoundException("Analysis not found");
        }
        return comparator.compare(
                analysisService.loadSummary(original, COMPARISON_GAP_LIMIT),
                analysisService.loadSummary(variantAnalysis, COMPARISON_GAP_LIMIT),
                variant.getParameters());
    }
}
