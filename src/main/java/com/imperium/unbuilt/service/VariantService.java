package com.imperium.unbuilt.service;

import com.imperium.unbuilt.model.dto.response.VariantComparisonResponse;
import com.imperium.unbuilt.model.entity.ConversationVariant;

import java.util.List;
import java.util.Map;

/**
 * 分析变体：在原会话下派生一次修改参数后的分析，并与原分析对比。
 */
public interface VariantService {

    ConversationVariant createVariant(String conversationId, String userId, String modifiedQuery, Map<String, String> parameters);

    List<ConversationVariant> listVariants(String conversationId, String userId);

    /**
     * @param variantId 变体 ID 或变体分析 ID
     */
    VariantComparisonResponse compareVariants(String conversationId, String variantId, String userId);
}
