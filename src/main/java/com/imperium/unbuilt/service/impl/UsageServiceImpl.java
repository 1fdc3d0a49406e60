package com.imperium.unbuilt.service.impl;

import com.imperium.unbuilt.config.IdSupport;
import com.imperium.unbuilt.mapper.RequestUsageMapper;
import com.imperium.unbuilt.model.entity.RequestUsage;
import com.imperium.unbuilt.service.UsageService;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;

@Service
public class UsageServiceImpl implements UsageService {

    private final RequestUsageMapper requestUsageMapper;

    @Value("${app.generation.cost-per-1k-input-tokens:0.00027}")
    private double costPer1kInput;

    @Value("${app.generation.cost-per-1k-output-tokens:0.0011}")
    private double costPer1kOutput;

    public UsageServiceImpl(RequestUsageMapper requestUsageMapper) {
        this.requestUsageMapper = requestUsageMapper;
    }

    @Override
    public void record(String messageId, String conversationId, String userId, String model, int latencyMs,
                       Integer promptTokens, Integer completionTokens, boolean cached) {
        RequestUsage usage = new RequestUsage();
        usage.setId(IdSupport.newId("ru_"));
        usage.setMessageId(messageId);
        usage.setConversationId(conversationId);
        usage.setUserId(userId);
        usage.setModel(model != null ? model : "");
        usage.setLatencyMs(latencyMs);
        usage.setPromptTokens(promptTokens);
        usage.setCompletionTokens(completionTokens);
        usage.setEstimatedCostUsd(cached ? 0.0 : estimateCostUsd(promptTokens, completionTokens));
        usage.setCached(cached);
        usage.setCreatedAt(LocalDateTime.now());
        requestUsageMapper.insert(usage);
    }

    @Override
    public double estimateCostUsd(Integer promptTokens, Integer completionTokens) {
        int in = promptTokens != null ? promptTokens : 0;
        int out = completionTokens != null ? completionTokens : 0;
        return in / 1000.0 * costPer1kInput + out / 1000.0 * costPer1kOutput;
    }
}
