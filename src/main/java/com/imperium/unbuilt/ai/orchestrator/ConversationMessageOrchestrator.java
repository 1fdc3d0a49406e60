package com.imperium.unbuilt.ai.orchestrator;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.imperium.unbuilt.ai.context.ContextWindow;
import com.imperium.unbuilt.ai.context.ContextWindowBuilder;
import com.imperium.unbuilt.ai.context.TokenEstimator;
import com.imperium.unbuilt.ai.generation.GenerationChunk;
import com.imperium.unbuilt.ai.generation.GenerationClient;
import com.imperium.unbuilt.ai.generation.GenerationMetadata;
import com.imperium.unbuilt.ai.generation.GenerationResult;
import com.imperium.unbuilt.config.ConversationProperties;
import com.imperium.unbuilt.config.IdSupport;
import com.imperium.unbuilt.exception.ContentRejectedException;
import com.imperium.unbuilt.exception.ConversationBusyException;
import com.imperium.unbuilt.exception.ConversationPipelineException;
import com.imperium.unbuilt.exception.ErrorCode;
import com.imperium.unbuilt.exception.GenerationFailedException;
import com.imperium.unbuilt.exception.InjectionDetectedException;
import com.imperium.unbuilt.exception.PersistenceFailedException;
import com.imperium.unbuilt.exception.QuotaExceededException;
import com.imperium.unbuilt.exception.ValidationFailedException;
import com.imperium.unbuilt.guard.ContentModerator;
import com.imperium.unbuilt.guard.GuardContext;
import com.imperium.unbuilt.guard.InjectionDetector;
import com.imperium.unbuilt.guard.InputGuard;
import com.imperium.unbuilt.guard.InputValidationResult;
import com.imperium.unbuilt.guard.ModerationResult;
import com.imperium.unbuilt.model.dto.analysis.AnalysisSummary;
import com.imperium.unbuilt.model.dto.response.MessageDto;
import com.imperium.unbuilt.model.dto.response.MessageExchangeResponse;
import com.imperium.unbuilt.model.entity.Analysis;
import com.imperium.unbuilt.model.entity.Message;
import com.imperium.unbuilt.policy.ConversationRateLimiter;
import com.imperium.unbuilt.policy.RateLimitDecision;
import com.imperium.unbuilt.service.AnalysisService;
import com.imperium.unbuilt.service.ConversationStore;
import com.imperium.unbuilt.service.QueryDeduplicationCache;
import com.imperium.unbuilt.service.SimilarityResult;
import com.imperium.unbuilt.service.UsageService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 消息流水线编排器。
 * <p>
 * 阶段：限流预占 → 输入校验与清洗 → 注入检测 → 内容审核 → [会话锁] → 去重 → 组装上下文
 * → 生成（批量 / 流式）→ 落库 → 用量记录。
 * <p>
 * 额度在第一步预占；之后的校验拒绝、等锁超时、生成失败（且未落库）会退还额度。
 * 命中去重缓存、客户端取消、生成后写库失败都照常计数。
 * <p>
 * 同一会话的消息在会话锁内串行处理，保证消息日志里每个 user 消息后紧跟它自己的回复。
 */
@Service
public class ConversationMessageOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ConversationMessageOrchestrator.class);

    /** 生成失败时对用户展示的文案，不透露后端细节 */
    static final String GENERATION_FAILED_MESSAGE =
            "The AI advisor is temporarily unavailable. Please try again in a moment.";

    private final ConversationStore conversationStore;
    private final AnalysisService analysisService;
    private final ConversationRateLimiter rateLimiter;
    private final InputGuard inputGuard;
    private final InjectionDetector injectionDetector;
    private final ContentModerator contentModerator;
    private final QueryDeduplicationCache deduplicationCache;
    private final ContextWindowBuilder contextWindowBuilder;
    private final GenerationClient generationClient;
    private final TokenEstimator tokenEstimator;
    private final UsageService usageService;
    private final ConversationLockRegistry lockRegistry;
    private final ConversationProperties properties;
    private final ObjectMapper objectMapper;

    public ConversationMessageOrchestrator(ConversationStore conversationStore,
            AnalysisService analysisService,
            ConversationRateLimiter rateLimiter,
            InputGuard inputGuard,
            InjectionDetector injectionDetector,
            ContentModerator contentModerator,
            QueryDeduplicationCache deduplicationCache,
            ContextWindowBuilder contextWindowBuilder,
            GenerationClient generationClient,
            TokenEstimator tokenEstimator,
            UsageService usageService,
            ConversationLockRegistry lockRegistry,
            ConversationProperties properties,
            ObjectMapper objectMapper) {
        this.conversationStore = conversationStore;
        this.analysisService = analysisService;
        this.rateLimiter = rateLimiter;
        this.inputGuard = inputGuard;
        this.injectionDetector = injectionDetector;
        this.contentModerator = contentModerator;
        this.deduplicationCache = deduplicationCache;
        this.contextWindowBuilder = contextWindowBuilder;
        this.generationClient = generationClient;
        this.tokenEstimator = tokenEstimator;
        this.usageService = usageService;
        this.lockRegistry = lockRegistry;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    // ==================== 公开入口 ====================

    /**
     * 批量模式：返回完整的一问一答。失败以 {@link ConversationPipelineException} 子类抛出。
     */
    public MessageExchangeResponse send(MessageCommand command) {
        PreparedMessage prepared = prepare(command);
        return runLocked(prepared);
    }

    /**
     * 流式模式：chunk 事件若干，最后是一个 complete 或 error 事件。
     * 不支持流式的档位按批量生成，结果以单个 chunk + complete 下发。
     */
    public Flux<ServerSentEvent<String>> stream(MessageCommand command) {
        PreparedMessage prepared;
        try {
            prepared = prepare(command);
        } catch (ConversationPipelineException e) {
            return Flux.just(sseError(e));
        }

        if (!command.tier().supportsStreaming()) {
            return Flux.defer(() -> {
                        try {
                            MessageExchangeResponse response = runLocked(prepared);
                            return Flux.just(chunkEvent(response.getAiMessage().getContent()), completeEvent(response));
                        } catch (ConversationPipelineException e) {
                            return Flux.just(sseError(e));
                        }
                    })
                    .onErrorResume(e -> Flux.just(failureEvent(prepared, e)))
                    .subscribeOn(Schedulers.boundedElastic());
        }

        return Flux.using(
                        () -> lockRegistry.acquire(prepared.conversationId()),
                        lease -> streamExchange(prepared),
                        ConversationLockRegistry.Lease::close)
                .onErrorResume(e -> Flux.just(failureEvent(prepared, e)))
                .subscribeOn(Schedulers.boundedElastic());
    }

    // ==================== 私有：锁外阶段 ====================

    private PreparedMessage prepare(MessageCommand command) {
        // ---------- 0. 会话解析与归属 ----------
        Analysis analysis = analysisService.requireOwnedAnalysis(command.analysisId(), command.userId());
        String conversationId = conversationStore
                .getOrCreateConversation(analysis.getId(), command.userId())
                .conversation()
                .getId();
        GuardContext ctx = new GuardContext(command.userId(), conversationId, command.ipAddress(), command.userAgent());

        // ---------- 1. 限流预占 ----------
        RateLimitDecision decision = rateLimiter.checkAndReserve(command.userId(), conversationId, command.tier());
        if (!decision.isAllowed()) {
            throw new QuotaExceededException(decision);
        }

        try {
            // ---------- 2. 校验与清洗 ----------
            InputValidationResult validation = inputGuard.validate(command.content(), command.tier(), ctx);
            if (!validation.valid()) {
                throw new ValidationFailedException(validation.reason());
            }
            String sanitized = validation.sanitizedText();

            // ---------- 3. 注入检测 ----------
            if (injectionDetector.detect(sanitized, ctx).injection()) {
                throw new InjectionDetectedException(InjectionDetector.USER_MESSAGE);
            }

            // ---------- 4. 内容审核 ----------
            ModerationResult moderation = contentModerator.moderateUserInput(sanitized, command.userId(), ctx);
            if (!moderation.approved()) {
                throw new ContentRejectedException(ContentModerator.USER_MESSAGE);
            }

            return new PreparedMessage(command, analysis, conversationId, sanitized, decision);
        } catch (ConversationPipelineException e) {
            rateLimiter.release(command.userId(), conversationId, decision);
            log.info("Message rejected before generation: conversationId={}, userId={}, code={}",
                    conversationId, command.userId(), e.getErrorCode().code());
            throw e;
        }
    }

    // ==================== 私有：批量 ====================

    private MessageExchangeResponse runLocked(PreparedMessage prepared) {
        try (ConversationLockRegistry.Lease ignored = lockRegistry.acquire(prepared.conversationId())) {
            return toResponse(exchange(prepared));
        } catch (ConversationBusyException | GenerationFailedException e) {
            rateLimiter.release(prepared.userId(), prepared.conversationId(), prepared.decision());
            throw e;
        }
    }

    private CompletedExchange exchange(PreparedMessage p) {
        List<Message> history = conversationStore.getRecentMessages(p.conversationId(),
                properties.getContext().getHistoryLimit());

        // ---------- 5. 去重 ----------
        SimilarityResult similarity = checkDuplicate(p, history);
        if (similarity.similar()) {
            return persistExchange(p, similarity.cachedResponse(), GenerationMetadata.ZERO, similarity);
        }

        // ---------- 6. 上下文 ----------
        ContextWindow window = buildContext(p, history);

        // ---------- 7. 生成 ----------
        GenerationResult result = generateWithDeadline(p, window);

        // ---------- 8. 落库 ----------
        return persistExchange(p, result.content(), result.metadata(), null);
    }

    private GenerationResult generateWithDeadline(PreparedMessage p, ContextWindow window) {
        Duration timeout = properties.getGeneration().getTimeout();
        GenerationResult result;
        try {
            result = generationClient.generate(window)
                    .timeout(timeout)
                    .onErrorMap(TimeoutException.class,
                            e -> GenerationFailedException.timeout("Generation timed out after " + timeout.toMillis() + "ms"))
                    .onErrorMap(e -> !(e instanceof GenerationFailedException), GenerationFailedException::backend)
                    .block();
        } catch (GenerationFailedException e) {
            log.error("Generation failed: conversationId={}, userId={}, kind={}, error={}",
                    p.conversationId(), p.userId(), e.getKind(), e.getMessage(), e);
            throw e;
        }
        if (result == null || result.content() == null || result.content().isBlank()) {
            log.error("Generation returned no content: conversationId={}, userId={}", p.conversationId(), p.userId());
            throw GenerationFailedException.backend(new IllegalStateException("empty response from model"));
        }
        return result;
    }

    // ==================== 私有：流式 ====================

    private Flux<ServerSentEvent<String>> streamExchange(PreparedMessage p) {
        return Flux.defer(() -> {
            List<Message> history = conversationStore.getRecentMessages(p.conversationId(),
                    properties.getContext().getHistoryLimit());

            SimilarityResult similarity = checkDuplicate(p, history);
            if (similarity.similar()) {
                CompletedExchange done = persistExchange(p, similarity.cachedResponse(), GenerationMetadata.ZERO, similarity);
                return Flux.just(chunkEvent(similarity.cachedResponse()), completeEvent(toResponse(done)));
            }

            ContextWindow window = buildContext(p, history);
            long startMs = System.currentTimeMillis();
            StringBuilder contentAccumulator = new StringBuilder();
            AtomicReference<Integer> promptTokensRef = new AtomicReference<>();
            AtomicReference<Integer> completionTokensRef = new AtomicReference<>();
            // 完成、出错或取消三者只处理其一
            AtomicBoolean settled = new AtomicBoolean(false);

            Flux<ServerSentEvent<String>> chunkFlux = withStreamingDeadlines(generationClient.generateStreaming(window))
                    .doOnNext(c -> captureUsage(c, promptTokensRef, completionTokensRef))
                    .filter(GenerationChunk::hasText)
                    .map(GenerationChunk::text)
                    .doOnNext(contentAccumulator::append)
                    .map(this::chunkEvent);

            Flux<ServerSentEvent<String>> completeFlux = Flux.defer(() -> {
                settled.set(true);
                String content = contentAccumulator.toString();
                if (content.isBlank()) {
                    throw GenerationFailedException.backend(new IllegalStateException("empty response from model"));
                }
                GenerationMetadata metadata = streamingMetadata(window, content, startMs,
                        promptTokensRef.get(), completionTokensRef.get());
                return Flux.just(completeEvent(toResponse(persistExchange(p, content, metadata, null))));
            });

            return chunkFlux
                    .concatWith(completeFlux)
                    .doOnError(e -> settled.set(true))
                    .doOnCancel(() -> {
                        if (settled.compareAndSet(false, true)) {
                            String partial = contentAccumulator.toString();
                            persistCancelled(p, partial, streamingMetadata(window, partial, startMs,
                                    promptTokensRef.get(), completionTokensRef.get()));
                        }
                    });
        });
    }

    /** 首个分片与相邻分片之间的空闲上限，以及整体截止时间 */
    private Flux<GenerationChunk> withStreamingDeadlines(Flux<GenerationChunk> source) {
        Duration total = properties.getGeneration().getTimeout();
        Duration idle = properties.getGeneration().getIdleChunkTimeout();
        long deadlineNanos = System.nanoTime() + total.toNanos();
        return source
                .timeout(Mono.delay(shorter(idle, total)),
                        chunk -> Mono.delay(shorter(idle, Duration.ofNanos(Math.max(0, deadlineNanos - System.nanoTime())))))
                .onErrorMap(TimeoutException.class, e -> GenerationFailedException.timeout(
                        "Generation stalled or exceeded the " + total.toMillis() + "ms deadline"));
    }

    private void persistCancelled(PreparedMessage p, String partialContent, GenerationMetadata metadata) {
        try {
            Message userMessage = userMessage(p);
            Message assistant = assistantMessage(p, partialContent, metadata, null);
            assistant.setStatus(Message.STATUS_CANCELLED);
            conversationStore.appendExchange(userMessage, assistant);
            log.info("Stream cancelled by client: conversationId={}, userMessageId={}, messageId={}, partialChars={}",
                    p.conversationId(), userMessage.getId(), assistant.getId(), partialContent.length());
            recordUsageAsync(p, assistant, metadata, false);
        } catch (RuntimeException e) {
            log.error("Failed to persist cancelled exchange: conversationId={}, userId={}",
                    p.conversationId(), p.userId(), e);
        }
    }

    private ServerSentEvent<String> failureEvent(PreparedMessage p, Throwable e) {
        ConversationPipelineException failure;
        if (e instanceof ConversationPipelineException pipelineException) {
            failure = pipelineException;
        } else {
            failure = new ConversationPipelineException(ErrorCode.PERSISTENCE_FAILED,
                    "Internal error while processing the message", e);
        }
        if (!(failure instanceof PersistenceFailedException)) {
            // 未落库：退还额度
            rateLimiter.release(p.userId(), p.conversationId(), p.decision());
        }
        if (failure.getErrorCode().isClientCaused()) {
            log.info("Stream rejected: conversationId={}, userId={}, code={}",
                    p.conversationId(), p.userId(), failure.getErrorCode().code());
        } else {
            log.error("Stream failed: conversationId={}, userId={}, code={}, error={}",
                    p.conversationId(), p.userId(), failure.getErrorCode().code(), failure.getMessage(), failure);
        }
        return sseError(failure);
    }

    // ==================== 私有：共用阶段 ====================

    private SimilarityResult checkDuplicate(PreparedMessage p, List<Message> history) {
        ConversationProperties.Dedup dedup = properties.getDedup();
        if (!dedup.isEnabled()) {
            return SimilarityResult.miss(0.0);
        }
        return deduplicationCache.findSimilarQuery(p.conversationId(), p.sanitizedText(), history, dedup.getThreshold());
    }

    private ContextWindow buildContext(PreparedMessage p, List<Message> history) {
        ConversationProperties.Context context = properties.getContext();
        AnalysisSummary summary = analysisService.loadSummary(p.analysis(), context.getSummaryGapLimit());
        return contextWindowBuilder.buildContext(summary, history, p.sanitizedText(), context.getMaxTokens());
    }

    private CompletedExchange persistExchange(PreparedMessage p, String content, GenerationMetadata metadata,
                                              SimilarityResult similarity) {
        boolean cached = similarity != null;
        Message userMessage = userMessage(p);
        Message aiMessage = assistantMessage(p, content, metadata, similarity);
        try {
            conversationStore.appendExchange(userMessage, aiMessage);
        } catch (RuntimeException e) {
            log.error("Failed to persist exchange: conversationId={}, userId={}, cached={}",
                    p.conversationId(), p.userId(), cached, e);
            throw new PersistenceFailedException(p.conversationId(), content, metadata, e);
        }

        if (!cached) {
            deduplicationCache.cacheQueryResponse(p.sanitizedText(), content, p.conversationId());
        }
        log.info("Message exchange completed: conversationId={}, messageId={}, cached={}, tokensIn={}, tokensOut={}, latencyMs={}, remaining={}",
                p.conversationId(), aiMessage.getId(), cached, metadata.tokensIn(), metadata.tokensOut(),
                metadata.processingTimeMs(), p.decision().getRemaining());
        recordUsageAsync(p, aiMessage, metadata, cached);
        return new CompletedExchange(userMessage, aiMessage, p.decision(), cached,
                cached ? similarity.similarity() : null);
    }

    private static Message userMessage(PreparedMessage p) {
        Message m = new Message();
        m.setId(IdSupport.newId("msg_"));
        m.setConversationId(p.conversationId());
        m.setRole(Message.ROLE_USER);
        m.setContent(p.sanitizedText());
        m.setStatus(Message.STATUS_DONE);
        m.setCreatedAt(LocalDateTime.now());
        return m;
    }

    private static Message assistantMessage(PreparedMessage p, String content, GenerationMetadata metadata,
                                            SimilarityResult similarity) {
        Message m = new Message();
        m.setId(IdSupport.newId("msg_"));
        m.setConversationId(p.conversationId());
        m.setRole(Message.ROLE_ASSISTANT);
        m.setContent(content != null ? content : "");
        m.setStatus(Message.STATUS_DONE);
        m.setPromptTokens(metadata.tokensIn());
        m.setCompletionTokens(metadata.tokensOut());
        m.setProcessingTimeMs(metadata.processingTimeMs());
        m.setCached(similarity != null);
        m.setSimilarity(similarity != null ? similarity.similarity() : null);
        m.setFlagged(false);
        m.setCreatedAt(LocalDateTime.now());
        return m;
    }

    /** 统计与用量写入不阻塞响应，失败只记日志 */
    private void recordUsageAsync(PreparedMessage p, Message aiMessage, GenerationMetadata metadata, boolean cached) {
        Schedulers.boundedElastic().schedule(() -> {
            try {
                conversationStore.recordExchange(p.conversationId(), metadata.totalTokens(), metadata.processingTimeMs());
                usageService.record(aiMessage.getId(), p.conversationId(), p.userId(),
                        cached ? null : generationClient.modelName(), (int) metadata.processingTimeMs(),
                        metadata.tokensIn(), metadata.tokensOut(), cached);
            } catch (RuntimeException e) {
                log.warn("Usage recording failed: conversationId={}, messageId={}, error={}",
                        p.conversationId(), aiMessage.getId(), e.getMessage());
            }
        });
    }

    private GenerationMetadata streamingMetadata(ContextWindow window, String content, long startMs,
                                                 Integer promptTokens, Integer completionTokens) {
        int tokensIn = promptTokens != null ? promptTokens : window.totalTokens();
        int tokensOut = completionTokens != null ? completionTokens : tokenEstimator.estimate(content);
        return new GenerationMetadata(System.currentTimeMillis() - startMs, tokensIn, tokensOut);
    }

    private static void captureUsage(GenerationChunk chunk, AtomicReference<Integer> promptRef,
                                     AtomicReference<Integer> completionRef) {
        if (chunk.promptTokens() != null) {
            promptRef.set(chunk.promptTokens());
        }
        if (chunk.completionTokens() != null) {
            completionRef.set(chunk.completionTokens());
        }
    }

    private static Duration shorter(Duration a, Duration b) {
        return a.compareTo(b) <= 0 ? a : b;
    }

    private static MessageExchangeResponse toResponse(CompletedExchange done) {
        return MessageExchangeResponse.builder()
                .userMessage(MessageDto.from(done.userMessage()))
                .aiMessage(MessageDto.from(done.aiMessage()))
                .rateLimit(done.rateLimit())
                .cached(done.cached() ? Boolean.TRUE : null)
                .similarity(done.similarity())
                .build();
    }

    // ==================== 私有：SSE 事件 ====================

    private ServerSentEvent<String> chunkEvent(String text) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("type", "chunk");
        payload.put("content", text);
        return ServerSentEvent.<String>builder(toJson(payload)).event("chunk").build();
    }

    private ServerSentEvent<String> completeEvent(MessageExchangeResponse response) {
        MessageDto ai = response.getAiMessage();
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("processingTimeMs", ai.getProcessingTimeMs());
        metadata.put("tokensIn", ai.getTokensIn());
        metadata.put("tokensOut", ai.getTokensOut());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("type", "complete");
        payload.put("messageId", ai.getId());
        payload.put("userMessageId", response.getUserMessage().getId());
        payload.put("metadata", metadata);
        payload.put("rateLimit", response.getRateLimit());
        if (response.getCached() != null) {
            payload.put("cached", response.getCached());
            payload.put("similarity", response.getSimilarity());
        }
        return ServerSentEvent.<String>builder(toJson(payload)).event("complete").build();
    }

    private ServerSentEvent<String> sseError(ConversationPipelineException e) {
        Map<String, Object> error = new LinkedHashMap<>();
        error.put("code", e.getErrorCode().code());
        error.put("message", e instanceof GenerationFailedException ? GENERATION_FAILED_MESSAGE : e.getMessage());
        Map<String, Object> details = e.details();
        if (!details.isEmpty()) {
            error.put("details", details);
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("type", "error");
        payload.put("error", error);
        return ServerSentEvent.<String>builder(toJson(payload)).event("error").build();
    }

    private String toJson(Map<String, ?> map) {
        try {
            return objectMapper.writeValueAsString(map);
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize SSE payload: {}", e.getMessage());
            return "{}";
        }
    }

    // ==================== 内部类型 ====================

    private record PreparedMessage(MessageCommand command, Analysis analysis, String conversationId,
                                   String sanitizedText, RateLimitDecision decision) {

        String userId() {
            return command.userId();
        }
    }

    private record CompletedExchange(Message userMessage, Message aiMessage, RateLimitDecision rateLimit,
                                     boolean cached, Double similarity) {
    }
}
