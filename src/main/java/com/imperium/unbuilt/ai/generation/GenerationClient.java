package com.imperium.unbuilt.ai.generation;

import com.imperium.unbuilt.ai.context.ContextWindow;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * 生成后端接缝。
 * <p>
 * 失败以 {@link com.imperium.unbuilt.exception.GenerationFailedException} 结束序列；
 * 超时由调用方施加。流式序列有序、有限，取消订阅会传递到后端请求。
 */
public interface GenerationClient {

    Mono<GenerationResult> generate(ContextWindow context);

    Flux<GenerationChunk> generateStreaming(ContextWindow context);

    /** 用于用量记录的模型名 */
    String modelName();
}
