package com.imperium.unbuilt.model.dto.response;

import com.imperium.unbuilt.model.entity.SuggestedQuestion;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SuggestionDto {

    private String id;

    private String text;

    /** market_validation | competitive_analysis | execution_strategy | risk_assessment */
    private String category;

    private Integer priority;

    private boolean used;

    public static SuggestionDto from(SuggestedQuestion q) {
        return SuggestionDto.builder()
                .id(q.getId())
                .text(q.getQuestionText())
                .category(q.getCategory())
                .priority(q.getPriority())
                .used(Boolean.TRUE.equals(q.getUsed()))
                .build();
    }
}
