package com.imperium.unbuilt.model.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 原分析与变体分析的结构化对比。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class VariantComparisonResponse {

    private String originalAnalysisId;

    private String variantAnalysisId;

    private String summary;

    /** 变体创新分 - 原创新分，任一缺失时为 null */
    private Integer innovationScoreDelta;

    private FeasibilityChange feasibilityChange;

    private List<String> gapsAdded;

    private List<String> gapsRemoved;

    private List<String> gapsShared;

    private List<ParameterChange> parameterChanges;

    private List<KeyDifference> keyDifferences;

    private List<String> recommendations;

    /** original | variant | both */
    private String preferredVariant;

    private String reasoning;

    @Data
    @AllArgsConstructor
    @NoArgsConstructor
    public static class FeasibilityChange {
        private String original;
        private String variant;
    }

    @Data
    @AllArgsConstructor
    @NoArgsConstructor
    public static class ParameterChange {
        private String name;
        private String original;
        private String variant;
    }

    @Data
    @AllArgsConstructor
    @NoArgsConstructor
    public static class KeyDifference {
        private String aspect;
        private String original;
        private String variant;
        /** positive | negative | neutral */
        private String impact;
    }
}
