package com.imperium.unbuilt.service;

import com.imperium.unbuilt.model.dto.analysis.AnalysisSummary;
import com.imperium.unbuilt.model.dto.analysis.GapSummary;
import com.imperium.unbuilt.model.dto.response.VariantComparisonResponse;
import com.imperium.unbuilt.model.dto.response.VariantComparisonResponse.KeyDifference;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class VariantComparatorTest {

    private final VariantComparator comparator = new VariantComparator();

    @Test
    void prefersVariantWhenMoreInnovativeAndAtLeastAsFeasible() {
        VariantComparisonResponse result = comparator.compare(
                summary("a1", 70, "medium", "$2B", "Reptile coverage", "Bird coverage"),
                summary("a2", 82, "high", "$3B", "bird coverage", "Vet network"),
                Map.of());

        assertThat(result.getOriginalAnalysisId()).isEqualTo("a1");
        assertThat(result.getVariantAnalysisId()).isEqualTo("a2");
        assertThat(result.getInnovationScoreDelta()).isEqualTo(12);
        assertThat(result.getFeasibilityChange().getOriginal()).isEqualTo("medium");
        assertThat(result.getFeasibilityChange().getVariant()).isEqualTo("high");
        assertThat(result.getPreferredVariant()).isEqualTo("variant");
        assertThat(result.getKeyDifferences())
                .extracting(KeyDifference::getAspect, KeyDifference::getImpact)
                .contains(
                        tuple("Innovation Score", VariantComparator.IMPACT_POSITIVE),
                        tuple("Feasibility", VariantComparator.IMPACT_POSITIVE),
                        tuple("Market Size", VariantComparator.IMPACT_NEUTRAL));
        assertThat(result.getSummary()).contains("rises by 12 points");
        assertThat(result.getRecommendations()).hasSize(3);
    }

    @Test
    void diffsGapTitlesIgnoringCase() {
        VariantComparisonResponse result = comparator.compare(
                summary("a1", 70, "medium", null, "Reptile coverage", "Bird coverage"),
                summary("a2", 70, "medium", null, "bird coverage", "Vet network"),
                null);

        assertThat(result.getGapsAdded()).containsExactly("Vet network");
        assertThat(result.getGapsRemoved()).containsExactly("Reptile coverage");
        assertThat(result.getGapsShared()).containsExactly("bird coverage");
        assertThat(result.getPreferredVariant()).isEqualTo("both");
    }

    @Test
    void listsParameterChangesWithReadableNames() {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("targetAudience", "reptile breeders");
        params.put("price_point", "$15/month");

        VariantComparisonResponse result = comparator.compare(
                summary("a1", 70, "medium", null), summary("a2", 70, "medium", null), params);

        assertThat(result.getParameterChanges()).hasSize(2);
        assertThat(result.getParameterChanges().get(0).getOriginal()).isEqualTo("Not specified");
        assertThat(result.getKeyDifferences()).extracting(KeyDifference::getAspect)
                .contains("Target Audience", "Price point");
        assertThat(result.getSummary()).contains("2 parameter(s) changed");
    }

    @Test
    void prefersOriginalWhenVariantLosesInnovation() {
        VariantComparisonResponse result = comparator.compare(
                summary("a1", 80, "medium", null), summary("a2", 70, "medium", null), Map.of());

        assertThat(result.getPreferredVariant()).isEqualTo("original");
        assertThat(result.getReasoning()).contains("original");
    }

    @Test
    void mixedSignalsPreferBoth() {
        assertThat(comparator.compare(summary("a1", 70, "high", null), summary("a2", 90, "low", null), Map.of())
                .getPreferredVariant()).isEqualTo("both");
        assertThat(comparator.compare(summary("a1", 70, "medium", null), summary("a2", 73, "medium", null), Map.of())
                .getPreferredVariant()).isEqualTo("both");
        VariantComparisonResponse unscored = comparator.compare(
                summary("a1", null, null, null), summary("a2", 73, null, null), Map.of());
        assertThat(unscored.getPreferredVariant()).isEqualTo("both");
        assertThat(unscored.getInnovationScoreDelta()).isNull();
        assertThat(unscored.getFeasibilityChange()).isNull();
    }

    @Test
    void humanizesParameterKeys() {
        assertThat(VariantComparator.humanize("targetAudience")).isEqualTo("Target Audience");
        assertThat(VariantComparator.humanize("region")).isEqualTo("Region");
        assertThat(VariantComparator.humanize("price_point")).isEqualTo("Price point");
    }

    private static AnalysisSummary summary(String id, Integer innovation, String feasibility, String marketSize,
                                           String... gaps) {
        return AnalysisSummary.builder()
                .analysisId(id)
                .innovationScore(innovation)
                .feasibilityRating(feasibility)
                .marketSize(marketSize)
                .topGaps(Arrays.stream(gaps).map(t -> GapSummary.builder().title(t).build()).toList())
                .build();
    }
}
