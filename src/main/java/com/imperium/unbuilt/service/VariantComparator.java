package com.imperium.unbuilt.service;

import com.imperium.unbuilt.model.dto.analysis.AnalysisSummary;
import com.imperium.unbuilt.model.dto.analysis.GapSummary;
import com.imperium.unbuilt.model.dto.response.VariantComparisonResponse;
import com.imperium.unbuilt.model.dto.response.VariantComparisonResponse.FeasibilityChange;
import com.imperium.unbuilt.model.dto.response.VariantComparisonResponse.KeyDifference;
import com.imperium.unbuilt.model.dto.response.VariantComparisonResponse.ParameterChange;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 基于规则的变体对比：创新分差、可行性变化、缺口增删、参数变化。
 */
@Component
public class VariantComparator {

    static final String IMPACT_POSITIVE = "positive";
    static final String IMPACT_NEGATIVE = "negative";
    static final String IMPACT_NEUTRAL = "neutral";

    /** 创新分差超过该值才倾向某一方 */
    static final int PREFERENCE_MARGIN = 5;

    public VariantComparisonResponse compare(AnalysisSummary original, AnalysisSummary variant,
                                             Map<String, String> variantParameters) {
        List<KeyDifference> differences = new ArrayList<>();

        Integer delta = null;
        if (original.getInnovationScore() != null && variant.getInnovationScore() != null) {
            delta = variant.getInnovationScore() - original.getInnovationScore();
            differences.add(new KeyDifference("Innovation Score",
                    original.getInnovationScore() + "/100",
                    variant.getInnovationScore() + "/100",
                    impactOf(delta)));
        }

        FeasibilityChange feasibilityChange = null;
        int feasibilityDirection = 0;
        if (original.getFeasibilityRating() != null || variant.getFeasibilityRating() != null) {
            feasibilityChange = new FeasibilityChange(original.getFeasibilityRating(), variant.getFeasibilityRating());
            feasibilityDirection = Integer.compare(feasibilityRank(variant.getFeasibilityRating()),
                    feasibilityRank(original.getFeasibilityRating()));
            if (original.getFeasibilityRating() != null && variant.getFeasibilityRating() != null) {
                differences.add(new KeyDifference("Feasibility",
                        original.getFeasibilityRating(), variant.getFeasibilityRating(), impactOf(feasibilityDirection)));
            }
        }

        if (!Objects.equals(original.getMarketSize(), variant.getMarketSize())
                && original.getMarketSize() != null && variant.getMarketSize() != null) {
            differences.add(new KeyDifference("Market Size", original.getMarketSize(), variant.getMarketSize(), IMPACT_NEUTRAL));
        }

        Set<String> originalGaps = gapTitles(original);
        Set<String> variantGaps = gapTitles(variant);
        List<String> added = variantGaps.stream().filter(t -> !containsIgnoreCase(originalGaps, t)).toList();
        List<String> removed = originalGaps.stream().filter(t -> !containsIgnoreCase(variantGaps, t)).toList();
        List<String> shared = variantGaps.stream().filter(t -> containsIgnoreCase(originalGaps, t)).toList();

        List<ParameterChange> parameterChanges = new ArrayList<>();
        if (variantParameters != null) {
            variantParameters.forEach((name, value) -> {
                parameterChanges.add(new ParameterChange(name, "Not specified", value));
                differences.add(new KeyDifference(humanize(name), "Not specified", value, IMPACT_NEUTRAL));
            });
        }

        String preferred = preferred(delta, feasibilityDirection);
        return VariantComparisonResponse.builder()
                .originalAnalysisId(original.getAnalysisId())
                .variantAnalysisId(variant.getAnalysisId())
                .summary(summary(delta, added.size(), removed.size(), parameterChanges.size()))
                .innovationScoreDelta(delta)
                .feasibilityChange(feasibilityChange)
                .gapsAdded(added)
                .gapsRemoved(removed)
                .gapsShared(shared)
                .parameterChanges(parameterChanges)
                .keyDifferences(differences)
                .recommendations(List.of(
                        "Review the innovation scores and feasibility ratings to assess which variant aligns better with your goals",
                        "Consider the market size and competitive landscape differences",
                        "Evaluate which parameter set matches your resources and capabilities"))
                .preferredVariant(preferred)
                .reasoning(reasoning(preferred))
                .build();
    }

    private static String preferred(Integer delta, int feasibilityDirection) {
        if (delta == null) {
            return "both";
        }
        if (delta > PREFERENCE_MARGIN && feasibilityDirection >= 0) {
            return "variant";
        }
        if (delta < -PREFERENCE_MARGIN && feasibilityDirection <= 0) {
            return "original";
        }
        return "both";
    }

    private static String reasoning(String preferred) {
        return switch (preferred) {
            case "variant" -> "The variant scores higher on innovation without losing feasibility.";
            case "original" -> "The original analysis scores higher on innovation without losing feasibility.";
            default -> "Both analyses provide valuable insights. The choice depends on your specific goals, resources, and market positioning.";
        };
    }

    private static String summary(Integer delta, int added, int removed, int parameters) {
        StringBuilder sb = new StringBuilder("The variant analysis explores the opportunity with modified parameters.");
        if (delta != null && delta != 0) {
            sb.append(" Innovation score ").append(delta > 0 ? "rises" : "drops").append(" by ")
                    .append(Math.abs(delta)).append(" points.");
        }
        if (added > 0 || removed > 0) {
            sb.append(" ").append(added).append(" new gap(s) appear and ").append(removed).append(" drop out.");
        }
        if (parameters > 0) {
            sb.append(" ").append(parameters).append(" parameter(s) changed.");
        }
        return sb.toString();
    }

    private static String impactOf(int direction) {
        if (direction > 0) {
            return IMPACT_POSITIVE;
        }
        return direction < 0 ? IMPACT_NEGATIVE : IMPACT_NEUTRAL;
    }

    private static int feasibilityRank(String rating) {
        if (rating == null) {
            return 0;
        }
        return switch (rating.toLowerCase(Locale.ROOT)) {
            case "high" -> 3;
            case "medium" -> 2;
            case "low" -> 1;
            default -> 0;
        };
    }

    private static Set<String> gapTitles(AnalysisSummary summary) {
        Set<String> titles = new LinkedHashSet<>();
        if (summary.hasGaps()) {
            summary.getTopGaps().stream().map(GapSummary::getTitle).filter(Objects::nonNull).forEach(titles::add);
        }
        return titles;
    }

    private static boolean containsIgnoreCase(Set<String> titles, String title) {
        return titles.stream().anyMatch(t -> t.equalsIgnoreCase(title));
    }

    /** targetAudience -> Target Audience */
    static String humanize(String key) {
        String spaced = key.replaceAll("([a-z])([A-Z])", "$1 $2").replace('_', ' ').trim();
        if (spaced.isEmpty()) {
            return key;
        }
        return Character.toUpperCase(spaced.charAt(0)) + spaced.substring(1);
    }
}
