package com.imperium.unbuilt.model.dto.analysis;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GapSummary {

    private String title;

    private String description;

    private String category;

    /** 创新分 0~100 */
    private Integer score;

    /** high | medium | low */
    private String feasibility;

    private String marketPotential;
}
