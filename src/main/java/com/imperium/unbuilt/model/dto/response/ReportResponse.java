package com.imperium.unbuilt.model.dto.response;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class ReportResponse {

    private String reportId;

    /** 新举报固定为 pending */
    private String status;

    private String message;
}
