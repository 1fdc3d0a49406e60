package com.imperium.unbuilt.guard;

public record ReportResult(boolean success, String reportId) {

    public static ReportResult failed() {
        return new ReportResult(false, null);
    }
}
