package com.imperium.unbuilt.guard;

public record ReportAbuseCheck(boolean abusive, long reportCount) {
}
