package com.smurthy.ai.insights.extract;

public enum MetricKind {
    CLICKS,
    IMPRESSIONS,
    CTR,
    POSITION
}
