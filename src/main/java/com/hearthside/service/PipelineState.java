package com.hearthside.service;

/**
 * Stages of one request's lifecycle, in the order they are reached.
 */
public enum PipelineState {
    RECEIVED,
    RATE_CHECKED,
    CACHE_CHECKED,
    CACHE_HIT,
    CACHE_MISS,
    BUDGET_CHECKED,
    CALLING,
    USAGE_RECORDED,
    CACHE_STORED,
    RECORDED,
    DONE,
    FAILED
}
