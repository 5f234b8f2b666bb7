package com.qgen.contract.model;

/**
 * Non-fatal analysis condition. Never aborts an audit; findings touched by it are reported with
 * heuristic confidence.
 */
public record AnalysisWarning(String branch, int line, String message) {
}
