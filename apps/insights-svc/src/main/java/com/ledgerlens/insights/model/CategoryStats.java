package com.ledgerlens.insights.model;

public record CategoryStats(int count, double mean, double stdDev) {
}
