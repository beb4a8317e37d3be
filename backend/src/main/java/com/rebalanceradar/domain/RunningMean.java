package com.rebalanceradar.domain;

import org.bson.Document;

import java.util.List;

/**
 * Builds the $set fields of an aggregation-pipeline update that adds one sample to a running mean:
 * mean' = (mean * n + x) / (n + 1) and n' = n + 1. Both expressions read the pre-update document,
 * so the pair is applied atomically.
 */
final class RunningMean {

    private RunningMean() {
    }

    static Document fold(String meanField, String countField, double sample) {
        Document mean = new Document("$ifNull", List.of("$" + meanField, 0.0));
        Document count = new Document("$ifNull", List.of("$" + countField, 0L));
        Document nextCount = new Document("$add", List.of(count, 1L));
        Document nextMean = new Document("$divide", List.of(
                new Document("$add", List.of(new Document("$multiply", List.of(mean, count)), sample)),
                nextCount));
        return new Document(meanField, nextMean).append(countField, nextCount);
    }
}
