package com.rebalanceradar.domain;

import org.bson.Document;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class RunningMeanTest {

    @Test
    void fold_appliedPerSample_tracksMeanAfterEachOne() {
        Map<String, Object> strategy = new HashMap<>();

        applyFold(strategy, 2.0);
        assertThat((double) strategy.get("averageDrift")).isCloseTo(2.0, within(1e-9));
        assertThat(strategy.get("totalRebalances")).isEqualTo(1L);

        applyFold(strategy, 4.0);
        assertThat((double) strategy.get("averageDrift")).isCloseTo(3.0, within(1e-9));
        assertThat(strategy.get("totalRebalances")).isEqualTo(2L);

        applyFold(strategy, 6.0);
        assertThat((double) strategy.get("averageDrift")).isCloseTo(4.0, within(1e-9));
        assertThat(strategy.get("totalRebalances")).isEqualTo(3L);
    }

    @Test
    void fold_bothFieldsReadThePreUpdateCount() {
        Document set = RunningMean.fold("averageDrift", "totalRebalances", 9.0);

        Document nextCount = (Document) set.get("totalRebalances");
        Document nextMean = (Document) set.get("averageDrift");
        assertThat(nextMean.getList("$divide", Object.class).get(1)).isEqualTo(nextCount);
        assertThat(nextCount.getList("$add", Object.class)).containsExactly(
                new Document("$ifNull", List.of("$totalRebalances", 0L)), 1L);
    }

    /** Evaluates both expressions against the same snapshot, as a pipeline $set does. */
    private static void applyFold(Map<String, Object> doc, double sample) {
        Document set = RunningMean.fold("averageDrift", "totalRebalances", sample);
        Map<String, Object> snapshot = new HashMap<>(doc);
        doc.put("averageDrift", ((Number) eval(set.get("averageDrift"), snapshot)).doubleValue());
        doc.put("totalRebalances", ((Number) eval(set.get("totalRebalances"), snapshot)).longValue());
    }

    private static Object eval(Object expr, Map<String, Object> doc) {
        if (expr instanceof String path && path.startsWith("$")) {
            return doc.get(path.substring(1));
        }
        if (!(expr instanceof Document op)) {
            return expr;
        }
        String name = op.keySet().iterator().next();
        List<?> args = op.getList(name, Object.class);
        Object first = eval(args.get(0), doc);
        Object second = eval(args.get(1), doc);
        switch (name) {
            case "$ifNull":
                return first != null ? first : second;
            case "$add":
                if (first instanceof Long a && second instanceof Long b) {
                    return a + b;
                }
                return ((Number) first).doubleValue() + ((Number) second).doubleValue();
            case "$multiply":
                return ((Number) first).doubleValue() * ((Number) second).doubleValue();
            case "$divide":
                return ((Number) first).doubleValue() / ((Number) second).doubleValue();
            default:
                throw new IllegalArgumentException("Unsupported operator " + name);
        }
    }
}
