package com.scorebot.scoring;

import org.apache.commons.math3.stat.ranking.NaNStrategy;
import org.apache.commons.math3.stat.ranking.NaturalRanking;
import org.apache.commons.math3.stat.ranking.TiesStrategy;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mid-rank percentile of each value within its set: ties share the average of their ranks.
 */
public final class PercentileRanker {
    private static final NaturalRanking RANKING = new NaturalRanking(NaNStrategy.FAILED, TiesStrategy.AVERAGE);

    private PercentileRanker() {
    }

    /**
     * @param values keyed values; null values are skipped and get no rank
     * @return rank in [0,100] per key, in input order
     */
    public static <K> Map<K, Double> rank(Map<K, Double> values) {
        List<K> keys = new ArrayList<>();
        List<Double> finite = new ArrayList<>();
        for (Map.Entry<K, Double> entry : values.entrySet()) {
            Double value = entry.getValue();
            if (value != null && Double.isFinite(value)) {
                keys.add(entry.getKey());
                finite.add(value);
            }
        }
        Map<K, Double> out = new LinkedHashMap<>();
        int n = finite.size();
        if (n == 0) {
            return out;
        }
        double[] data = new double[n];
        for (int i = 0; i < n; i++) {
            data[i] = finite.get(i);
        }
        double[] ranks = RANKING.rank(data);
        for (int i = 0; i < n; i++) {
            out.put(keys.get(i), (ranks[i] - 0.5) / n * 100.0);
        }
        return out;
    }
}
