package com.community.movierating.dto;

import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collections;
import java.util.List;

/**
 * Aggregate of all current ratings for one item in one context.
 */
@Value
public class RatingStats {

    public static final RatingStats EMPTY = new RatingStats(0.0, 0, Collections.emptyList());

    // one decimal, HALF_UP
    double average;

    int count;

    List<Integer> ratingValues;

    public static RatingStats fromValues(List<Integer> values) {
        if (values == null || values.isEmpty()) {
            return EMPTY;
        }
        long sum = 0;
        for (Integer value : values) {
            sum += value;
        }
        BigDecimal average = BigDecimal.valueOf(sum)
                .divide(BigDecimal.valueOf(values.size()), 1, RoundingMode.HALF_UP);
        return new RatingStats(average.doubleValue(), values.size(), List.copyOf(values));
    }

    public boolean isEmpty() {
        return count == 0;
    }
}
