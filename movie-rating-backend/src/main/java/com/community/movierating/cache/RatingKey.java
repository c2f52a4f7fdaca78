package com.community.movierating.cache;

import com.community.movierating.dto.RatingContext;
import lombok.Value;

/**
 * Cache key: one item inside one context.
 */
@Value
public class RatingKey {

    String imdbId;

    RatingContext context;

    public static RatingKey of(String imdbId, RatingContext context) {
        return new RatingKey(imdbId, context);
    }
}
