package com.community.movierating.guard;

import lombok.Value;

/**
 * Identifies one corrective reaction removal: whose reaction, on which message, which symbol.
 */
@Value
public class SelfActionKey {

    Long userId;

    Long messageId;

    String emoji;
}
