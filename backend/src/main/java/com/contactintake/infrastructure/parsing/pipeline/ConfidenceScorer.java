package com.contactintake.infrastructure.parsing.pipeline;

import org.springframework.stereotype.Component;

/**
 * Completeness score of a parsed contact: name 0.5, phone 0.3, room 0.2, capped at 1.0.
 */
@Component
public class ConfidenceScorer {

    public static final double NAME_WEIGHT = 0.5;
    public static final double PHONE_WEIGHT = 0.3;
    public static final double ROOM_WEIGHT = 0.2;

    public double score(boolean hasName, boolean hasPhone, boolean hasRoom) {
        double score = 0.0;
        if (hasName) {
            score += NAME_WEIGHT;
        }
        if (hasPhone) {
            score += PHONE_WEIGHT;
        }
        if (hasRoom) {
            score += ROOM_WEIGHT;
        }
        return Math.min(1.0, score);
    }
}
