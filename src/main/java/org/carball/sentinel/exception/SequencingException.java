package org.carball.sentinel.exception;

/**
 * A measurement phase was invoked out of order: an after snapshot without a before snapshot, or a
 * second before snapshot for the same recommendation.
 */
public class SequencingException extends SentinelException {

    private final String recommendationId;

    public SequencingException(String recommendationId, String message) {
        super(message);
        this.recommendationId = recommendationId;
    }

    public String getRecommendationId() {
        return recommendationId;
    }
}
