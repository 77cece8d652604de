package com.chronograph.ingest;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Result of reporting an interaction.
 *
 * @param status        "recorded" or "rejected"
 * @param interactionId event id of the stored interaction (null when rejected)
 * @param error         rejection reason (null when recorded)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record InteractionReceipt(
        String status,
        @JsonProperty("interaction_id") String interactionId,
        String error
) {

    public static InteractionReceipt recorded(String interactionId) {
        return new InteractionReceipt("recorded", interactionId, null);
    }

    public static InteractionReceipt rejected(String error) {
        return new InteractionReceipt("rejected", null, error);
    }

    @JsonIgnore
    public boolean isRecorded() {
        return "recorded".equals(status);
    }
}
