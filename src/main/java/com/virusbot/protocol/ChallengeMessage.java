package com.virusbot.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ChallengeMessage(String challengeId, String fromUserId, String fromUsername) implements ServerMessage {

    @Override
    public MessageType type() {
        return MessageType.CHALLENGE_RECEIVED;
    }
}
