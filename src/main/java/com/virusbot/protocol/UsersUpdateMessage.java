package com.virusbot.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record UsersUpdateMessage(List<UserInfo> users) implements ServerMessage {

    @Override
    public MessageType type() {
        return MessageType.USERS_UPDATE;
    }

    public int userCount() {
        return users == null ? 0 : users.size();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record UserInfo(String id, String name, String status, String lobbyId) {
    }
}
