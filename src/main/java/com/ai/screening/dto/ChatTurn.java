package com.ai.screening.dto;

import java.util.Objects;

/**
 * Role-tagged turn in the chat history sent to the language model.
 */
public final class ChatTurn {

    public static final String USER = "user";
    public static final String ASSISTANT = "assistant";

    private final String role;
    private final String content;

    public ChatTurn(String role, String content) {
        this.role = Objects.requireNonNull(role, "role");
        this.content = content != null ? content : "";
    }

    public static ChatTurn user(String content) {
        return new ChatTurn(USER, content);
    }

    public static ChatTurn assistant(String content) {
        return new ChatTurn(ASSISTANT, content);
    }

    public String getRole() {
        return role;
    }

    public String getContent() {
        return content;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ChatTurn)) return false;
        ChatTurn other = (ChatTurn) o;
        return role.equals(other.role) && content.equals(other.content);
    }

    @Override
    public int hashCode() {
        return Objects.hash(role, content);
    }

    @Override
    public String toString() {
        return role + ": " + content;
    }
}
