package com.ai.screening.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.List;

/**
 * Evolution API webhook body, e.g. event "messages.upsert".
 */
@Getter
@Setter
@ToString
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class EvolutionWebhookPayload {

    public static final String MESSAGES_UPSERT = "messages.upsert";

    private String event;

    private MessageData data;

    public boolean isMessageEvent() {
        return MESSAGES_UPSERT.equals(event);
    }

    @Getter
    @Setter
    @ToString
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class MessageData {

        private String instanceId;

        private List<Message> messages = new ArrayList<>();
    }

    @Getter
    @Setter
    @ToString
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Message {

        /** 5511999999999@s.whatsapp.net */
        private String remoteJid;

        private boolean fromMe;

        private String id;

        /** Text body; absent for media messages. */
        private String conversation;
    }
}
