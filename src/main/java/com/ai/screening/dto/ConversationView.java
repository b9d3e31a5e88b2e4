package com.ai.screening.dto;

import com.ai.screening.entity.Conversation;
import lombok.Builder;
import lombok.Getter;

import java.time.Instant;
import java.util.UUID;

@Getter
@Builder
public class ConversationView {

    private final UUID id;
    private final String inboundText;
    private final String outboundText;
    private final Integer tokensInput;
    private final Integer tokensOutput;
    private final Integer tokensTotal;
    private final Integer costCents;
    private final Long latencyMs;
    private final Instant timestamp;

    public static ConversationView from(Conversation c) {
        return ConversationView.builder()
                .id(c.getId())
                .inboundText(c.getInboundText())
                .outboundText(c.getOutboundText())
                .tokensInput(c.getTokensInput())
                .tokensOutput(c.getTokensOutput())
                .tokensTotal(c.getTokensTotal())
                .costCents(c.getCostCents())
                .latencyMs(c.getLatencyMs())
                .timestamp(c.getTimestamp())
                .build();
    }
}
