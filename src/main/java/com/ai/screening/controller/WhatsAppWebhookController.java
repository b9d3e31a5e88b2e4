package com.ai.screening.controller;

import com.ai.screening.dto.EvolutionWebhookPayload;
import com.ai.screening.dto.ScreeningResult;
import com.ai.screening.service.LeadScreeningOrchestrator;
import com.ai.screening.utils.PhoneNumbers;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Receives Evolution API (WhatsApp) webhooks and hands customer messages to the screening flow.
 */
@RestController
@RequestMapping("/api/webhooks")
public class WhatsAppWebhookController {

    private static final Logger log = LoggerFactory.getLogger(WhatsAppWebhookController.class);

    private final LeadScreeningOrchestrator orchestrator;
    private final ObjectMapper mapper;
    private final String webhookSecret;

    public WhatsAppWebhookController(LeadScreeningOrchestrator orchestrator,
                                     ObjectMapper mapper,
                                     @Value("${webhook.secret:}") String webhookSecret) {
        this.orchestrator = orchestrator;
        this.mapper = mapper;
        this.webhookSecret = webhookSecret;
    }

    @PostMapping("/evolution")
    public ResponseEntity<Map<String, Object>> evolution(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @RequestBody(required = false) String rawBody) {

        if (!isAuthorized(authorization)) {
            log.warn("Webhook authentication failed");
            return error(HttpStatus.UNAUTHORIZED, "unauthorized", "Invalid authentication token");
        }

        EvolutionWebhookPayload payload;
        try {
            payload = StringUtils.isBlank(rawBody) ? null : mapper.readValue(rawBody, EvolutionWebhookPayload.class);
        } catch (JsonProcessingException ex) {
            log.error("Webhook payload rejected: {}", ex.getOriginalMessage());
            return error(HttpStatus.BAD_REQUEST, "validation_error", "Invalid payload");
        }
        if (payload == null || payload.getEvent() == null || payload.getData() == null
                || payload.getData().getMessages() == null) {
            return error(HttpStatus.BAD_REQUEST, "validation_error", "Invalid payload");
        }

        if (!payload.isMessageEvent()) {
            log.debug("Ignoring webhook event={}", payload.getEvent());
            return ok(0);
        }

        int processed = 0;
        for (EvolutionWebhookPayload.Message message : payload.getData().getMessages()) {
            if (message.isFromMe()) {
                continue;
            }
            ScreeningResult result = orchestrator.receiveMessage(
                    message.getRemoteJid(), StringUtils.defaultString(message.getConversation()));
            log.info("Webhook message processed phone={} success={} error={}",
                    result.getPhone() != null ? PhoneNumbers.mask(result.getPhone()) : message.getRemoteJid(),
                    result.isSuccess(), result.getError());
            processed++;
        }
        return ok(processed);
    }

    /** Evolution API pings the URL with GET when the webhook is configured. */
    @GetMapping("/evolution")
    public ResponseEntity<Map<String, Object>> verify() {
        log.info("Webhook verification request");
        return ResponseEntity.ok(Map.of("status", "ok"));
    }

    private boolean isAuthorized(String authorization) {
        if (StringUtils.isBlank(webhookSecret)) {
            log.error("webhook.secret is not set; rejecting webhook calls");
            return false;
        }
        if (authorization == null || !authorization.startsWith("Bearer ")) {
            return false;
        }
        String token = authorization.substring("Bearer ".length()).trim();
        return MessageDigest.isEqual(token.getBytes(StandardCharsets.UTF_8),
                webhookSecret.getBytes(StandardCharsets.UTF_8));
    }

    private static ResponseEntity<Map<String, Object>> ok(int processed) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "ok");
        body.put("processed", processed);
        return ResponseEntity.ok(body);
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String error, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", error);
        body.put("code", status.value());
        body.put("message", message);
        return ResponseEntity.status(status).body(body);
    }
}
