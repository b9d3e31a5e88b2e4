package com.ai.screening.service;

import com.ai.screening.dto.ChatTurn;
import com.ai.screening.dto.GenerationResult;

import java.util.List;

/**
 * Language-model capability used by the screening flow.
 * Implementations report timeouts and upstream errors as failed results instead of throwing.
 */
public interface ResponseGenerator {

    GenerationResult generate(String systemPrompt, List<ChatTurn> history, String newMessage);
}
