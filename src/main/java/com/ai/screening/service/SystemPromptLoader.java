package com.ai.screening.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Loads versioned system prompts from classpath:prompts/{version}/system.txt.
 */
@Component
public class SystemPromptLoader {

    private static final Logger log = LoggerFactory.getLogger(SystemPromptLoader.class);

    static final String FALLBACK_PROMPT = "Você é um assistente útil. Ajude o usuário.";

    private final String defaultVersion;
    private final Map<String, String> cache = new ConcurrentHashMap<>();

    public SystemPromptLoader(@Value("${screening.prompt-version:v1.0}") String defaultVersion) {
        this.defaultVersion = defaultVersion;
    }

    public String load() {
        return load(defaultVersion);
    }

    public String load(String version) {
        String v = version != null ? version : defaultVersion;
        return cache.computeIfAbsent(v, this::read);
    }

    private String read(String version) {
        Resource resource = new ClassPathResource("prompts/" + version + "/system.txt");
        if (!resource.exists()) {
            log.error("System prompt not found for version={}, using fallback", version);
            return FALLBACK_PROMPT;
        }
        try {
            return StreamUtils.copyToString(resource.getInputStream(), StandardCharsets.UTF_8).trim();
        } catch (IOException ex) {
            log.error("Failed to read system prompt version={}, using fallback", version, ex);
            return FALLBACK_PROMPT;
        }
    }
}
