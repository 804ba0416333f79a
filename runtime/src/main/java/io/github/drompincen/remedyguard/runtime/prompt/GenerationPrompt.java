package io.github.drompincen.remedyguard.runtime.prompt;

public record GenerationPrompt(String system, String user) {}
