package org.agentworld.node.processes.http.api.dto;

public record MessageResponseDto(String message) {
}
