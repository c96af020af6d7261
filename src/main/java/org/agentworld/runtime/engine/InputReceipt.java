package org.agentworld.runtime.engine;

/**
 * Acknowledgement of an accepted submission. The outcome can be polled with the input number.
 */
public record InputReceipt(String worldId, long inputNumber, long receivedAt) {
}
