package org.agentworld.runtime.model;

/**
 * An entity removed from the live world. Archived entities are kept so historical references
 * stay resolvable; they are never modified again.
 *
 * @param entity     The entity as it was when it was archived.
 * @param archivedAt Epoch millis of the archival.
 * @param reason     Why the entity was archived.
 * @param <T>        Entity type.
 */
public record ArchiveEntry<T>(T entity, long archivedAt, String reason) {
}
