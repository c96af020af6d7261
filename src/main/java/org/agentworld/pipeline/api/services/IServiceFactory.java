package org.agentworld.pipeline.api.services;

/**
 * Creates a fresh instance of a configured service. Every (re)start uses a new instance.
 */
@FunctionalInterface
public interface IServiceFactory {
    IService create();
}
