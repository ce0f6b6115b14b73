package com.streamfirst.dataset.unpublish.adapters;

import com.streamfirst.dataset.unpublish.domain.UnpublishException;
import com.streamfirst.dataset.unpublish.ports.RegistryPort;
import com.streamfirst.dataset.unpublish.ports.RegistryPortFactory;
import lombok.extern.slf4j.Slf4j;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory implementation of RegistryPort for testing and development. Keeps the set of
 * published identifiers and the calls received; rejections and transport faults can be scripted
 * per identifier. Also serves as its own factory, returning itself for every transport.
 */
@Slf4j
public class InMemoryRegistryAdapter implements RegistryPort, RegistryPortFactory {

    /** A call received by the registry. */
    public record Call(String operation, String identifier) {}

    private final Set<String> published = ConcurrentHashMap.newKeySet();
    private final Set<String> retracted = ConcurrentHashMap.newKeySet();
    private final Map<String, String> rejections = new ConcurrentHashMap<>();
    private final Set<String> unreachable = ConcurrentHashMap.newKeySet();
    private final List<Call> calls = new CopyOnWriteArrayList<>();
    private final List<Transport> requestedTransports = new CopyOnWriteArrayList<>();

    @Override
    public RegistryPort create(Transport transport) {
        requestedTransports.add(transport);
        return this;
    }

    @Override
    public void delete(String identifier) {
        receive("delete", identifier);
        published.remove(identifier);
        retracted.remove(identifier);
        log.debug("Deleted {} from registry", identifier);
    }

    @Override
    public void retract(String identifier) {
        receive("retract", identifier);
        if (published.remove(identifier)) {
            retracted.add(identifier);
        }
        log.debug("Retracted {} in registry", identifier);
    }

    @Override
    public String credentialDescription() {
        return "in-memory";
    }

    private void receive(String operation, String identifier) {
        calls.add(new Call(operation, identifier));
        if (unreachable.contains(identifier)) {
            throw UnpublishException.transportFault(
                    "Connection refused", new java.net.ConnectException("Connection refused"));
        }
        String rejection = rejections.get(identifier);
        if (rejection != null) {
            throw UnpublishException.remoteRejection(identifier, rejection);
        }
    }

    public void publish(String identifier) {
        published.add(identifier);
    }

    /** Makes every call for an identifier fail with the given registry message. */
    public void rejectWith(String identifier, String message) {
        rejections.put(identifier, message);
    }

    /** Makes every call for an identifier fail as if the registry could not be reached. */
    public void failTransportFor(String identifier) {
        unreachable.add(identifier);
    }

    public boolean isPublished(String identifier) {
        return published.contains(identifier);
    }

    public boolean isRetracted(String identifier) {
        return retracted.contains(identifier);
    }

    public List<Call> getCalls() {
        return List.copyOf(calls);
    }

    public List<Transport> getRequestedTransports() {
        return List.copyOf(requestedTransports);
    }
}
