package com.labelops.config;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Immutable, versioned snapshot of every configured client. Consumers keep the snapshot they
 * started with; reloads produce a new instance.
 */
public final class ClientConfigSet {
    private final long version;
    private final Path source;
    private final Map<String, ClientConfig> clients;
    private final List<String> readProblems;

    public ClientConfigSet(long version, Path source, Collection<ClientConfig> clients) {
        this(version, source, clients, List.of());
    }

    ClientConfigSet(long version, Path source, Collection<ClientConfig> clients, List<String> readProblems) {
        this.version = version;
        this.source = source;
        Map<String, ClientConfig> byId = new TreeMap<>();
        for (ClientConfig client : clients) {
            byId.put(client.clientId(), client);
        }
        this.clients = Collections.unmodifiableMap(byId);
        this.readProblems = List.copyOf(readProblems);
    }

    public long version() {
        return version;
    }

    public Optional<Path> source() {
        return Optional.ofNullable(source);
    }

    public List<String> clientIds() {
        return new ArrayList<>(clients.keySet());
    }

    public Collection<ClientConfig> clients() {
        return clients.values();
    }

    public Optional<ClientConfig> find(String clientId) {
        return Optional.ofNullable(clientId == null ? null : clients.get(clientId));
    }

    public ClientConfig get(String clientId) throws UnknownClientException {
        return find(clientId).orElseThrow(() -> new UnknownClientException(clientId));
    }

    public boolean contains(String clientId) {
        return find(clientId).isPresent();
    }

    /**
     * Structural problems found while reading the document (wrong section types, unknown trigger
     * types). Reported together with the validation rules.
     */
    List<String> readProblems() {
        return readProblems;
    }

    ClientConfigSet withVersion(long newVersion) {
        return new ClientConfigSet(newVersion, source, clients.values(), readProblems);
    }
}
