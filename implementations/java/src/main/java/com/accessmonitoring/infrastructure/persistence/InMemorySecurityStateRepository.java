package com.accessmonitoring.infrastructure.persistence;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Keeps the last snapshot for the lifetime of the process.
 */
public class InMemorySecurityStateRepository implements SecurityStateRepository {

    private final AtomicReference<SecurityStateSnapshot> latest = new AtomicReference<>();

    @Override
    public void save(SecurityStateSnapshot snapshot) {
        latest.set(snapshot);
    }

    @Override
    public Optional<SecurityStateSnapshot> load() {
        return Optional.ofNullable(latest.get());
    }
}
