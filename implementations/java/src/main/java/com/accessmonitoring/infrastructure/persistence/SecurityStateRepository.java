package com.accessmonitoring.infrastructure.persistence;

import java.util.Optional;

/**
 * Storage for {@link SecurityStateSnapshot}s. A shared implementation is the hook for
 * running more than one instance; alert and incident ids are stable keys for that.
 */
public interface SecurityStateRepository {

    void save(SecurityStateSnapshot snapshot);

    Optional<SecurityStateSnapshot> load();
}
