package com.bbthechange.bridge.repository;

import com.bbthechange.bridge.model.Puppet;

import java.util.List;
import java.util.Optional;

/**
 * Persistent store of puppets. Plain CRUD, no transactions.
 * All methods throw {@link com.bbthechange.bridge.exception.RepositoryException} when the store fails.
 */
public interface PuppetRepository {

    Optional<Puppet> findByRemoteUserKey(String remoteUserKey);

    Optional<Puppet> findByCustomMxid(String customMxid);

    /**
     * All puppets that are linked to a real Matrix account.
     */
    List<Puppet> findAllWithCustomMxid();

    /**
     * Store a new puppet. Fails if a puppet with the same remote user key already exists.
     */
    Puppet insert(Puppet puppet);

    /**
     * Create or overwrite a puppet.
     */
    Puppet save(Puppet puppet);
}
