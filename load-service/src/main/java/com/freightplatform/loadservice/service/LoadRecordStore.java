package com.freightplatform.loadservice.service;

import com.freightplatform.loadservice.model.Load;
import com.freightplatform.loadservice.model.LoadStatus;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Persistence boundary for the current state of a load.
 *
 * <p>Every mutating method joins the caller's transaction and fails when none is active.
 * {@link #patchStatus} is the only way a load's status changes.</p>
 */
public interface LoadRecordStore {

    Optional<Load> get(UUID loadId);

    /**
     * Reads the load and holds a row lock on it until the surrounding transaction ends.
     */
    Optional<Load> getForUpdate(UUID loadId);

    Load insert(Load load);

    /**
     * Moves the load to {@code newStatus} if its version still equals {@code expectedVersion}.
     *
     * @return the load as written, with its version and update time advanced
     * @throws org.springframework.orm.ObjectOptimisticLockingFailureException if the version moved
     */
    Load patchStatus(UUID loadId, long expectedVersion, LoadStatus newStatus);

    void delete(UUID loadId);

    /**
     * Number of loads per status, only for statuses that have at least one load.
     */
    Map<LoadStatus, Long> countByStatus(UUID shipperId);
}
