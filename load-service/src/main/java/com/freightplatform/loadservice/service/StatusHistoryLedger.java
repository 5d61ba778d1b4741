package com.freightplatform.loadservice.service;

import com.freightplatform.loadservice.model.LoadStatus;
import com.freightplatform.loadservice.model.StatusHistoryRecord;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Append-only audit trail of the statuses a load has entered.
 */
public interface StatusHistoryLedger {

    /**
     * Appends a record inside the caller's transaction. The ledger assigns the sequence
     * number and creation time; both are ignored on the draft.
     */
    StatusHistoryRecord append(StatusHistoryRecord draft);

    List<StatusHistoryRecord> listByLoad(UUID loadId);

    Optional<LoadStatus> currentStatus(UUID loadId);

    int purgeByLoad(UUID loadId);
}
