package com.freightplatform.loadservice.service.imp;

import com.freightplatform.loadservice.core.exceptions.InvalidStatusTransitionException;
import com.freightplatform.loadservice.core.exceptions.LoadNotFoundException;
import com.freightplatform.loadservice.core.exceptions.LoadPersistenceException;
import com.freightplatform.loadservice.core.statemachine.TransitionRuleTable;
import com.freightplatform.loadservice.dto.CreateLoadRequest;
import com.freightplatform.loadservice.dto.StatusCountFilter;
import com.freightplatform.loadservice.dto.StatusUpdateRequest;
import com.freightplatform.loadservice.model.Load;
import com.freightplatform.loadservice.model.LoadStatus;
import com.freightplatform.loadservice.model.StatusHistoryRecord;
import com.freightplatform.loadservice.service.LoadEventDispatcher;
import com.freightplatform.loadservice.service.LoadEventFactory;
import com.freightplatform.loadservice.service.LoadLifecycleService;
import com.freightplatform.loadservice.service.LoadRecordStore;
import com.freightplatform.loadservice.service.StatusHistoryLedger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class LoadLifecycleServiceImp implements LoadLifecycleService {

    static final String SYSTEM_ACTOR = "system";

    private final LoadRecordStore loadStore;
    private final StatusHistoryLedger historyLedger;
    private final LoadEventFactory eventFactory;
    private final LoadEventDispatcher eventDispatcher;
    private final TransactionTemplate tx;

    @Override
    public Load createLoad(CreateLoadRequest request) {
        if (request == null || request.shipperId() == null) {
            throw new IllegalArgumentException("A shipper is required to create a load");
        }

        String actor = request.createdBy() == null || request.createdBy().isBlank()
                ? SYSTEM_ACTOR
                : request.createdBy();

        Load created = inTransaction("create load", null, status -> {
            Load load = loadStore.insert(Load.builder()
                    .shipperId(request.shipperId())
                    .referenceNumber(request.referenceNumber())
                    .description(request.description())
                    .equipmentType(request.equipmentType())
                    .weight(request.weight())
                    .offeredRate(request.offeredRate())
                    .build());

            Map<String, Object> details = new LinkedHashMap<>();
            details.put("message", "Load created");

            StatusHistoryRecord initial = historyLedger.append(StatusHistoryRecord.builder()
                    .loadId(load.getId())
                    .status(LoadStatus.CREATED)
                    .details(details)
                    .actor(actor)
                    .build());

            eventDispatcher.dispatchAfterCommit(eventFactory.loadCreated(load, initial));
            return load;
        });

        log.info("Created load {} for shipper {}", created.getId(), created.getShipperId());
        return created;
    }

    @Override
    public Load getLoad(UUID loadId) {
        return inTransaction("read load", loadId, status -> requireLoad(loadId));
    }

    @Override
    public Load updateStatus(UUID loadId, StatusUpdateRequest request) {
        validate(request);
        LoadStatus requested = request.status();

        return inTransaction("update status", loadId, status -> {
            Load current = loadStore.getForUpdate(loadId)
                    .orElseThrow(() -> {
                        log.warn("Status update rejected, load {} does not exist", loadId);
                        return new LoadNotFoundException(loadId);
                    });

            LoadStatus previous = current.getStatus();

            if (previous == requested) {
                log.info("Load {} re-confirmed in status {} by {}", loadId, previous, request.actor());
            } else if (!TransitionRuleTable.allowed(previous, requested)) {
                if (previous.isTerminal()) {
                    log.warn("Rejected transition {} -> {} for load {}, {} is terminal",
                            previous, requested, loadId, previous);
                } else {
                    log.warn("Rejected transition {} -> {} for load {}", previous, requested, loadId);
                }
                throw new InvalidStatusTransitionException(loadId, previous, requested);
            }

            Load patched = loadStore.patchStatus(loadId, current.getVersion(), requested);

            StatusHistoryRecord record = historyLedger.append(StatusHistoryRecord.builder()
                    .loadId(loadId)
                    .status(requested)
                    .details(request.details() == null ? new LinkedHashMap<>() : new LinkedHashMap<>(request.details()))
                    .actor(request.actor())
                    .latitude(request.latitude())
                    .longitude(request.longitude())
                    .build());

            eventDispatcher.dispatchAfterCommit(eventFactory.statusChanged(previous, record));

            log.info("Load {} moved {} -> {} by {}", loadId, previous, requested, request.actor());
            return patched;
        });
    }

    @Override
    public List<StatusHistoryRecord> getStatusHistory(UUID loadId) {
        return inTransaction("read status history", loadId, status -> {
            requireLoad(loadId);
            return historyLedger.listByLoad(loadId);
        });
    }

    @Override
    public LoadStatus getCurrentStatus(UUID loadId) {
        return inTransaction("read current status", loadId, status -> {
            Load load = requireLoad(loadId);

            return historyLedger.currentStatus(loadId)
                    .map(fromLedger -> {
                        if (fromLedger != load.getStatus()) {
                            log.error("Load {} record says {} but its ledger ends at {}",
                                    loadId, load.getStatus(), fromLedger);
                        }
                        return fromLedger;
                    })
                    .orElseGet(load::getStatus);
        });
    }

    @Override
    public Map<LoadStatus, Long> getStatusCounts(StatusCountFilter filter) {
        UUID shipperId = filter == null ? null : filter.shipperId();

        Map<LoadStatus, Long> counts = new EnumMap<>(LoadStatus.class);
        for (LoadStatus s : LoadStatus.values()) {
            counts.put(s, 0L);
        }

        Map<LoadStatus, Long> actual = inTransaction("count loads", null, status -> loadStore.countByStatus(shipperId));
        counts.putAll(actual);
        return counts;
    }

    @Override
    public Map<LoadStatus, Set<LoadStatus>> getTransitionRules() {
        return TransitionRuleTable.asMap();
    }

    @Override
    public void deleteLoad(UUID loadId) {
        inTransaction("delete load", loadId, status -> {
            loadStore.getForUpdate(loadId)
                    .orElseThrow(() -> new LoadNotFoundException(loadId));

            int purged = historyLedger.purgeByLoad(loadId);
            loadStore.delete(loadId);

            eventDispatcher.dispatchAfterCommit(eventFactory.loadDeleted(loadId));
            return purged;
        });

        log.info("Deleted load {}", loadId);
    }

    private Load requireLoad(UUID loadId) {
        return loadStore.get(loadId)
                .orElseThrow(() -> new LoadNotFoundException(loadId));
    }

    private void validate(StatusUpdateRequest request) {
        if (request == null || request.status() == null) {
            throw new IllegalArgumentException("A target status is required");
        }
        if (request.actor() == null || request.actor().isBlank()) {
            throw new IllegalArgumentException("The actor performing the update is required");
        }
        if ((request.latitude() == null) != (request.longitude() == null)) {
            throw new IllegalArgumentException("Latitude and longitude must be provided together");
        }
        // NaN fails every comparison, so the bounds are written to reject it
        if (request.latitude() != null
                && !(request.latitude() >= -90 && request.latitude() <= 90
                && request.longitude() >= -180 && request.longitude() <= 180)) {
            throw new IllegalArgumentException("Coordinates out of range: "
                    + request.latitude() + ", " + request.longitude());
        }
    }

    // Rolls back on any exception; storage failures surface as LoadPersistenceException
    private <T> T inTransaction(String operation, UUID loadId, TransactionCallback<T> work) {
        try {
            return tx.execute(work);
        } catch (DataAccessException | TransactionException e) {
            log.error("Failed to {} for load {}", operation, loadId, e);
            throw new LoadPersistenceException("Could not " + operation + " for load " + loadId, e);
        }
    }
}
