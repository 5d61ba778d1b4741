package com.freightplatform.loadservice.service.imp;

import com.freightplatform.loadservice.core.exceptions.LoadNotFoundException;
import com.freightplatform.loadservice.model.Load;
import com.freightplatform.loadservice.model.LoadStatus;
import com.freightplatform.loadservice.repository.LoadRepository;
import com.freightplatform.loadservice.service.LoadRecordStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class LoadRecordStoreImp implements LoadRecordStore {

    private final LoadRepository loadRepository;

    @Override
    @Transactional(readOnly = true)
    public Optional<Load> get(UUID loadId) {
        return loadRepository.findById(loadId);
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public Optional<Load> getForUpdate(UUID loadId) {
        return loadRepository.findByIdForUpdate(loadId);
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public Load insert(Load load) {
        if (load.getStatus() != LoadStatus.CREATED) {
            throw new IllegalArgumentException("New loads must start in " + LoadStatus.CREATED);
        }
        return loadRepository.saveAndFlush(load);
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public Load patchStatus(UUID loadId, long expectedVersion, LoadStatus newStatus) {
        int updated = loadRepository.updateStatus(loadId, expectedVersion, newStatus, Instant.now());

        if (updated == 0) {
            log.warn("Version conflict while patching load {} (expected version {})", loadId, expectedVersion);
            throw new ObjectOptimisticLockingFailureException(Load.class, loadId);
        }

        return loadRepository.findById(loadId)
                .orElseThrow(() -> new LoadNotFoundException(loadId));
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public void delete(UUID loadId) {
        loadRepository.deleteById(loadId);
        loadRepository.flush();
    }

    @Override
    @Transactional(readOnly = true)
    public Map<LoadStatus, Long> countByStatus(UUID shipperId) {
        List<LoadRepository.StatusCount> rows = shipperId == null
                ? loadRepository.countGroupedByStatus()
                : loadRepository.countGroupedByStatusForShipper(shipperId);

        Map<LoadStatus, Long> counts = new EnumMap<>(LoadStatus.class);
        for (LoadRepository.StatusCount row : rows) {
            counts.put(row.getStatus(), row.getTotal());
        }
        return counts;
    }
}
