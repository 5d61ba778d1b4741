package com.freightplatform.loadservice.service.imp;

import com.freightplatform.loadservice.model.LoadStatus;
import com.freightplatform.loadservice.model.StatusHistoryRecord;
import com.freightplatform.loadservice.repository.StatusHistoryRepository;
import com.freightplatform.loadservice.service.StatusHistoryLedger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class StatusHistoryLedgerImp implements StatusHistoryLedger {

    private final StatusHistoryRepository historyRepository;

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public StatusHistoryRecord append(StatusHistoryRecord draft) {
        Optional<StatusHistoryRecord> previous =
                historyRepository.findFirstByLoadIdOrderBySequenceNumberDesc(draft.getLoadId());

        long sequence = previous.map(p -> p.getSequenceNumber() + 1).orElse(1L);

        // Never earlier than the entry before it, even if the clock stepped back
        Instant createdAt = Instant.now();
        if (previous.isPresent() && createdAt.isBefore(previous.get().getCreatedAt())) {
            createdAt = previous.get().getCreatedAt();
        }

        StatusHistoryRecord saved = historyRepository.saveAndFlush(draft.toBuilder()
                .id(null)
                .sequenceNumber(sequence)
                .createdAt(createdAt)
                .build());

        log.debug("Appended history #{} ({}) for load {}", sequence, saved.getStatus(), saved.getLoadId());
        return saved;
    }

    @Override
    @Transactional(readOnly = true)
    public List<StatusHistoryRecord> listByLoad(UUID loadId) {
        return historyRepository.findByLoadIdOrderBySequenceNumberAsc(loadId);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<LoadStatus> currentStatus(UUID loadId) {
        return historyRepository.findFirstByLoadIdOrderBySequenceNumberDesc(loadId)
                .map(StatusHistoryRecord::getStatus);
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public int purgeByLoad(UUID loadId) {
        // Immutable entity: remove row by row, never through a bulk delete
        List<StatusHistoryRecord> records = historyRepository.findByLoadIdOrderBySequenceNumberAsc(loadId);
        historyRepository.deleteAll(records);
        historyRepository.flush();
        log.info("Purged {} history records for load {}", records.size(), loadId);
        return records.size();
    }
}
