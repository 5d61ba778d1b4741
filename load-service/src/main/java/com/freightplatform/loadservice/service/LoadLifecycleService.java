package com.freightplatform.loadservice.service;

import com.freightplatform.loadservice.dto.CreateLoadRequest;
import com.freightplatform.loadservice.dto.StatusCountFilter;
import com.freightplatform.loadservice.dto.StatusUpdateRequest;
import com.freightplatform.loadservice.model.Load;
import com.freightplatform.loadservice.model.LoadStatus;
import com.freightplatform.loadservice.model.StatusHistoryRecord;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

public interface LoadLifecycleService {

    Load createLoad(CreateLoadRequest request);

    Load getLoad(UUID loadId);

    Load updateStatus(UUID loadId, StatusUpdateRequest request);

    List<StatusHistoryRecord> getStatusHistory(UUID loadId);

    LoadStatus getCurrentStatus(UUID loadId);

    Map<LoadStatus, Long> getStatusCounts(StatusCountFilter filter);

    Map<LoadStatus, Set<LoadStatus>> getTransitionRules();

    void deleteLoad(UUID loadId);
}
