package com.delta.propertytracker.distress.service;

import com.delta.propertytracker.distress.model.PropertyRecord;
import com.delta.propertytracker.distress.model.RunMeta;
import com.delta.propertytracker.distress.model.StatusResponse;
import com.delta.propertytracker.distress.persistence.DistressJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.springframework.http.HttpStatus.BAD_REQUEST;

@Service
public class TrackerStatusService {
    private static final Logger log = LoggerFactory.getLogger(TrackerStatusService.class);
    private static final int MAX_RUNS_LIMIT = 200;

    private final DistressJdbcRepository repository;

    public TrackerStatusService(DistressJdbcRepository repository) {
        this.repository = repository;
    }

    public StatusResponse getStatus() {
        boolean dbConnected;
        try {
            dbConnected = repository.isDbReachable();
        } catch (Exception e) {
            log.warn("Database unreachable: {}", e.getMessage());
            dbConnected = false;
        }
        if (!dbConnected) {
            return new StatusResponse(false, new LinkedHashMap<>(), null);
        }

        Map<String, Long> counts = repository.tableCounts();
        List<RunMeta> latest = repository.findRecentRuns(1);
        return new StatusResponse(true, counts, latest.isEmpty() ? null : latest.get(0));
    }

    public List<PropertyRecord> listItems() {
        return repository.findAllRecordsOrdered();
    }

    public List<RunMeta> recentRuns(int limit) {
        if (limit < 1 || limit > MAX_RUNS_LIMIT) {
            throw new ResponseStatusException(BAD_REQUEST, "limit must be between 1 and " + MAX_RUNS_LIMIT);
        }
        return repository.findRecentRuns(limit);
    }
}
