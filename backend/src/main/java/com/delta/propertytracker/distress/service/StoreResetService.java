package com.delta.propertytracker.distress.service;

import com.delta.propertytracker.distress.model.SeedLoadResult;
import com.delta.propertytracker.distress.persistence.DistressJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class StoreResetService {
    private static final Logger log = LoggerFactory.getLogger(StoreResetService.class);

    private final DistressJdbcRepository repository;
    private final SeedDataLoader seedDataLoader;
    private final StoreMaintenanceGuard maintenanceGuard;

    public StoreResetService(
        DistressJdbcRepository repository,
        SeedDataLoader seedDataLoader,
        StoreMaintenanceGuard maintenanceGuard
    ) {
        this.repository = repository;
        this.seedDataLoader = seedDataLoader;
        this.maintenanceGuard = maintenanceGuard;
    }

    public SeedLoadResult reset() {
        return maintenanceGuard.runExclusive("reset", () -> {
            repository.deleteAll();
            SeedLoadResult seed = seedDataLoader.loadIfEmpty();
            log.info("Store reset. reseeded={} inserted={}", seed.loaded(), seed.inserted());
            return seed;
        });
    }
}
