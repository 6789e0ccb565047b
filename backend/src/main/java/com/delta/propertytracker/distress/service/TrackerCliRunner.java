package com.delta.propertytracker.distress.service;

import com.delta.propertytracker.config.TrackerProperties;
import com.delta.propertytracker.distress.model.ResolveBatchResult;
import com.delta.propertytracker.distress.model.RunDiffView;
import com.delta.propertytracker.distress.model.SnapshotResult;
import com.delta.propertytracker.distress.model.TaxRefreshSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(10)
public class TrackerCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(TrackerCliRunner.class);

    private final TrackerProperties properties;
    private final TaxListRefreshService taxListRefreshService;
    private final SitusResolverService situsResolverService;
    private final SnapshotService snapshotService;
    private final RunDiffService runDiffService;
    private final ConfigurableApplicationContext applicationContext;

    public TrackerCliRunner(
        TrackerProperties properties,
        TaxListRefreshService taxListRefreshService,
        SitusResolverService situsResolverService,
        SnapshotService snapshotService,
        RunDiffService runDiffService,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.taxListRefreshService = taxListRefreshService;
        this.situsResolverService = situsResolverService;
        this.snapshotService = snapshotService;
        this.runDiffService = runDiffService;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        TrackerProperties.Cli cli = properties.getCli();
        if (!cli.isRun()) {
            return;
        }

        if (cli.isRefreshTaxList()) {
            TaxRefreshSummary refresh = taxListRefreshService.refresh();
            log.info("Tax refresh {}: {}", refresh.status(), refresh.message());
        }
        if (cli.getResolveLimit() > 0) {
            ResolveBatchResult resolved = situsResolverService.resolveBatch(cli.getResolveLimit());
            log.info(
                "Resolve batch: processed={} resolved={} unresolved={} errors={}",
                resolved.processed(),
                resolved.resolvedCount(),
                resolved.unresolvedCount(),
                resolved.sampleErrors()
            );
        }

        SnapshotResult snapshot = snapshotService.createRun();
        RunDiffView diff = runDiffService.latestDiff();
        log.info("Run {} recorded {} items; changes {}", snapshot.runId(), snapshot.entryCount(), diff.summary());

        if (cli.isExitAfterRun()) {
            int exitCode = SpringApplication.exit(applicationContext, () -> 0);
            System.exit(exitCode);
        }
    }
}
