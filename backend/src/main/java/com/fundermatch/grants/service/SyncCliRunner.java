package com.fundermatch.grants.service;

import com.fundermatch.config.FunderMatchProperties;
import com.fundermatch.grants.model.SyncRequest;
import com.fundermatch.grants.model.SyncResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

@Component
public class SyncCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(SyncCliRunner.class);

    private final FunderMatchProperties properties;
    private final GrantSyncService syncService;
    private final ConfigurableApplicationContext applicationContext;

    public SyncCliRunner(
        FunderMatchProperties properties,
        GrantSyncService syncService,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.syncService = syncService;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        FunderMatchProperties.Cli cli = properties.getCli();
        if (!cli.isRun()) {
            return;
        }

        SyncRequest request = new SyncRequest(
            cli.getMaxOrganisations(),
            cli.getMaxGrants(),
            cli.getOffset(),
            cli.isForceFullSync()
        );
        int exitCode = 0;
        try {
            SyncResult result = syncService.runSync(request);
            log.info(
                "Sync {} ({}) finished: organisations={}, grantsSynced={}, grantsSkipped={}",
                result.syncLogId(),
                result.syncType().dbValue(),
                result.organisationsSynced(),
                result.grantsSynced(),
                result.grantsSkipped()
            );
        } catch (RuntimeException e) {
            log.error("CLI sync failed", e);
            exitCode = 1;
        }

        if (cli.isExitAfterRun()) {
            int code = exitCode;
            int springExit = SpringApplication.exit(applicationContext, () -> code);
            System.exit(springExit);
        }
    }
}
