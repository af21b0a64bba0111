package com.fundermatch.grants.api;

import com.fundermatch.config.FunderMatchProperties;
import com.fundermatch.grants.model.SyncRequest;
import com.fundermatch.grants.model.SyncResult;
import com.fundermatch.grants.model.SyncStatusResponse;
import com.fundermatch.grants.service.DataFreshnessService;
import com.fundermatch.grants.service.GrantSyncService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/sync")
public class SyncController {
    private static final Logger log = LoggerFactory.getLogger(SyncController.class);

    private final GrantSyncService syncService;
    private final DataFreshnessService freshnessService;
    private final FunderMatchProperties properties;

    public SyncController(
        GrantSyncService syncService,
        DataFreshnessService freshnessService,
        FunderMatchProperties properties
    ) {
        this.syncService = syncService;
        this.freshnessService = freshnessService;
        this.properties = properties;
    }

    @PostMapping
    public ResponseEntity<SyncResponse> runSync(
        @RequestParam(name = "maxOrgs", required = false) Integer maxOrganisations,
        @RequestParam(name = "maxGrants", required = false) Integer maxGrants,
        @RequestParam(name = "offset", required = false, defaultValue = "0") int offset,
        @RequestParam(name = "force", required = false, defaultValue = "false") boolean force,
        @RequestParam(name = "full", required = false, defaultValue = "false") boolean full
    ) {
        FunderMatchProperties.Sync sync = properties.getSync();
        SyncRequest request = new SyncRequest(
            maxOrganisations == null ? sync.getDefaultMaxOrganisations() : maxOrganisations,
            maxGrants == null ? sync.getDefaultMaxGrants() : maxGrants,
            offset,
            force || full
        );
        try {
            SyncResult result = syncService.runSync(request);
            return ResponseEntity.ok(SyncResponse.completed(result));
        } catch (RuntimeException e) {
            log.warn("Sync request failed", e);
            String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(SyncResponse.failed(message));
        }
    }

    @GetMapping("/status")
    public SyncStatusResponse status() {
        return freshnessService.getStatus();
    }
}
