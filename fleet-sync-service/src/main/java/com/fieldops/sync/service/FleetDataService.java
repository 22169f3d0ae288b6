package com.fieldops.sync.service;

import com.fieldops.common.model.FetchResult;
import com.fieldops.common.model.FleetSnapshot;
import com.fieldops.sync.cache.DatasetCatalog;
import com.fieldops.sync.client.TelematicsClient;
import reactor.core.publisher.Mono;

/**
 * Current fleet positions. Authenticates, pulls devices and statuses in parallel,
 * assembles them into a {@link FleetSnapshot} and routes the whole thing through
 * the {@link FetchOrchestrator} so callers always get a well-formed result.
 */
public class FleetDataService {

    private final TelematicsClient client;
    private final FetchOrchestrator orchestrator;
    private final AssetRecordAssembler assembler;

    public FleetDataService(TelematicsClient client, FetchOrchestrator orchestrator,
                            AssetRecordAssembler assembler) {
        this.client       = client;
        this.orchestrator = orchestrator;
        this.assembler    = assembler;
    }

    public Mono<FetchResult<FleetSnapshot>> currentFleet() {
        return orchestrator.current(DatasetCatalog.FLEET_ASSETS, this::fetchFleet);
    }

    private Mono<FleetSnapshot> fetchFleet() {
        return client.authenticate()
            .then(Mono.zip(client.getDevices(), client.getDeviceStatuses()))
            .map(tuple -> assembler.assemble(tuple.getT1(), tuple.getT2()));
    }
}
