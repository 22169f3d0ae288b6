package com.fieldops.sync.service;

import com.fieldops.common.classifier.AssetCategoryClassifier;
import com.fieldops.common.model.AssetRecord;
import com.fieldops.common.model.CommunicationStatus;
import com.fieldops.common.model.FleetSnapshot;
import com.fieldops.sync.model.DeviceRecord;
import com.fieldops.sync.model.DeviceStatusRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Joins the device listing with the latest device statuses into canonical
 * {@link AssetRecord}s.
 *
 * <p>Rules:
 * <ul>
 *   <li>devices without a name, or without a non-zero position, are skipped;</li>
 *   <li>speed km/h → mph, rounded; driving when above {@value #DRIVING_THRESHOLD_MPH} mph;</li>
 *   <li>installer is the device comment, falling back to the device name;</li>
 *   <li>a missing or unparseable status time is replaced by now.</li>
 * </ul>
 */
public class AssetRecordAssembler {

    private static final Logger log = LoggerFactory.getLogger(AssetRecordAssembler.class);

    public static final double KMH_TO_MPH            = 0.621371;
    public static final int    DRIVING_THRESHOLD_MPH = 5;

    private final Clock clock;

    public AssetRecordAssembler(Clock clock) {
        this.clock = clock;
    }

    public FleetSnapshot assemble(List<DeviceRecord> devices, List<DeviceStatusRecord> statuses) {
        Map<String, DeviceStatusRecord> byDevice = new HashMap<>();
        for (DeviceStatusRecord status : statuses) {
            if (status.deviceId() != null) {
                byDevice.put(status.deviceId(), status);
            }
        }

        List<AssetRecord> assets = new ArrayList<>(devices.size());
        int skipped = 0;
        for (DeviceRecord device : devices) {
            DeviceStatusRecord status = byDevice.get(device.id());
            if (device.name() == null || device.name().isBlank() || status == null || !status.hasPosition()) {
                skipped++;
                continue;
            }
            assets.add(toAsset(device, status));
        }

        log.info("FLEET_ASSEMBLED devices={} assets={} skipped={}", devices.size(), assets.size(), skipped);
        return new FleetSnapshot(assets);
    }

    static int toMph(Double kmh) {
        return kmh == null ? 0 : (int) Math.round(kmh * KMH_TO_MPH);
    }

    private AssetRecord toAsset(DeviceRecord device, DeviceStatusRecord status) {
        int speedMph = toMph(status.speed());
        String installer = device.comment() == null || device.comment().isBlank()
            ? device.name()
            : device.comment();

        return new AssetRecord(
            device.id(),
            device.name(),
            status.latitude(),
            status.longitude(),
            speedMph,
            status.bearing() == null ? 0.0 : status.bearing(),
            parseTime(status.dateTime()),
            status.deviceCommunicating() ? CommunicationStatus.ONLINE : CommunicationStatus.OFFLINE,
            AssetCategoryClassifier.classify(device.name()),
            installer,
            speedMph > DRIVING_THRESHOLD_MPH);
    }

    private Instant parseTime(String dateTime) {
        if (dateTime == null || dateTime.isBlank()) {
            return clock.instant();
        }
        try {
            return Instant.parse(dateTime);
        } catch (DateTimeParseException e) {
            log.debug("Unparseable status time '{}', using now", dateTime);
            return clock.instant();
        }
    }
}
