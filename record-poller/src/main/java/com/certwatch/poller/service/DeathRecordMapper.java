package com.certwatch.poller.service;

import com.certwatch.poller.model.DeathRecord;
import com.certwatch.poller.model.RegistryRecordDto;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Maps raw registry rows to the {@link DeathRecord} domain model.
 */
@Component
@Slf4j
public class DeathRecordMapper {

    /**
     * Convert registry rows, dropping rows without a name.
     */
    public List<DeathRecord> mapAll(List<RegistryRecordDto> rows) {
        List<DeathRecord> records = new ArrayList<>(rows.size());
        int skipped = 0;
        for (RegistryRecordDto row : rows) {
            if (row == null || row.getName() == null || row.getName().isBlank()) {
                skipped++;
                continue;
            }
            records.add(map(row));
        }
        if (skipped > 0) {
            log.debug("Skipped {} registry rows without a name", skipped);
        }
        return records;
    }

    public DeathRecord map(RegistryRecordDto row) {
        return DeathRecord.builder()
                .name(clean(row.getName()))
                .gender(clean(row.getGender()))
                .dateOfDeath(clean(row.getDateOfDeath()))
                .fathersName(clean(row.getFathersName()))
                .mothersName(clean(row.getMothersName()))
                .build();
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    /** Trim, and collapse the internal whitespace the registry pads names with. */
    private String clean(String val) {
        if (val == null) return "";
        return val.trim().replaceAll("\\s+", " ");
    }
}
