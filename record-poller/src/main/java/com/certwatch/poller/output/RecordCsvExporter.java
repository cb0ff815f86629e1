package com.certwatch.poller.output;

import com.certwatch.poller.config.CertWatchProperties;
import com.certwatch.poller.model.DeathRecord;
import com.certwatch.poller.model.JobSnapshot;
import com.certwatch.poller.model.RecordMatch;
import com.opencsv.CSVWriter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.time.LocalDate;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Writes a job's accumulated records as CSV, one row per record in date order.
 *
 * The {@code matched} column is "true" when any target name matched the record,
 * so a spreadsheet filter gives the same view as the found-dates panel.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class RecordCsvExporter {

    private final CertWatchProperties properties;

    private static final String[] HEADERS = {
            "date", "name", "gender", "date_of_death",
            "fathers_name", "mothers_name", "matched"
    };

    public String export(JobSnapshot snapshot) {
        StringWriter out = new StringWriter();
        write(snapshot, out);
        return out.toString();
    }

    public void write(JobSnapshot snapshot, Writer out) {
        try (CSVWriter writer = new CSVWriter(
                out,
                CSVWriter.DEFAULT_SEPARATOR,
                CSVWriter.DEFAULT_QUOTE_CHARACTER,
                CSVWriter.DEFAULT_ESCAPE_CHARACTER,
                CSVWriter.DEFAULT_LINE_END)) {

            if (properties.getOutput().getCsv().isIncludeHeader()) {
                writer.writeNext(HEADERS);
            }

            int rows = 0;
            for (var entry : snapshot.recordsByDate().entrySet()) {
                Set<DeathRecord.NaturalKey> matched = matchedKeys(snapshot, entry.getKey());
                for (DeathRecord r : entry.getValue()) {
                    writer.writeNext(toRow(entry.getKey(), r, matched.contains(r.naturalKey())));
                    rows++;
                }
            }
            log.info("Exported {} records for job {}", rows, snapshot.jobId());

        } catch (IOException e) {
            log.error("Failed to export CSV for job {}: {}", snapshot.jobId(), e.getMessage(), e);
            throw new UncheckedIOException("CSV export failed", e);
        }
    }

    private Set<DeathRecord.NaturalKey> matchedKeys(JobSnapshot snapshot, LocalDate date) {
        Set<DeathRecord.NaturalKey> keys = new HashSet<>();
        for (RecordMatch m : snapshot.matchesByDate().getOrDefault(date, List.of())) {
            keys.add(m.record().naturalKey());
        }
        return keys;
    }

    private String[] toRow(LocalDate date, DeathRecord r, boolean matched) {
        return new String[]{
                str(date),
                str(r.getName()),
                str(r.getGender()),
                str(r.getDateOfDeath()),
                str(r.getFathersName()),
                str(r.getMothersName()),
                String.valueOf(matched)
        };
    }

    private String str(Object val) {
        return val == null ? "" : val.toString();
    }
}
