package com.certwatch.poller.model;

import lombok.Builder;
import lombok.Value;

/**
 * One death record as returned by the registry for a single registration date.
 *
 * Immutable once built: records are shared between the live tracker state
 * and every snapshot taken from it.
 */
@Value
@Builder(toBuilder = true)
public class DeathRecord {

    String name;
    String gender;
    String dateOfDeath;
    String fathersName;
    String mothersName;

    /** Identity used to suppress duplicates when a date is fetched again. */
    public NaturalKey naturalKey() {
        return new NaturalKey(name, dateOfDeath, fathersName, mothersName);
    }

    public record NaturalKey(String name, String dateOfDeath, String fathersName, String mothersName) {}
}
