package com.certwatch.poller.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.function.Function;

/**
 * Record fields a target name is matched against, in priority order.
 */
public enum MatchedField {
    NAME("name", DeathRecord::getName),
    FATHERS_NAME("fathersName", DeathRecord::getFathersName),
    MOTHERS_NAME("mothersName", DeathRecord::getMothersName);

    private final String wireName;
    private final Function<DeathRecord, String> accessor;

    MatchedField(String wireName, Function<DeathRecord, String> accessor) {
        this.wireName = wireName;
        this.accessor = accessor;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public String valueOf(DeathRecord record) {
        return accessor.apply(record);
    }
}
