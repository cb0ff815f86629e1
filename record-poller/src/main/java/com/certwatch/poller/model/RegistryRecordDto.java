package com.certwatch.poller.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

/**
 * Raw DTO matching the registry's JSON rows.
 * Kept separate from the domain model to isolate API coupling.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class RegistryRecordDto {

    private String name;

    private String gender;

    @JsonProperty("date_of_death")
    @JsonAlias("dateOfDeath")
    private String dateOfDeath;

    @JsonProperty("fathers_name")
    @JsonAlias("fathersName")
    private String fathersName;

    @JsonProperty("mothers_name")
    @JsonAlias("mothersName")
    private String mothersName;
}
