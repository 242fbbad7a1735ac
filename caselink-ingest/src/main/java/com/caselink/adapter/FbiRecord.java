package com.caselink.adapter;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * One poster from the FBI Wanted API. {@code race_raw} and {@code age_range}
 * have appeared both as strings and as arrays, so they stay untyped.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FbiRecord(
    String uid,
    String title,
    String description,
    String caution,
    String classification,
    @JsonProperty("poster_classification") String posterClassification,
    List<String> subjects,
    @JsonProperty("dates_of_birth_used") List<String> datesOfBirthUsed,
    @JsonProperty("height_min") Double heightMin,
    @JsonProperty("height_max") Double heightMax,
    @JsonProperty("weight_min") Double weightMin,
    @JsonProperty("weight_max") Double weightMax,
    String sex,
    String race,
    @JsonProperty("race_raw") JsonNode raceRaw,
    String nationality,
    @JsonProperty("age_range") JsonNode ageRange,
    @JsonProperty("age_min") Integer ageMin,
    @JsonProperty("age_max") Integer ageMax,
    List<Image> images,
    @JsonProperty("possible_states") List<String> possibleStates,
    String url,
    String modified,
    @JsonProperty("missing_persons") List<MissingPerson> missingPersons
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Image(String original, String thumb, String caption) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record MissingPerson(
        @JsonProperty("missing_from") String missingFrom,
        String date,
        Integer age,
        String sex,
        String race
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Page(int total, int page, List<FbiRecord> items) {}
}
