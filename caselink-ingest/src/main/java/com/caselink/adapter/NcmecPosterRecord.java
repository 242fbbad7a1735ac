package com.caselink.adapter;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * One poster from the NCMEC public search servlet. Photo paths are relative
 * to the API host.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record NcmecPosterRecord(
    Long id,
    String caseNumber,
    String orgPrefix,
    String orgName,
    String firstName,
    String middleName,
    String lastName,
    String missingDate,
    String missingCity,
    String missingCounty,
    String missingState,
    String missingCountry,
    Integer age,
    String approxAge,
    String race,
    String sex,
    String height,
    String weight,
    String hairColor,
    String eyeColor,
    String thumbnailUrl,
    String imageUrl,
    String caseType,
    String url
) {

    /**
     * The servlet has returned its results under three different keys over
     * time; the first non-empty one wins.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Page(
        List<NcmecPosterRecord> persons,
        List<NcmecPosterRecord> subject,
        List<NcmecPosterRecord> cases,
        Integer totalRecords,
        Integer totalPages,
        Integer thisPage
    ) {
        public List<NcmecPosterRecord> records() {
            if (persons != null && !persons.isEmpty()) return persons;
            if (subject != null && !subject.isEmpty()) return subject;
            if (cases != null) return cases;
            return List.of();
        }
    }
}
