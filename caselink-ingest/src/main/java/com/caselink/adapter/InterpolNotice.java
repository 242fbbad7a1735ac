package com.caselink.adapter;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A yellow notice as returned by the list endpoint, together with whatever
 * enrichment succeeded. {@code detail} is null and {@code photoUrls} empty
 * when the follow-up requests failed.
 */
public record InterpolNotice(Notice summary, Notice detail, List<String> photoUrls) {

    public InterpolNotice {
        photoUrls = photoUrls == null ? List.of() : List.copyOf(photoUrls);
    }

    /** Detail fields win over summary fields. */
    public Notice best() {
        return detail != null ? detail : summary;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Notice(
        @JsonProperty("entity_id") String entityId,
        String forename,
        String name,
        @JsonProperty("date_of_birth") String dateOfBirth,
        List<String> nationalities,
        @JsonProperty("sex_id") String sexId,
        @JsonProperty("country_of_birth_id") String countryOfBirthId,
        @JsonProperty("place_of_birth") String placeOfBirth,
        Double height,
        Double weight,
        @JsonProperty("distinguishing_marks") String distinguishingMarks,
        @JsonProperty("specific_alert_text") String specificAlertText,
        @JsonProperty("_links") Links links
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Links(Link self, Link images, Link thumbnail, Link next) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Link(String href) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Page(
        @JsonProperty("_embedded") Embedded embedded,
        @JsonProperty("_links") Links links,
        Integer total
    ) {
        public List<Notice> notices() {
            return embedded == null || embedded.notices() == null ? List.of() : embedded.notices();
        }

        public boolean hasNext() {
            return links != null && links.next() != null && links.next().href() != null;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Embedded(List<Notice> notices, List<Picture> images) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Picture(String pictureId, @JsonProperty("_links") Links links) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ImagePage(@JsonProperty("_embedded") Embedded embedded) {
        public List<Picture> pictures() {
            return embedded == null || embedded.images() == null ? List.of() : embedded.images();
        }
    }
}
