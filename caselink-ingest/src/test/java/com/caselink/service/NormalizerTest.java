package com.caselink.service;

import com.caselink.model.CaseSource;
import com.caselink.model.Gender;
import com.caselink.model.MissingCase;
import com.caselink.model.NormalizedCase;
import com.caselink.model.RecordStatus;
import com.caselink.service.Normalizer.NameParts;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class NormalizerTest {

    @Nested
    @DisplayName("normalizeNameForSearch")
    class NormalizeNameForSearch {

        @Test
        void stripsDiacriticsAndPunctuation() {
            assertThat(Normalizer.normalizeNameForSearch("  José  O'Brien-Núñez ")).isEqualTo("jose obriennunez");
        }

        @Test
        void collapsesWhitespace() {
            assertThat(Normalizer.normalizeNameForSearch("Maria\t  da   Silva")).isEqualTo("maria da silva");
        }

        @Test
        void returnsEmptyForNull() {
            assertThat(Normalizer.normalizeNameForSearch(null)).isEmpty();
        }

        @Test
        void joinsFirstAndLast() {
            assertThat(Normalizer.normalizeName("Ana", null)).isEqualTo("ana");
            assertThat(Normalizer.normalizeName(null, "Souza")).isEqualTo("souza");
            assertThat(Normalizer.normalizeName("Ana", "Souza")).isEqualTo("ana souza");
        }
    }

    @Nested
    @DisplayName("splitFullName")
    class SplitFullName {

        @Test
        void splitsLastCommaFirst() {
            assertThat(Normalizer.splitFullName("DOE, JANE MARIE")).isEqualTo(new NameParts("JANE MARIE", "DOE"));
        }

        @Test
        void splitsFirstMiddleLast() {
            assertThat(Normalizer.splitFullName("Jane Marie Doe")).isEqualTo(new NameParts("Jane Marie", "Doe"));
        }

        @Test
        void singleWordIsFirstName() {
            assertThat(Normalizer.splitFullName("Cher")).isEqualTo(new NameParts("Cher", null));
        }

        @Test
        void blankGivesNoName() {
            assertThat(Normalizer.splitFullName("  ")).isEqualTo(new NameParts(null, null));
        }
    }

    @Nested
    @DisplayName("parseDate")
    class ParseDate {

        @Test
        void parsesSupportedFormats() {
            LocalDate expected = LocalDate.of(2015, 5, 1);
            assertThat(Normalizer.parseDate("2015-05-01")).isEqualTo(expected);
            assertThat(Normalizer.parseDate("2015/05/01")).isEqualTo(expected);
            assertThat(Normalizer.parseDate("05/01/2015")).isEqualTo(expected);
            assertThat(Normalizer.parseDate("May 1, 2015")).isEqualTo(expected);
            assertThat(Normalizer.parseDate("May 1, 2015 12:00:00 AM")).isEqualTo(expected);
            assertThat(Normalizer.parseDate("2015-05-01T10:15:30")).isEqualTo(expected);
            assertThat(Normalizer.parseDate("2015-05-01T10:15:30+00:00")).isEqualTo(expected);
            assertThat(Normalizer.parseDate("Fri, 1 May 2015 10:15:30 GMT")).isEqualTo(expected);
        }

        @Test
        void returnsNullForGarbage() {
            assertThat(Normalizer.parseDate(null)).isNull();
            assertThat(Normalizer.parseDate("")).isNull();
            assertThat(Normalizer.parseDate("not a date")).isNull();
            assertThat(Normalizer.parseDate("2015-13-45")).isNull();
        }
    }

    @Nested
    @DisplayName("measurements")
    class Measurements {

        @Test
        void parsesHeightStrings() {
            assertThat(Normalizer.parseHeight("5'4\"")).isEqualTo(163);
            assertThat(Normalizer.parseHeight("4' 0\"")).isEqualTo(122);
            assertThat(Normalizer.parseHeight("64 inches")).isEqualTo(163);
            assertThat(Normalizer.parseHeight("163 cm")).isEqualTo(163);
            assertThat(Normalizer.parseHeight("tall")).isNull();
        }

        @Test
        void oversizedHeightDigitsAreUnparseable() {
            assertThat(Normalizer.parseHeight("99999999999 cm")).isNull();
            assertThat(Normalizer.parseHeight("99999999999' 2\"")).isNull();
            assertThat(Normalizer.parseHeight("99999999999 inches")).isNull();
        }

        @Test
        void parsesWeightStrings() {
            assertThat(Normalizer.parseWeight("120 lbs")).isEqualTo(54);
            assertThat(Normalizer.parseWeight("54 kg")).isEqualTo(54);
            assertThat(Normalizer.parseWeight("heavy")).isNull();
        }

        @Test
        void convertsUnits() {
            assertThat(Normalizer.inchesToCm(60)).isEqualTo(152);
            assertThat(Normalizer.metersToCm(1.45)).isEqualTo(145);
            assertThat(Normalizer.lbsToKg(100)).isEqualTo(45);
            assertThat(Normalizer.inchesToCm(null)).isNull();
        }
    }

    @Nested
    @DisplayName("codes")
    class Codes {

        @Test
        void normalizesGender() {
            assertThat(Normalizer.normalizeGender("M")).isEqualTo(Gender.MALE);
            assertThat(Normalizer.normalizeGender("girl")).isEqualTo(Gender.FEMALE);
            assertThat(Normalizer.normalizeGender("Feminino")).isEqualTo(Gender.FEMALE);
            assertThat(Normalizer.normalizeGender("outros")).isEqualTo(Gender.OTHER);
            assertThat(Normalizer.normalizeGender("?")).isEqualTo(Gender.UNKNOWN);
            assertThat(Normalizer.normalizeGender(null)).isEqualTo(Gender.UNKNOWN);
        }

        @Test
        void acceptsOnlyAlpha2Countries() {
            assertThat(Normalizer.normalizeCountryCode(" br ")).isEqualTo("BR");
            assertThat(Normalizer.normalizeCountryCode("BRA")).isNull();
            assertThat(Normalizer.normalizeCountryCode(null)).isNull();
        }

        @Test
        void formatsPhoneNumbers() {
            assertThat(Normalizer.normalizePhone("(11) 98765-4321")).isEqualTo("+11987654321");
            assertThat(Normalizer.normalizePhone("0119876-5432")).isEqualTo("+551198765432");
            assertThat(Normalizer.normalizePhone("12345")).isNull();
        }

        @Test
        void rejectsOutOfRangeAges() {
            assertThat(Normalizer.parseAge(7)).isEqualTo(7);
            assertThat(Normalizer.parseAge("12")).isEqualTo(12);
            assertThat(Normalizer.parseAge(-1)).isNull();
            assertThat(Normalizer.parseAge(121)).isNull();
            assertThat(Normalizer.parseAge("seven")).isNull();
        }
    }

    @Nested
    @DisplayName("case mapping")
    class CaseMapping {

        @Test
        void truncatesExternalIdInCaseNumber() {
            NormalizedCase record = record("abcdefghijklmnopqrstuvwxyz0123456789", RecordStatus.MISSING);
            assertThat(Normalizer.caseNumber(record)).isEqualTo("FBI-abcdefghijklmnopqrstuvwxyz0123");
        }

        @Test
        void foundRecordsResolveTheCase() {
            assertThat(Normalizer.caseStatus(RecordStatus.FOUND)).isEqualTo(MissingCase.STATUS_RESOLVED);
            assertThat(Normalizer.caseStatus(RecordStatus.MISSING)).isEqualTo(MissingCase.STATUS_ACTIVE);
            assertThat(Normalizer.caseStatus(RecordStatus.UNKNOWN)).isEqualTo(MissingCase.STATUS_ACTIVE);
        }
    }

    private static NormalizedCase record(String externalId, RecordStatus status) {
        return new NormalizedCase(externalId, CaseSource.FBI, "Jane", "Doe", "jane doe", null, null, null, null,
            null, null, null, Gender.UNKNOWN, null, null, null, null, null, List.of(), status, null, null);
    }
}
