package com.caselink.service;

import com.caselink.model.Gender;
import com.caselink.model.MissingCase;
import com.caselink.model.NormalizedCase;
import com.caselink.model.RecordStatus;

import java.text.Normalizer.Form;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.function.Supplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Stateless helpers shared by the source adapters and the persistence mapping.
 * Every parser returns null for input it cannot understand.
 */
public final class Normalizer {

    private static final Pattern DIACRITICS = Pattern.compile("\\p{M}+");
    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^a-z0-9\\s]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern ISO_ALPHA2 = Pattern.compile("^[A-Z]{2}$");

    private static final Pattern FEET_INCHES = Pattern.compile("(\\d+)['′]\\s*(\\d+)?[\"″]?");
    private static final Pattern INCHES = Pattern.compile("(\\d+)\\s*inch");
    private static final Pattern CENTIMETRES = Pattern.compile("(\\d+)\\s*cm");
    private static final Pattern POUNDS = Pattern.compile("(\\d+(?:\\.\\d+)?)\\s*lbs?", Pattern.CASE_INSENSITIVE);
    private static final Pattern KILOGRAMS = Pattern.compile("(\\d+(?:\\.\\d+)?)\\s*kg", Pattern.CASE_INSENSITIVE);

    private static final int CASE_NUMBER_ID_LENGTH = 30;

    // Tried in order; the first that parses wins
    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
        DateTimeFormatter.ISO_LOCAL_DATE,
        DateTimeFormatter.ofPattern("yyyy/MM/dd"),
        DateTimeFormatter.ofPattern("MM/dd/yyyy"),
        DateTimeFormatter.ofPattern("MMMM d, yyyy", Locale.ENGLISH),
        DateTimeFormatter.ofPattern("MMM d, yyyy", Locale.ENGLISH)
    );

    private static final List<DateTimeFormatter> DATE_TIME_FORMATS = List.of(
        DateTimeFormatter.ISO_LOCAL_DATE_TIME,
        new DateTimeFormatterBuilder().parseCaseInsensitive()
            .appendPattern("MMM d, yyyy h:mm:ss a").toFormatter(Locale.ENGLISH)
    );

    private Normalizer() {
    }

    public record NameParts(String firstName, String lastName) {}

    /**
     * Lower-case, diacritics stripped, non-alphanumerics removed, whitespace
     * collapsed. Used for deduplication and search indexing.
     */
    public static String normalizeNameForSearch(String name) {
        if (name == null) return "";
        String decomposed = java.text.Normalizer.normalize(name.toLowerCase(Locale.ROOT), Form.NFD);
        String stripped = DIACRITICS.matcher(decomposed).replaceAll("");
        String alnum = NON_ALPHANUMERIC.matcher(stripped).replaceAll("");
        return WHITESPACE.matcher(alnum).replaceAll(" ").trim();
    }

    public static String normalizeName(String firstName, String lastName) {
        StringBuilder sb = new StringBuilder();
        if (firstName != null && !firstName.isBlank()) sb.append(firstName);
        if (lastName != null && !lastName.isBlank()) {
            if (sb.length() > 0) sb.append(' ');
            sb.append(lastName);
        }
        return normalizeNameForSearch(sb.toString());
    }

    /**
     * Split "LASTNAME, FIRSTNAME MIDDLE" or "FIRSTNAME MIDDLE LASTNAME".
     */
    public static NameParts splitFullName(String fullName) {
        if (fullName == null || fullName.isBlank()) {
            return new NameParts(null, null);
        }
        String trimmed = fullName.trim();

        int comma = trimmed.indexOf(',');
        if (comma >= 0) {
            String last = trimmed.substring(0, comma).trim();
            String first = trimmed.substring(comma + 1).trim();
            return new NameParts(emptyToNull(first), emptyToNull(last));
        }

        String[] parts = WHITESPACE.split(trimmed);
        if (parts.length == 1) {
            return new NameParts(trimmed, null);
        }
        String first = String.join(" ", Arrays.copyOf(parts, parts.length - 1));
        return new NameParts(first, parts[parts.length - 1]);
    }

    /**
     * E.164 formatting. Numbers with fewer than 10 digits are rejected; an
     * 11-digit number with a trunk zero is assumed to be Brazilian.
     */
    public static String normalizePhone(String phone) {
        if (phone == null) return null;
        String digits = phone.replaceAll("\\D", "");
        if (digits.length() < 10) return null;
        if (digits.length() > 11) return "+" + digits;
        if (digits.startsWith("0")) return "+55" + digits.substring(1);
        return "+" + digits;
    }

    public static Integer inchesToCm(Number inches) {
        return inches == null ? null : (int) Math.round(inches.doubleValue() * 2.54);
    }

    public static Integer metersToCm(Number meters) {
        return meters == null ? null : (int) Math.round(meters.doubleValue() * 100);
    }

    public static Integer lbsToKg(Number lbs) {
        return lbs == null ? null : (int) Math.round(lbs.doubleValue() * 0.453592);
    }

    /**
     * Height strings such as 5'4", 64 inches or 163 cm.
     */
    public static Integer parseHeight(String height) {
        if (height == null || height.isBlank()) return null;

        try {
            Matcher feet = FEET_INCHES.matcher(height);
            if (feet.find()) {
                int ft = Integer.parseInt(feet.group(1));
                int in = feet.group(2) != null ? Integer.parseInt(feet.group(2)) : 0;
                return (int) Math.round((ft * 12 + in) * 2.54);
            }
            Matcher inches = INCHES.matcher(height);
            if (inches.find()) {
                return (int) Math.round(Integer.parseInt(inches.group(1)) * 2.54);
            }
            Matcher cm = CENTIMETRES.matcher(height);
            if (cm.find()) {
                return Integer.parseInt(cm.group(1));
            }
        } catch (NumberFormatException e) {
            // digit run too long for an int
            return null;
        }
        return null;
    }

    /**
     * Weight strings such as 120 lbs or 54 kg.
     */
    public static Integer parseWeight(String weight) {
        if (weight == null || weight.isBlank()) return null;

        Matcher lbs = POUNDS.matcher(weight);
        if (lbs.find()) {
            return (int) Math.round(Double.parseDouble(lbs.group(1)) * 0.453592);
        }
        Matcher kg = KILOGRAMS.matcher(weight);
        if (kg.find()) {
            return (int) Math.round(Double.parseDouble(kg.group(1)));
        }
        return null;
    }

    public static Gender normalizeGender(String gender) {
        if (gender == null || gender.isBlank()) return Gender.UNKNOWN;
        return switch (gender.trim().toLowerCase(Locale.ROOT)) {
            case "m", "male", "man", "boy", "masculino" -> Gender.MALE;
            case "f", "female", "woman", "girl", "feminino" -> Gender.FEMALE;
            case "other", "outros" -> Gender.OTHER;
            default -> Gender.UNKNOWN;
        };
    }

    /**
     * ISO 3166-1 alpha-2, or null for anything else.
     */
    public static String normalizeCountryCode(String code) {
        if (code == null) return null;
        String c = code.trim().toUpperCase(Locale.ROOT);
        return ISO_ALPHA2.matcher(c).matches() ? c : null;
    }

    public static LocalDate parseDate(String value) {
        if (value == null || value.isBlank()) return null;
        String s = value.trim();

        for (DateTimeFormatter format : DATE_FORMATS) {
            LocalDate date = tryParse(() -> LocalDate.parse(s, format));
            if (date != null) return date;
        }
        for (DateTimeFormatter format : DATE_TIME_FORMATS) {
            LocalDate date = tryParse(() -> LocalDateTime.parse(s, format).toLocalDate());
            if (date != null) return date;
        }
        LocalDate offset = tryParse(() -> OffsetDateTime.parse(s).toLocalDate());
        if (offset != null) return offset;
        return tryParse(() -> ZonedDateTime.parse(s, DateTimeFormatter.RFC_1123_DATE_TIME).toLocalDate());
    }

    private static LocalDate tryParse(Supplier<LocalDate> parser) {
        try {
            return parser.get();
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    public static Integer parseAge(Object age) {
        if (age == null) return null;
        int n;
        if (age instanceof Number number) {
            n = number.intValue();
        } else {
            try {
                n = Integer.parseInt(age.toString().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return n < 0 || n > 120 ? null : n;
    }

    public static String caseStatus(RecordStatus status) {
        return status == RecordStatus.FOUND ? MissingCase.STATUS_RESOLVED : MissingCase.STATUS_ACTIVE;
    }

    /**
     * SOURCE-EXTERNALID with the external id truncated.
     */
    public static String caseNumber(NormalizedCase record) {
        String id = record.externalId();
        if (id.length() > CASE_NUMBER_ID_LENGTH) {
            id = id.substring(0, CASE_NUMBER_ID_LENGTH);
        }
        return record.source().slug().toUpperCase(Locale.ROOT) + "-" + id;
    }

    public static String emptyToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
