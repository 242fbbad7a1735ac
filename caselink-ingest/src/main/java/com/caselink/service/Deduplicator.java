package com.caselink.service;

import com.caselink.exception.DeduplicationException;
import com.caselink.model.DeduplicationDecision;
import com.caselink.model.ExactMatch;
import com.caselink.model.Gender;
import com.caselink.model.MatchCandidate;
import com.caselink.model.NormalizedCase;
import com.caselink.repository.CaseSourceRecordRepository;
import com.caselink.repository.PersonRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Decides whether a normalized record is already known: first by source and
 * external id, then by fuzzy name similarity against other sources' cases.
 * Errors during fuzzy matching resolve to "create".
 */
@Service
public class Deduplicator {

    private static final Logger log = LoggerFactory.getLogger(Deduplicator.class);

    public static final double DEDUP_THRESHOLD = 0.85;
    static final int MAX_CANDIDATES = 50;
    static final int DOB_WINDOW_DAYS = 30;
    static final int MIN_NAME_LENGTH = 3;

    private static final double DOB_EXACT_BOOST = 0.10;
    private static final double DOB_NEAR_BOOST = 0.05;
    private static final int DOB_NEAR_DAYS = 7;
    private static final double GENDER_BOOST = 0.05;

    private final CaseSourceRecordRepository sourceRecords;
    private final PersonRepository persons;

    public Deduplicator(CaseSourceRecordRepository sourceRecords, PersonRepository persons) {
        this.sourceRecords = sourceRecords;
        this.persons = persons;
    }

    public DeduplicationDecision deduplicate(NormalizedCase record) {
        Optional<ExactMatch> exact = findExactMatch(record);
        if (exact.isPresent()) {
            return DeduplicationDecision.exact(exact.get());
        }
        return findFuzzyMatch(record);
    }

    /**
     * Previous ingestion of the same (source, externalId). Lookup failures
     * propagate; the caller counts them against the record.
     */
    public Optional<ExactMatch> findExactMatch(NormalizedCase record) {
        return sourceRecords.findExactMatch(record.source().slug(), record.externalId());
    }

    /**
     * Best cross-source candidate at or above {@link #DEDUP_THRESHOLD}. Any
     * failure while matching yields a create decision.
     */
    public DeduplicationDecision findFuzzyMatch(NormalizedCase record) {
        try {
            return matchAgainstCandidates(record);
        } catch (RuntimeException e) {
            DeduplicationException failure = new DeduplicationException(
                "Fuzzy match failed for " + record.source().slug() + "/" + record.externalId(), e);
            log.error("Deduplication failed, creating a new case instead", failure);
            return DeduplicationDecision.create(0, "Deduplication error: " + e.getMessage());
        }
    }

    private DeduplicationDecision matchAgainstCandidates(NormalizedCase record) {
        String name = record.fullName();
        String normalized = Normalizer.normalizeNameForSearch(name);
        if (normalized.length() < MIN_NAME_LENGTH) {
            return DeduplicationDecision.create(0, "Insufficient name data for deduplication");
        }

        LocalDate dob = record.dateOfBirth();
        List<MatchCandidate> candidates = persons.findMatchCandidates(
            record.source().slug(),
            dob != null ? dob.minusDays(DOB_WINDOW_DAYS) : null,
            dob != null ? dob.plusDays(DOB_WINDOW_DAYS) : null,
            MAX_CANDIDATES
        );

        MatchCandidate best = null;
        double bestScore = 0;
        for (MatchCandidate candidate : candidates) {
            double score = score(record, candidate);
            if (score > bestScore) {
                bestScore = score;
                best = candidate;
            }
        }

        if (best != null && meetsThreshold(bestScore)) {
            log.info("Cross-source duplicate: {}/{} matches case {} (score={})",
                record.source().slug(), record.externalId(), best.caseId(), format(bestScore));
            return DeduplicationDecision.attach(best.caseId(), best.personId(), bestScore,
                "Fuzzy name match (score=" + format(bestScore) + ") with existing case " + best.caseId());
        }

        return DeduplicationDecision.create(bestScore, bestScore > 0
            ? "Best score " + format(bestScore) + " below threshold " + DEDUP_THRESHOLD
            : "No candidates found");
    }

    static double score(NormalizedCase record, MatchCandidate candidate) {
        double score = nameSimilarity(record.fullName(), joinName(candidate.firstName(), candidate.lastName()));

        if (record.dateOfBirth() != null && candidate.dateOfBirth() != null) {
            long days = Math.abs(ChronoUnit.DAYS.between(record.dateOfBirth(), candidate.dateOfBirth()));
            if (days == 0) {
                score = Math.min(1.0, score + DOB_EXACT_BOOST);
            } else if (days <= DOB_NEAR_DAYS) {
                score = Math.min(1.0, score + DOB_NEAR_BOOST);
            }
        }

        if (record.gender().isKnown() && record.gender() == Gender.fromDbValue(candidate.gender())) {
            score = Math.min(1.0, score + GENDER_BOOST);
        }
        return score;
    }

    public static boolean meetsThreshold(double score) {
        return score >= DEDUP_THRESHOLD;
    }

    /**
     * 1 - levenshtein / max length over the normalized forms. Symmetric;
     * 0 when either side is empty.
     */
    public static double nameSimilarity(String a, String b) {
        if (a == null || b == null || a.isBlank() || b.isBlank()) return 0;
        String na = Normalizer.normalizeNameForSearch(a);
        String nb = Normalizer.normalizeNameForSearch(b);
        if (na.equals(nb)) return 1.0;
        int maxLen = Math.max(na.length(), nb.length());
        if (maxLen == 0) return 1.0;
        return 1.0 - (double) levenshtein(na, nb) / maxLen;
    }

    static int levenshtein(String a, String b) {
        if (a.equals(b)) return 0;
        if (a.isEmpty()) return b.length();
        if (b.isEmpty()) return a.length();

        int[] prev = new int[b.length() + 1];
        int[] curr = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) prev[j] = j;

        for (int i = 1; i <= a.length(); i++) {
            curr[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                curr[j] = Math.min(Math.min(curr[j - 1] + 1, prev[j] + 1), prev[j - 1] + cost);
            }
            int[] tmp = prev;
            prev = curr;
            curr = tmp;
        }
        return prev[b.length()];
    }

    private static String joinName(String first, String last) {
        StringBuilder sb = new StringBuilder();
        if (first != null && !first.isBlank()) sb.append(first.trim());
        if (last != null && !last.isBlank()) {
            if (sb.length() > 0) sb.append(' ');
            sb.append(last.trim());
        }
        return sb.toString();
    }

    private static String format(double score) {
        return String.format(Locale.ROOT, "%.2f", score);
    }
}
