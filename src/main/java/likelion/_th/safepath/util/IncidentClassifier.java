package likelion._th.safepath.util;

import likelion._th.safepath.domain.IncidentCategory;
import likelion._th.safepath.domain.Severity;
import lombok.Value;

import java.util.List;
import java.util.Locale;

/**
 * Keyword rules mapping a feed's free text to a category and severity.
 * Rules are checked in order and the first match wins; text matching no rule
 * is suspicious activity of low severity.
 */
public final class IncidentClassifier {

    private static final List<String> AGGRESSIVE = List.of("aggressive", "threatening", "threats", "harassment");
    private static final List<String> VIOLENT = List.of(
            "weapon", "shooting", "shots", "gun", "knife", "explosive", "explosion", "robbery", "assault", "battery");
    private static final List<String> DRUGS = List.of("drug", "narcotic", "needle");
    private static final List<String> PROPERTY = List.of("burglary", "breaking in", "theft", "purse snatch");
    // 출동 신고 유형 "Mentally Disturbed Person"
    private static final List<String> DISTURBED_PERSON = List.of("mentally disturbed");
    private static final List<String> ENCAMPMENT = List.of("encampment");

    private IncidentClassifier() {
    }

    @Value
    public static class Classification {
        IncidentCategory category;
        Severity severity;
    }

    /**
     * @param text             source text, e.g. service name and subtype
     * @param reportedSeverity severity the source itself reports, may be null.
     *                         Only encampment reports take it into account.
     */
    public static Classification classify(String text, Severity reportedSeverity) {
        String t = text == null ? "" : text.toLowerCase(Locale.ROOT);

        if (containsAny(t, AGGRESSIVE)) {
            return new Classification(IncidentCategory.AGGRESSIVE_BEHAVIOR, Severity.HIGH);
        }
        if (containsAny(t, VIOLENT)) {
            return new Classification(IncidentCategory.CRIME, Severity.HIGH);
        }
        if (containsAny(t, DRUGS)) {
            return new Classification(IncidentCategory.CRIME, Severity.MEDIUM);
        }
        if (containsAny(t, PROPERTY)) {
            return new Classification(IncidentCategory.CRIME, Severity.MEDIUM);
        }
        if (containsAny(t, DISTURBED_PERSON)) {
            return new Classification(IncidentCategory.CRIME, Severity.MEDIUM);
        }
        if (containsAny(t, ENCAMPMENT)) {
            // 소스가 high 로 보고한 경우만 high
            Severity severity = reportedSeverity == Severity.HIGH ? Severity.HIGH : Severity.MEDIUM;
            return new Classification(IncidentCategory.ENCAMPMENT, severity);
        }
        return new Classification(IncidentCategory.SUSPICIOUS_ACTIVITY, Severity.LOW);
    }

    private static boolean containsAny(String text, List<String> keywords) {
        for (String keyword : keywords) {
            if (text.contains(keyword)) {
                return true;
            }
        }
        return false;
    }
}
