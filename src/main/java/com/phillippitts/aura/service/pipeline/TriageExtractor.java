package com.phillippitts.aura.service.pipeline;

import com.phillippitts.aura.domain.TriageLevel;

/**
 * Parses the {@code TRIAGE_LEVEL: <level>} trailer of a generated report.
 *
 * <p>Only the last non-blank line is inspected. A missing marker or an unknown level yields
 * {@link TriageLevel#UNDETERMINED}; malformed trailers are not errors.
 */
public final class TriageExtractor {

    static final String MARKER = "TRIAGE_LEVEL:";

    private TriageExtractor() {}

    public static TriageLevel extract(String report) {
        if (report == null || report.isBlank()) {
            return TriageLevel.UNDETERMINED;
        }
        String lastLine = lastNonBlankLine(report);
        int idx = lastLine.indexOf(MARKER);
        if (idx < 0) {
            return TriageLevel.UNDETERMINED;
        }
        String value = clean(lastLine.substring(idx + MARKER.length()));
        return TriageLevel.fromLabel(value).orElse(TriageLevel.UNDETERMINED);
    }

    private static String lastNonBlankLine(String text) {
        String[] lines = text.strip().split("\\R");
        for (int i = lines.length - 1; i >= 0; i--) {
            if (!lines[i].isBlank()) {
                return lines[i];
            }
        }
        return "";
    }

    // "[Urgent]", "**Urgent**", "Urgent." all mean Urgent
    private static String clean(String raw) {
        return raw.trim().replaceAll("^[\\[\"'*`\\s]+|[\\]\"'*`.\\s]+$", "");
    }
}
