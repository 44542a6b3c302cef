package com.phillippitts.aura.service.collaborator;

import com.phillippitts.aura.domain.RunRecord;

/**
 * Synthesizes the preliminary report from a run snapshot.
 *
 * <p>By contract the text ends with a {@code TRIAGE_LEVEL: <level>} line. The pipeline does not
 * enforce the format; a malformed trailer yields UNDETERMINED.
 */
public interface ReportGenerator {

    String generate(RunRecord snapshot);
}
