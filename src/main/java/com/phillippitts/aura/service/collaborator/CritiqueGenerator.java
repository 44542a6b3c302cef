package com.phillippitts.aura.service.collaborator;

import com.phillippitts.aura.domain.Critique;
import com.phillippitts.aura.domain.RunRecord;

/**
 * Reviews the gathered evidence for inconsistencies, gaps and red flags.
 */
public interface CritiqueGenerator {

    Critique critique(RunRecord snapshot);
}
