package com.eainde.intent.nlu;

import com.eainde.intent.model.RequestCategory;
import com.eainde.intent.model.ServiceIdentification;

import java.util.Collection;
import java.util.List;

/**
 * Natural-language understanding collaborator.
 *
 * <p>Implementations may return zero identifications, and are not trusted to honour
 * the "do not repropose validated services" instruction; callers enforce it.</p>
 */
public interface NluCollaborator {

    RequestCategory classify(String text);

    List<ServiceIdentification> decompose(String text);

    List<ServiceIdentification> clarify(ClarificationContext context);

    List<String> suggestAlternatives(Collection<String> refused, Collection<String> validated, List<String> history);

    /**
     * One follow-up question about the refused services, worded for the user.
     * Only the most recent history entries are expected to inform it.
     */
    String askClarification(Collection<String> refused, Collection<String> validated, List<String> history);
}
