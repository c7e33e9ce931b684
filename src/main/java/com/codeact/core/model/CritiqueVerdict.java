package com.codeact.core.model;

import java.io.Serializable;

/**
 * Critic's judgement of a proposed final answer.
 *
 * @param feedback what to fix when rejected; may be empty when accepted
 */
public record CritiqueVerdict(
    boolean accepted,
    String feedback
) implements Serializable {

    public static CritiqueVerdict accept(String feedback) {
        return new CritiqueVerdict(true, feedback == null ? "" : feedback);
    }
}
