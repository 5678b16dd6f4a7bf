package org.itinera.routing.collaborator;

/**
 * Translates display text into the caller's language.
 */
@FunctionalInterface
public interface Translator {
    CollaboratorResult<String> translate(String text);

    /**
     * Translator returning its input unchanged.
     */
    static Translator identity() {
        return CollaboratorResult::success;
    }
}
