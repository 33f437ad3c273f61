package com.overseer.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Session information supplied alongside a {@link Request}.
 *
 * @param priorPatterns patterns already recorded for this session (used for reusability scoring)
 * @param recentFiles   files touched recently in the session
 * @param currentTokens estimated tokens already loaded in the working context
 * @param loadedFiles   number of files already loaded in the working context
 */
public record SessionContext(
    List<String> priorPatterns,
    List<String> recentFiles,
    int currentTokens,
    int loadedFiles
) implements Serializable {

    public SessionContext {
        priorPatterns = priorPatterns == null ? List.of() : List.copyOf(priorPatterns);
        recentFiles = recentFiles == null ? List.of() : List.copyOf(recentFiles);
        currentTokens = Math.max(0, currentTokens);
        loadedFiles = Math.max(0, loadedFiles);
    }

    public static SessionContext empty() {
        return new SessionContext(List.of(), List.of(), 0, 0);
    }
}
