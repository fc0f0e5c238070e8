package com.github.rudygunawan.kura.file;

import java.util.Objects;

/**
 * Identifies a saved draft by the project it belongs to and its id within that project.
 */
public final class DraftKey {
    private final String projectId;
    private final String draftId;

    public DraftKey(String projectId, String draftId) {
        this.projectId = Objects.requireNonNull(projectId, "projectId cannot be null");
        this.draftId = Objects.requireNonNull(draftId, "draftId cannot be null");
        if (projectId.isEmpty() || draftId.isEmpty()) {
            throw new IllegalArgumentException("draft key parts must not be empty");
        }
    }

    public String getProjectId() {
        return projectId;
    }

    public String getDraftId() {
        return draftId;
    }

    /**
     * Returns the composite cache key {@code projectId/draftId}.
     */
    public String asCacheKey() {
        return projectId + "/" + draftId;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        }
        if (!(obj instanceof DraftKey)) {
            return false;
        }
        DraftKey other = (DraftKey) obj;
        return projectId.equals(other.projectId) && draftId.equals(other.draftId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(projectId, draftId);
    }

    @Override
    public String toString() {
        return "DraftKey(" + asCacheKey() + ")";
    }
}
