package com.knowledge.curation.review;

import java.util.List;
import java.util.Objects;

/**
 * A parsed reviewer command.
 *
 * @param type     command type
 * @param targetId item argument (canonical for merges, item for update/reject), or null
 * @param note     free-text note or reason, or null
 * @param title    new title for update, or null
 * @param body     new body for update, or null
 * @param groups   sub-groups for split
 */
public record ReviewCommand(
        Type type,
        String targetId,
        String note,
        String title,
        String body,
        List<List<String>> groups
) {
    public enum Type {
        MERGE,
        MERGE_AB,
        MERGE_BC,
        UPDATE,
        KEEP,
        REJECT,
        DIFF,
        SPLIT,
        HELP,
        QUIT;

        public boolean isMutating() {
            return this != DIFF && this != HELP && this != QUIT;
        }
    }

    public ReviewCommand {
        Objects.requireNonNull(type, "type is required");
        groups = groups != null ? groups.stream().map(List::copyOf).toList() : List.of();
    }

    public static ReviewCommand merge(String canonicalId, String note) {
        return new ReviewCommand(Type.MERGE, canonicalId, note, null, null, null);
    }

    public static ReviewCommand mergeAB(String canonicalId) {
        return new ReviewCommand(Type.MERGE_AB, canonicalId, null, null, null, null);
    }

    public static ReviewCommand mergeBC(String canonicalId) {
        return new ReviewCommand(Type.MERGE_BC, canonicalId, null, null, null, null);
    }

    public static ReviewCommand update(String itemId, String title, String body) {
        return new ReviewCommand(Type.UPDATE, itemId, null, title, body, null);
    }

    public static ReviewCommand keep(String note) {
        return new ReviewCommand(Type.KEEP, null, note, null, null, null);
    }

    public static ReviewCommand reject(String itemId, String reason) {
        return new ReviewCommand(Type.REJECT, itemId, reason, null, null, null);
    }

    public static ReviewCommand split(List<List<String>> groups) {
        return new ReviewCommand(Type.SPLIT, null, null, null, null, groups);
    }

    public static ReviewCommand of(Type type) {
        return new ReviewCommand(type, null, null, null, null, null);
    }
}
