package com.dailyfin.backend.repositories;

import java.util.Collection;
import java.util.UUID;

import org.springframework.data.jpa.domain.Specification;

import com.dailyfin.backend.entities.Note;

public final class NoteSpecifications {

    private NoteSpecifications() {
    }

    public static Specification<Note> ownedBy(UUID userId) {
        return (root, query, cb) -> cb.equal(root.get("user").get("id"), userId);
    }

    public static Specification<Note> archived(Boolean archived) {
        if (archived == null) return null;
        return (root, query, cb) -> cb.equal(root.get("isArchived"), archived);
    }

    public static Specification<Note> pinned(Boolean pinned) {
        if (pinned == null) return null;
        return (root, query, cb) -> cb.equal(root.get("isPinned"), pinned);
    }

    public static Specification<Note> withColor(String color) {
        if (color == null || color.isBlank()) return null;
        return (root, query, cb) -> cb.equal(cb.lower(root.get("color")), color.toLowerCase());
    }

    public static Specification<Note> taggedWithAny(Collection<String> tags) {
        if (tags == null || tags.isEmpty()) return null;
        return (root, query, cb) -> {
            var sub = query.subquery(UUID.class);
            var subRoot = sub.from(Note.class);
            var tagJoin = subRoot.join("tags");
            sub.select(subRoot.get("id"))
                    .where(cb.equal(subRoot.get("id"), root.get("id")), tagJoin.in(tags));
            return cb.exists(sub);
        };
    }

    public static Specification<Note> matching(String search) {
        if (search == null || search.isBlank()) return null;
        String pattern = "%" + search.trim().toLowerCase() + "%";
        return (root, query, cb) -> cb.or(
                cb.like(cb.lower(root.get("title")), pattern),
                cb.like(cb.lower(root.get("content")), pattern)
        );
    }
}
