package org.lime.caddie.profile;

import org.lime.caddie.memory.EntityCategory;
import org.springframework.data.jpa.domain.Specification;

import java.util.Locale;

public class InteractionSpec {

    public static Specification<InteractionRecord> userEquals(String userId) {
        return (root, q, cb) -> cb.equal(root.get("userId"), userId);
    }

    public static Specification<InteractionRecord> entityEquals(String name) {
        return (root, q, cb) -> name == null ? null
                : cb.equal(cb.lower(root.get("entityName")), name.toLowerCase(Locale.ROOT));
    }

    public static Specification<InteractionRecord> categoryEquals(EntityCategory category) {
        return (root, q, cb) -> category == null ? null
                : cb.equal(root.get("category"), category);
    }
}
