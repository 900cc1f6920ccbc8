package org.lime.caddie.memory;

public record PronounResolution(EntityCategory requestedCategory, TrackedEntity referent) {

    public String topicKey() {
        if (requestedCategory == null) {
            return referent.name();
        }
        return requestedCategory.key() + "-pairing-for-" + referent.name();
    }
}
