package org.lime.caddie.conversation;

import lombok.Data;
import org.lime.caddie.memory.EntityCategory;

@Data
public class PairingState {

    private String subject;
    private EntityCategory subjectCategory = EntityCategory.BOURBON;
    private Intensity intensity;
    private String topicKey;
    private boolean awaitingRefinement;

    public void reset() {
        subject = null;
        subjectCategory = EntityCategory.BOURBON;
        intensity = null;
        topicKey = null;
        awaitingRefinement = false;
    }
}
