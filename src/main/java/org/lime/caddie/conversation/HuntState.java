package org.lime.caddie.conversation;

import lombok.Data;
import org.lime.caddie.store.TargetCategory;

@Data
public class HuntState {

    private String area;
    private String bottle;
    private TargetCategory category = TargetCategory.SPIRITS;
    private boolean awaitingTarget;

    public boolean isStoreHunt() {
        return bottle == null || bottle.isBlank();
    }
}
