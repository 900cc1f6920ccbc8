package org.lime.caddie.conversation;

public record PendingClarification(Mode originMode, SlotType slot) {
}
