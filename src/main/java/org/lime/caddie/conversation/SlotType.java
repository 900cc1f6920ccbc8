package org.lime.caddie.conversation;

public enum SlotType {
    AREA,
    TARGET,
    SUBJECT,
    INTENSITY,
    TOPIC
}
