package org.lime.caddie.response;

public record LabeledItem(String label, String value) {
}
