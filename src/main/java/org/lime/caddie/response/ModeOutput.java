package org.lime.caddie.response;

import lombok.Builder;
import lombok.Singular;
import org.lime.caddie.conversation.Mode;
import org.lime.caddie.conversation.SlotType;
import org.lime.caddie.store.StoreRecord;

import java.util.List;

public sealed interface ModeOutput {

    Mode mode();

    @Builder
    record Info(
            String summary,
            @Singular List<String> keyPoints,
            @Singular List<LabeledItem> items,
            String nextStep
    ) implements ModeOutput {
        @Override
        public Mode mode() {
            return Mode.INFO;
        }
    }

    @Builder
    record Pairing(
            String summary,
            @Singular List<String> keyPoints,
            @Singular List<LabeledItem> items,
            PairingDetail primary,
            @Singular List<PairingDetail> alternatives,
            String nextStep
    ) implements ModeOutput {
        @Override
        public Mode mode() {
            return Mode.PAIRING;
        }
    }

    @Builder
    record Hunt(
            String summary,
            @Singular List<String> keyPoints,
            @Singular List<LabeledItem> items,
            @Singular List<StoreRecord> stops,
            @Singular List<String> targetBottles,
            @Singular List<String> storeTargets,
            String nextStep
    ) implements ModeOutput {
        @Override
        public Mode mode() {
            return Mode.HUNT;
        }
    }

    @Builder
    record Clarify(
            Mode originMode,
            SlotType slot,
            String summary,
            @Singular List<String> keyPoints,
            @Singular List<LabeledItem> examples,
            String nextStep
    ) implements ModeOutput {
        @Override
        public Mode mode() {
            return Mode.CLARIFY;
        }
    }
}
