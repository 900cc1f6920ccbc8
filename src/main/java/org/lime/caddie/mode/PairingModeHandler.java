package org.lime.caddie.mode;

import org.lime.caddie.conversation.DialogueSession;
import org.lime.caddie.conversation.Intensity;
import org.lime.caddie.conversation.PairingState;
import org.lime.caddie.memory.EntityCategory;
import org.lime.caddie.response.LabeledItem;
import org.lime.caddie.response.ModeOutput;
import org.lime.caddie.response.PairingDetail;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.Locale;
import java.util.Map;

@Component
public class PairingModeHandler {

    private static final String DEFAULT_SUBJECT = "bourbon";

    public ModeOutput.Pairing handle(DialogueSession session) {
        PairingState state = session.getPairing();
        Intensity intensity = state.getIntensity() == null ? Intensity.MEDIUM : state.getIntensity();
        String subject = StringUtils.hasText(state.getSubject()) ? state.getSubject() : DEFAULT_SUBJECT;
        boolean cigarInHand = state.getSubjectCategory() == EntityCategory.CIGAR;

        ModeOutput.Pairing.PairingBuilder output = ModeOutput.Pairing.builder()
                .item(new LabeledItem("Subject", subject))
                .item(new LabeledItem("Strength", intensity.label()));
        if (StringUtils.hasText(state.getTopicKey())) {
            output.item(new LabeledItem("Topic", state.getTopicKey()));
        }

        if (cigarInHand) {
            PairingGuide.Suggestion pour = PairingGuide.pourFor(intensity);
            output.summary("With the " + subject + ", reach for a " + pour.name().toLowerCase(Locale.ROOT) + ".")
                    .primary(pourDetail(subject, intensity, pour));
            for (Intensity other : Intensity.values()) {
                if (other != intensity) {
                    output.alternative(pourDetail(subject, other, PairingGuide.pourFor(other)));
                }
            }
            output.keyPoint("Match body to body: a " + intensity.label() + " smoke wants a pour that will not fade behind it.")
                    .keyPoint("Take a sip before the first draw so you taste the bourbon on its own.");
            session.getMemory().remember(EntityCategory.BOURBON, pour.name(), Map.of("strength", intensity.label()));
        } else {
            PairingGuide.Suggestion cigar = PairingGuide.cigarFor(intensity);
            output.summary("Pour the " + subject + " and light a " + cigar.name() + ".")
                    .primary(cigarDetail(subject, intensity, cigar));
            for (Intensity other : Intensity.values()) {
                if (other != intensity) {
                    output.alternative(cigarDetail(subject, other, PairingGuide.cigarFor(other)));
                }
            }
            output.keyPoint("Match body to body: a " + intensity.label() + " smoke keeps the " + subject + " in balance.")
                    .keyPoint("Toast the foot evenly so the first third does not turn harsh against the pour.");
            session.getMemory().remember(EntityCategory.CIGAR, cigar.name(), Map.of("strength", intensity.label()));
        }

        state.setIntensity(intensity);
        state.setAwaitingRefinement(true);
        return output.nextStep("Try it, then tell me if you want it milder or fuller.").build();
    }

    private static PairingDetail cigarDetail(String pour, Intensity intensity, PairingGuide.Suggestion cigar) {
        return PairingDetail.builder()
                .cigar(cigar.name())
                .strength(intensity.label())
                .why(cigar.why())
                .pour(pour + ", " + cigar.pour().toLowerCase(Locale.ROOT))
                .qualityTag(cigar.qualityTag())
                .build();
    }

    private static PairingDetail pourDetail(String cigar, Intensity intensity, PairingGuide.Suggestion pour) {
        return PairingDetail.builder()
                .cigar(cigar)
                .strength(intensity.label())
                .why(pour.why())
                .pour(pour.name() + ", " + pour.pour().toLowerCase(Locale.ROOT))
                .qualityTag(pour.qualityTag())
                .build();
    }
}
