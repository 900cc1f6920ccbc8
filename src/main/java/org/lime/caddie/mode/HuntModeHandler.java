package org.lime.caddie.mode;

import org.lime.caddie.conversation.DialogueSession;
import org.lime.caddie.conversation.HuntState;
import org.lime.caddie.memory.EntityCategory;
import org.lime.caddie.response.LabeledItem;
import org.lime.caddie.response.ModeOutput;
import org.lime.caddie.store.Provenance;
import org.lime.caddie.store.StoreRecord;
import org.lime.caddie.store.StoreResolution;
import org.lime.caddie.store.StoreResolutionService;
import org.lime.caddie.store.TargetCategory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.Map;
import java.util.Optional;

@Component
public class HuntModeHandler {

    private static final Logger log = LoggerFactory.getLogger(HuntModeHandler.class);
    static final String PLACEHOLDER_NAME = "No verified stores found yet";

    private final StoreResolutionService storeResolutionService;

    public HuntModeHandler(StoreResolutionService storeResolutionService) {
        this.storeResolutionService = storeResolutionService;
    }

    public ModeOutput.Hunt handle(DialogueSession session) {
        HuntState hunt = session.getHunt();
        StoreResolution resolution = storeResolutionService.resolveStores(hunt.getArea(), hunt.getCategory());
        boolean empty = resolution.stores().isEmpty();
        session.getMetrics().huntResolved(resolution.degraded() || empty);
        String label = StringUtils.hasText(resolution.label()) ? resolution.label() : "your area";

        ModeOutput.Hunt.HuntBuilder output = ModeOutput.Hunt.builder();
        if (empty) {
            output.stop(placeholder(label));
        } else {
            output.stops(resolution.stores());
            resolution.stores().forEach(store -> output.storeTarget(store.name()));
        }
        if (resolution.degraded()) {
            output.keyPoint("Live store search is unavailable right now, so these are curated picks only.");
        }

        if (hunt.getCategory() == TargetCategory.CIGARS) {
            output.summary("Here are cigar shops worth a visit around " + label + ".")
                    .keyPoint("Call ahead and ask what just came into the humidor.")
                    .keyPoint("Shops with a lounge usually carry the deepest selection.")
                    .item(new LabeledItem("Area", label))
                    .nextStep("Tell me what you're pouring and I'll pick a smoke for it.");
            hunt.setAwaitingTarget(false);
        } else if (hunt.isStoreHunt()) {
            output.summary("Here are the best starting moves to hunt allocations near " + label + ".")
                    .keyPoint("Independent shops with loyalty programs release most allocated bottles.")
                    .keyPoint("Ask each shop how it releases: list, raffle, points or first come.")
                    .item(new LabeledItem("Area", label))
                    .item(new LabeledItem("Target", "best allocation shops"))
                    .nextStep("Name a bottle you're chasing and I'll tailor the plan.");
            marketTip(resolution).ifPresent(output::keyPoint);
            hunt.setAwaitingTarget(true);
        } else {
            String bottle = hunt.getBottle().trim();
            output.summary("Here's how to hunt " + bottle + " around " + label + ".")
                    .targetBottle(bottle)
                    .keyPoint("Ask each shop how " + bottle + " is released and when it last came in.")
                    .keyPoint("Buy your everyday bottles at the shop you want an allocation from.")
                    .item(new LabeledItem("Area", label))
                    .item(new LabeledItem("Target", bottle))
                    .items(BottlePricing.itemsFor(bottle))
                    .nextStep("Call two of these shops and ask when " + bottle + " last came in.");
            marketTip(resolution).ifPresent(output::keyPoint);
            session.getMemory().remember(EntityCategory.BOURBON, bottle, Map.of());
            hunt.setAwaitingTarget(false);
        }
        log.info("[HuntModeHandler] Hunt near '{}' returned {} stores (degraded={})", label, resolution.stores().size(), resolution.degraded());
        return output.build();
    }

    private static Optional<String> marketTip(StoreResolution resolution) {
        return RetailMarket.forState(resolution.stateCode()).map(RetailMarket::tip);
    }

    private static StoreRecord placeholder(String label) {
        return StoreRecord.builder()
                .name(PLACEHOLDER_NAME)
                .address(label)
                .notes("Placeholder: no curated or live stores matched " + label + ". Try a nearby ZIP or a larger city.")
                .provenance(Provenance.PLACEHOLDER)
                .build();
    }
}
