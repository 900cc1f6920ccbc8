package org.lime.caddie.ai;

import lombok.*;
import org.lime.caddie.conversation.Intensity;

@Data @NoArgsConstructor @AllArgsConstructor @Builder
public class TurnSignals {
    private String postalCode;       // 30344
    private String areaHint;         // "30344", "Dallas, TX", "Nashville"
    private String bottle;           // Weller, Blanton's
    private String spirit;           // bourbon|rye|scotch
    private String cigar;            // Padron, Arturo Fuente
    private Intensity intensity;     // mild|medium|full
    private String pricePreference;  // budget|mid|premium
    private boolean storeIntent;     // "best allocation shops"
    private boolean mentionsCigars;  // cigar shopping rather than bottles

    public boolean hasPairingSubject() {
        return cigar != null || bottle != null || spirit != null;
    }
}
