package org.lime.caddie.profile;

import jakarta.persistence.*;
import lombok.*;
import org.lime.caddie.memory.EntityCategory;

import java.time.Instant;

@Entity @Table(name="interaction")
@Data @NoArgsConstructor @AllArgsConstructor @Builder
public class InteractionRecord {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;
    @Column(name="user_id", nullable=false)
    private String userId;
    @Column(name="entity_name", nullable=false)
    private String entityName;    // Weller, Padron 1964
    @Enumerated(EnumType.STRING)
    private EntityCategory category;
    @Column(name="mode_tag")
    private String modeTag;       // info | pairing | hunt
    @Column(name="recorded_at")
    private Instant recordedAt;
}
