package org.lime.caddie.profile;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Set;

@Entity @Table(name="user_preference")
@Data @NoArgsConstructor @AllArgsConstructor @Builder
public class UserPreference {
    @Id
    @Column(name="user_id")
    private String userId;
    @Column(name="cigar_strength")
    private String cigarStrength;     // mild | medium | full
    @Column(name="price_preference")
    private String pricePreference;   // budget | mid | premium
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name="favorite_bourbon", joinColumns=@JoinColumn(name="user_id"))
    @Column(name="name")
    @Builder.Default
    private Set<String> favoriteBourbons = new LinkedHashSet<>();
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name="favorite_cigar", joinColumns=@JoinColumn(name="user_id"))
    @Column(name="name")
    @Builder.Default
    private Set<String> favoriteCigars = new LinkedHashSet<>();
    @Column(name="updated_at")
    private Instant updatedAt;
}
