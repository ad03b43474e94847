package com.nosota.mvault.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * A member of the participant set. The identity itself is the primary key, so the set can hold no duplicates.
 */
@Entity
@Table(name = "participant")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class Participant {

    @Id
    @Column(name = "participant", length = 128)
    private String participant;

    @Column(name = "added_at", nullable = false)
    private LocalDateTime addedAt;
}
