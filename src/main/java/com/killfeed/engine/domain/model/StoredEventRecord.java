package com.killfeed.engine.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Lob;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Table(name = "kill_event", indexes = {
        @Index(name = "idx_kill_event_timestamp", columnList = "timestampEpochMs"),
        @Index(name = "idx_kill_event_player", columnList = "playerInvolved"),
        @Index(name = "idx_kill_event_source", columnList = "source"),
        @Index(name = "idx_kill_event_fingerprint", columnList = "fingerprint")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StoredEventRecord {

    public static final int SEARCH_TEXT_LENGTH = 2000;

    @Id
    @Column(length = 255)
    private String id;

    private long timestampEpochMs;

    @Lob
    @Column(nullable = false)
    private String eventData;

    private boolean playerInvolved;

    @Enumerated(EnumType.STRING)
    @Column(length = 16)
    private EventSource source;

    private long createdAtEpochMs;

    @Column(length = 512)
    private String fingerprint;

    @Column(length = SEARCH_TEXT_LENGTH)
    private String searchText;
}
