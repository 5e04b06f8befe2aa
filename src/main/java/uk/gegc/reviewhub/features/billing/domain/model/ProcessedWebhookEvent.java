package uk.gegc.reviewhub.features.billing.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.springframework.data.domain.Persistable;

import java.time.Instant;

/**
 * Marker that a Stripe event has been applied. Rows are only ever inserted, so a second insert
 * of the same event id fails on the primary key.
 */
@Entity
@Table(name = "processed_webhook_events")
@Getter
@Setter
public class ProcessedWebhookEvent implements Persistable<String> {

    @Id
    @Column(name = "event_id", length = 255, nullable = false, updatable = false)
    private String eventId;

    @Column(name = "event_type", nullable = false, length = 128)
    private String eventType;

    @Column(name = "subscription_id")
    private String subscriptionId;

    /** JSON object describing how the event was settled. */
    @Column(name = "metadata", length = 4000)
    private String metadata;

    @Column(name = "processed_at", nullable = false, updatable = false)
    private Instant processedAt;

    @Transient
    private boolean newEntity = true;

    @Override
    public String getId() {
        return eventId;
    }

    @Override
    public boolean isNew() {
        return newEntity;
    }

    @PostLoad
    @PostPersist
    void markPersisted() {
        this.newEntity = false;
    }
}
