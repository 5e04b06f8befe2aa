package uk.gegc.reviewhub.features.billing.domain.model;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter(autoApply = true)
public class SubscriptionLifecycleStatusConverter implements AttributeConverter<SubscriptionLifecycleStatus, String> {

    @Override
    public String convertToDatabaseColumn(SubscriptionLifecycleStatus attribute) {
        return attribute == null ? null : attribute.getValue();
    }

    @Override
    public SubscriptionLifecycleStatus convertToEntityAttribute(String dbData) {
        if (dbData == null) {
            return null;
        }
        return SubscriptionLifecycleStatus.fromValue(dbData)
                .orElseThrow(() -> new IllegalArgumentException("Unknown subscription status: " + dbData));
    }
}
