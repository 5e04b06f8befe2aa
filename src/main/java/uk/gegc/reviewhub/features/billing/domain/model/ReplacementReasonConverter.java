package uk.gegc.reviewhub.features.billing.domain.model;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter(autoApply = true)
public class ReplacementReasonConverter implements AttributeConverter<ReplacementReason, String> {

    @Override
    public String convertToDatabaseColumn(ReplacementReason attribute) {
        return attribute == null ? null : attribute.getValue();
    }

    @Override
    public ReplacementReason convertToEntityAttribute(String dbData) {
        return dbData == null ? null : ReplacementReason.fromValue(dbData);
    }
}
