package uk.gegc.reviewhub.features.billing.infra.mapping;

import org.mapstruct.Mapper;
import org.mapstruct.ReportingPolicy;
import uk.gegc.reviewhub.features.billing.api.dto.SubscriptionSnapshotDto;
import uk.gegc.reviewhub.features.billing.domain.model.CustomerSubscription;

import java.util.List;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.ERROR)
public interface CustomerSubscriptionMapper {
    SubscriptionSnapshotDto toSnapshot(CustomerSubscription entity);
    List<SubscriptionSnapshotDto> toSnapshots(List<CustomerSubscription> entities);
}
