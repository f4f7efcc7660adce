package com.flagship.smart_sync.view;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ApprovalQueueItemRepository extends JpaRepository<ApprovalQueueItemEntity, UUID> {

    List<ApprovalQueueItemEntity> findByTenantId(UUID tenantId);

    Optional<ApprovalQueueItemEntity> findByTenantIdAndBillId(UUID tenantId, UUID billId);
}
