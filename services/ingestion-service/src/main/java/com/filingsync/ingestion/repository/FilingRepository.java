package com.filingsync.ingestion.repository;

import com.filingsync.ingestion.domain.FilingEntity;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface FilingRepository extends JpaRepository<FilingEntity, UUID> {

    List<FilingEntity> findByDocumentIdentityOrderByVersionAsc(String documentIdentity);

    Optional<FilingEntity> findByDocumentIdentityAndVersion(String documentIdentity, int version);
}
