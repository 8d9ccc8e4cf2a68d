package com.filingsync.ingestion.repository;

import com.filingsync.ingestion.domain.IssuerEntity;
import org.springframework.data.jpa.repository.JpaRepository;

public interface IssuerRepository extends JpaRepository<IssuerEntity, String> {
}
