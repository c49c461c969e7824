package com.flagship.recurring_ledger.persistence;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface TransactionRepository extends JpaRepository<TransactionEntity, UUID> {

    List<TransactionEntity> findByAccountIdOrderByOccurrenceDateDesc(UUID accountId);

    List<TransactionEntity> findBySourceTemplateIdOrderByOccurrenceDateAsc(UUID sourceTemplateId);

    @Query("""
        SELECT t FROM TransactionEntity t
        WHERE t.sourceTemplateId = :templateId AND t.occurrenceDate >= :from
        ORDER BY t.occurrenceDate ASC
        """)
    List<TransactionEntity> findLinkedOnOrAfter(@Param("templateId") UUID templateId,
                                                @Param("from") LocalDate from);

    Optional<TransactionEntity> findByIdempotencyKey(String idempotencyKey);
}
