package com.flagship.recurring_ledger.persistence;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface AccountRepository extends JpaRepository<AccountEntity, UUID> {

    /**
     * Loads the account with a row lock held until the surrounding transaction ends.
     * Serializes all ledger writers of one account.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT a FROM AccountEntity a WHERE a.id = :id")
    Optional<AccountEntity> findByIdForUpdate(@Param("id") UUID id);

    List<AccountEntity> findByUserIdOrderByCreatedAtAsc(UUID userId);

    @Query("SELECT a.id FROM AccountEntity a ORDER BY a.createdAt ASC")
    List<UUID> findAllIds();
}
