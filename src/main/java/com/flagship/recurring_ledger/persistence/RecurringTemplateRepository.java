package com.flagship.recurring_ledger.persistence;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface RecurringTemplateRepository extends JpaRepository<RecurringTemplateEntity, UUID> {

    List<RecurringTemplateEntity> findByAccountIdOrderByStartDateAsc(UUID accountId);
}
