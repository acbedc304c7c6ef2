package com.wildsentinel.core.repository;

import com.wildsentinel.core.model.AlertRule;

import java.util.List;
import java.util.Optional;

/**
 * Store of user alert rules.
 *
 * @since 1.0.0
 */
public interface AlertRuleRepository {

    /**
     * Insert or replace the rule with the same id.
     */
    void save(AlertRule rule);

    Optional<AlertRule> findById(String id);

    List<AlertRule> findByUser(String userId);

    /**
     * @return every active rule, the candidate set for dispatch
     */
    List<AlertRule> findActive();
}
