package com.wildsentinel.core.repository;

import com.wildsentinel.core.model.AlertRule;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Heap-backed {@link AlertRuleRepository}.
 *
 * @since 1.0.0
 */
public class InMemoryAlertRuleRepository implements AlertRuleRepository {

    private final Map<String, AlertRule> rules = new ConcurrentHashMap<>();

    @Override
    public void save(AlertRule rule) {
        Objects.requireNonNull(rule, "rule must not be null");
        rules.put(Objects.requireNonNull(rule.getId(), "rule id must not be null"), rule);
    }

    @Override
    public Optional<AlertRule> findById(String id) {
        return Optional.ofNullable(rules.get(id));
    }

    @Override
    public List<AlertRule> findByUser(String userId) {
        return rules.values().stream().filter(r -> userId.equals(r.getUserId())).toList();
    }

    @Override
    public List<AlertRule> findActive() {
        return rules.values().stream().filter(AlertRule::isActive).toList();
    }
}
