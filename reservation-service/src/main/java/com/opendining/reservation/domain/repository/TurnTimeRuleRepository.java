package com.opendining.reservation.domain.repository;

import com.opendining.reservation.domain.model.TurnTimeRule;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface TurnTimeRuleRepository extends JpaRepository<TurnTimeRule, Long> {
    List<TurnTimeRule> findByRestaurantIdAndActiveTrue(Long restaurantId);
}
