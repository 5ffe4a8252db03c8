package com.opendining.reservation.domain.service;

import com.opendining.reservation.domain.model.Restaurant;
import com.opendining.reservation.domain.model.TurnTimeRule;
import com.opendining.reservation.domain.repository.TurnTimeRuleRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Resolves how long a party occupies a table.
 *
 * Resolution order:
 * 1. Active rule whose party-size range contains the party (narrowest range, then lowest
 *    minimum, then highest priority, then lowest id).
 * 2. The restaurant's default turn time, when configured.
 * 3. {@link #DEFAULT_TURN_TIME_MINUTES}.
 *
 * Never fails: duration resolution must not block booking creation.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TurnTimeResolver {

    public static final int DEFAULT_TURN_TIME_MINUTES = 120;

    static final Comparator<TurnTimeRule> RULE_PRECEDENCE = Comparator
            .comparingInt(TurnTimeRule::rangeWidth)
            .thenComparingInt(TurnTimeRule::getMinPartySize)
            .thenComparing(Comparator.comparingInt(TurnTimeRule::getPriority).reversed())
            .thenComparing(TurnTimeRule::getId, Comparator.nullsLast(Comparator.naturalOrder()));

    private final TurnTimeRuleRepository turnTimeRuleRepository;

    public int resolveDuration(Long restaurantId, int partySize) {
        return resolveDuration(restaurantId, partySize, null);
    }

    /**
     * @param restaurant optional, supplies the restaurant-level default when no rule matches
     */
    public int resolveDuration(Long restaurantId, int partySize, Restaurant restaurant) {
        List<TurnTimeRule> rules;
        try {
            rules = turnTimeRuleRepository.findByRestaurantIdAndActiveTrue(restaurantId);
        } catch (DataAccessException e) {
            log.warn("Turn time rules unavailable for restaurant {}, using default", restaurantId, e);
            return fallback(restaurant);
        }

        Optional<TurnTimeRule> rule = selectRule(rules, partySize);
        if (rule.isPresent()) {
            log.debug("Turn time for restaurant {} party {}: {} min (rule {})",
                    restaurantId, partySize, rule.get().getTurnTimeMinutes(), rule.get().getId());
            return rule.get().getTurnTimeMinutes();
        }
        return fallback(restaurant);
    }

    static Optional<TurnTimeRule> selectRule(List<TurnTimeRule> rules, int partySize) {
        return rules.stream()
                .filter(TurnTimeRule::isActive)
                .filter(r -> r.getTurnTimeMinutes() != null && r.getTurnTimeMinutes() > 0)
                .filter(r -> r.matches(partySize))
                .min(RULE_PRECEDENCE);
    }

    private int fallback(Restaurant restaurant) {
        if (restaurant != null && restaurant.getDefaultTurnTimeMinutes() != null
                && restaurant.getDefaultTurnTimeMinutes() > 0) {
            return restaurant.getDefaultTurnTimeMinutes();
        }
        return DEFAULT_TURN_TIME_MINUTES;
    }
}
