package com.opendining.reservation.domain.service;

import com.opendining.common.exception.ResourceNotFoundException;
import com.opendining.reservation.domain.model.OperatingSchedule;
import com.opendining.reservation.domain.model.Restaurant;
import com.opendining.reservation.domain.repository.RestaurantRepository;
import com.opendining.reservation.domain.repository.ServicePeriodRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * Read access to restaurant configuration owned by the restaurant admin side.
 */
@Service
@RequiredArgsConstructor
public class RestaurantDirectory {

    private final RestaurantRepository restaurantRepository;
    private final ServicePeriodRepository servicePeriodRepository;

    public Restaurant getRestaurant(Long restaurantId) {
        return restaurantRepository.findById(restaurantId)
                .orElseThrow(() -> new ResourceNotFoundException("Restaurant", restaurantId));
    }

    public OperatingSchedule getSchedule(Long restaurantId) {
        return new OperatingSchedule(restaurantId, servicePeriodRepository.findByRestaurantId(restaurantId));
    }
}
