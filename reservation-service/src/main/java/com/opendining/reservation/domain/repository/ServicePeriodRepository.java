package com.opendining.reservation.domain.repository;

import com.opendining.reservation.domain.model.ServicePeriod;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface ServicePeriodRepository extends JpaRepository<ServicePeriod, Long> {
    List<ServicePeriod> findByRestaurantId(Long restaurantId);
}
