package com.opendining.reservation.domain.repository;

import com.opendining.reservation.domain.model.DiningTable;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;

public interface DiningTableRepository extends JpaRepository<DiningTable, Long> {

    /**
     * Tables that can currently receive bookings: active and not soft-deleted.
     */
    @Query("""
           SELECT t FROM DiningTable t
           WHERE t.restaurantId = :restaurantId
             AND t.active = true
             AND t.deletedAt IS NULL
           ORDER BY t.id
           """)
    List<DiningTable> findAssignable(@Param("restaurantId") Long restaurantId);

    /**
     * SELECT ... FOR UPDATE on the given tables, in id order so two writers never wait on each
     * other in a cycle. Must run inside a transaction; the locks are held until it ends.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT t FROM DiningTable t WHERE t.id IN :ids ORDER BY t.id")
    List<DiningTable> findAllByIdWithLock(@Param("ids") Collection<Long> ids);
}
