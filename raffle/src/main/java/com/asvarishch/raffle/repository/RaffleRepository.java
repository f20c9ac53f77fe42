package com.asvarishch.raffle.repository;

import com.asvarishch.raffle.model.Raffle;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface RaffleRepository extends JpaRepository<Raffle, Long> {

    // Every mutation locks the single raffle row so that operations run one after another.
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("""
             SELECT r
             FROM Raffle r
             WHERE r.raffleId = :raffleId
            """)
    Optional<Raffle> findByIdForUpdate(@Param("raffleId") Long raffleId);
}
