package com.asvarishch.raffle.repository;

import com.asvarishch.raffle.model.Wallet;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface WalletRepository extends JpaRepository<Wallet, String> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("""
             SELECT w
             FROM Wallet w
             WHERE w.address = :address
            """)
    Optional<Wallet> findByAddressForUpdate(@Param("address") String address);
}
