package com.asvarishch.raffle.service;

import com.asvarishch.raffle.dto.WalletDTO;
import com.asvarishch.raffle.model.Wallet;
import com.asvarishch.raffle.repository.WalletRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;

@Slf4j
@Service
@RequiredArgsConstructor
public class WalletService {

    private final WalletRepository walletRepository;

    /** Unknown addresses report a zero balance and accept funds. */
    @Transactional(readOnly = true)
    public WalletDTO getWallet(String address) {
        return walletRepository.findById(address)
                .map(w -> new WalletDTO(w.getAddress(), w.getBalance(), w.isAcceptsFunds()))
                .orElseGet(() -> new WalletDTO(address, BigDecimal.ZERO, true));
    }

    /** Marks whether the address can receive payouts. */
    @Transactional
    public WalletDTO setAcceptsFunds(String address, boolean acceptsFunds) {
        if (address == null || address.isBlank()) {
            throw new IllegalArgumentException("address must not be blank");
        }
        final Wallet wallet = walletRepository.findByAddressForUpdate(address)
                .orElseGet(() -> Wallet.builder().address(address).build());
        wallet.setAcceptsFunds(acceptsFunds);
        final Wallet saved = walletRepository.save(wallet);
        log.info("Wallet {} acceptsFunds={}", address, acceptsFunds);
        return new WalletDTO(saved.getAddress(), saved.getBalance(), saved.isAcceptsFunds());
    }
}
