package com.asvarishch.raffle.payout;

import com.asvarishch.raffle.exception.PayoutFailedException;
import com.asvarishch.raffle.model.Wallet;
import com.asvarishch.raffle.repository.WalletRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;

/**
 * Credits the winner's {@link Wallet} inside the caller's transaction, creating the wallet on first
 * payout. Wallets flagged {@code acceptsFunds = false} reject the transfer.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WalletPayoutTransfer implements PayoutTransfer {

    private final WalletRepository walletRepository;

    @Override
    @Transactional
    public void transfer(String recipient, BigDecimal amount) {
        if (recipient == null || recipient.isBlank()) {
            throw new PayoutFailedException(String.valueOf(recipient), amount, "recipient is blank");
        }
        if (amount == null || amount.signum() < 0) {
            throw new IllegalArgumentException("amount must be non-negative");
        }
        try {
            final Wallet wallet = walletRepository.findByAddressForUpdate(recipient)
                    .orElseGet(() -> Wallet.builder().address(recipient).build());
            if (!wallet.isAcceptsFunds()) {
                throw new PayoutFailedException(recipient, amount, "recipient does not accept funds");
            }
            final BigDecimal before = wallet.getBalance();
            wallet.credit(amount);
            walletRepository.saveAndFlush(wallet);
            log.info("Payout credited: recipient={}, amount={}, balanceBefore={}, balanceAfter={}",
                    recipient, amount, before, wallet.getBalance());
        } catch (DataAccessException e) {
            throw new PayoutFailedException(recipient, amount, e);
        }
    }
}
