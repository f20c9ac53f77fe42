package com.asvarishch.raffle.controller;

import com.asvarishch.raffle.dto.WalletDTO;
import com.asvarishch.raffle.service.WalletService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/wallets")
public class WalletController {

    private final WalletService walletService;

    @GetMapping("/{address}")
    public WalletDTO get(@PathVariable String address) {
        return walletService.getWallet(address);
    }

    @PutMapping("/{address}/accepts-funds")
    public WalletDTO setAcceptsFunds(@PathVariable String address, @RequestParam boolean value) {
        return walletService.setAcceptsFunds(address, value);
    }
}
