package com.asvarishch.raffle.controller;

import com.asvarishch.raffle.dto.EnterRaffleRequestDTO;
import com.asvarishch.raffle.dto.EntryReceiptDTO;
import com.asvarishch.raffle.dto.RaffleSnapshotDTO;
import com.asvarishch.raffle.enums.RaffleState;
import com.asvarishch.raffle.service.RaffleEntryService;
import com.asvarishch.raffle.service.RaffleQueryService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.math.BigDecimal;
import java.time.Instant;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/raffle")
public class RaffleController {

    private final RaffleEntryService entryService;
    private final RaffleQueryService queryService;

    @PostMapping("/entries")
    @ResponseStatus(HttpStatus.CREATED)
    public EntryReceiptDTO enter(@RequestBody EnterRaffleRequestDTO req) {
        return entryService.enter(req.player(), req.amount());
    }

    @GetMapping
    public RaffleSnapshotDTO snapshot() {
        return queryService.getSnapshot();
    }

    @GetMapping("/entrance-fee")
    public BigDecimal entranceFee() {
        return queryService.getEntranceFee();
    }

    @GetMapping("/players/{index}")
    public String player(@PathVariable int index) {
        return queryService.getPlayer(index);
    }

    @GetMapping("/players/count")
    public int numberOfPlayers() {
        return queryService.getNumberOfPlayers();
    }

    @GetMapping("/recent-winner")
    public String recentWinner() {
        return queryService.getRecentWinner();
    }

    @GetMapping("/state")
    public RaffleState state() {
        return queryService.getRaffleState();
    }

    @GetMapping("/latest-timestamp")
    public Instant latestTimestamp() {
        return queryService.getLatestTimestamp();
    }

    @GetMapping("/interval")
    public long intervalSeconds() {
        return queryService.getInterval().toSeconds();
    }

    @GetMapping("/request-confirmations")
    public int requestConfirmations() {
        return queryService.getRequestConfirmations();
    }

    @GetMapping("/num-words")
    public int numWords() {
        return queryService.getNumWords();
    }
}
