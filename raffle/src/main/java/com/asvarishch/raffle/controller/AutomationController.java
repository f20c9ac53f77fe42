package com.asvarishch.raffle.controller;

import com.asvarishch.raffle.dto.DrawRequestedResponseDTO;
import com.asvarishch.raffle.dto.UpkeepResponseDTO;
import com.asvarishch.raffle.gateway.UpkeepResult;
import com.asvarishch.raffle.service.DrawCoordinator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.HexFormat;

/**
 * Endpoints for an external automation actor.
 * GET  /api/automation/upkeep -> { upkeepNeeded, performData }
 * POST /api/automation/upkeep -> { requestId } or 409 UPKEEP_NOT_NEEDED
 */
@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/automation")
public class AutomationController {

    private final DrawCoordinator drawCoordinator;

    @GetMapping("/upkeep")
    public UpkeepResponseDTO checkUpkeep() {
        final UpkeepResult result = drawCoordinator.checkUpkeep(new byte[0]);
        return new UpkeepResponseDTO(result.upkeepNeeded(), "0x" + HexFormat.of().formatHex(result.performData()));
    }

    @PostMapping("/upkeep")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public DrawRequestedResponseDTO performUpkeep() {
        final long requestId = drawCoordinator.requestDraw();
        log.info("[AUTOMATION] performUpkeep issued requestId={}", requestId);
        return new DrawRequestedResponseDTO(requestId);
    }
}
