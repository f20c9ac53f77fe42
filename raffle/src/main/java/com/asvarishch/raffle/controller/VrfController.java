package com.asvarishch.raffle.controller;

import com.asvarishch.raffle.dto.FulfillRequestDTO;
import com.asvarishch.raffle.gateway.LocalVrfCoordinator;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

/**
 * Operator endpoint driving the local randomness provider.
 * POST /api/vrf/requests/{requestId}/fulfill, optional body { "randomWords": [...] }.
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/vrf")
public class VrfController {

    private final LocalVrfCoordinator vrfCoordinator;

    @PostMapping("/requests/{requestId}/fulfill")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void fulfill(@PathVariable long requestId, @RequestBody(required = false) FulfillRequestDTO body) {
        if (body == null || body.randomWords() == null || body.randomWords().isEmpty()) {
            vrfCoordinator.fulfill(requestId);
        } else {
            vrfCoordinator.fulfill(requestId, body.randomWords());
        }
    }
}
