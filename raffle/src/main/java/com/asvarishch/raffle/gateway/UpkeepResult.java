package com.asvarishch.raffle.gateway;

public record UpkeepResult(boolean upkeepNeeded, byte[] performData) {
}
