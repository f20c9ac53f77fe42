package com.asvarishch.raffle.gateway;

/**
 * Check/perform contract offered to the automation actor. The actor polls {@link #checkUpkeep} and calls
 * {@link #performUpkeep} when it reports {@code true}; the implementation re-validates on perform.
 */
public interface AutomationCompatible {

    UpkeepResult checkUpkeep(byte[] checkData);

    void performUpkeep(byte[] performData);
}
