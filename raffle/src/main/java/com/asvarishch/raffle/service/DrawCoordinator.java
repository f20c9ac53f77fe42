package com.asvarishch.raffle.service;

import com.asvarishch.raffle.config.RaffleProperties;
import com.asvarishch.raffle.event.RaffleEvent;
import com.asvarishch.raffle.exception.PayoutFailedException;
import com.asvarishch.raffle.exception.RaffleException;
import com.asvarishch.raffle.exception.UpkeepNotNeededException;
import com.asvarishch.raffle.gateway.AutomationCompatible;
import com.asvarishch.raffle.gateway.RandomnessConsumer;
import com.asvarishch.raffle.gateway.RandomnessGateway;
import com.asvarishch.raffle.gateway.RandomnessRequest;
import com.asvarishch.raffle.gateway.UpkeepResult;
import com.asvarishch.raffle.model.Raffle;
import com.asvarishch.raffle.payout.PayoutTransfer;
import com.asvarishch.raffle.repository.RaffleRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Runs the two-phase draw.
 * <p>
 * Phase 1, {@link #requestDraw()} (reached through {@link #performUpkeep}):
 * <ol>
 *   <li>Lock the raffle and re-evaluate the upkeep predicate; a stale trigger fails with
 *       {@link UpkeepNotNeededException}.</li>
 *   <li>Ask the {@link RandomnessGateway} for random words and move OPEN -> CALCULATING under the returned id.</li>
 *   <li>Publish {@code RANDOMNESS_REQUESTED}.</li>
 * </ol>
 * Phase 2, {@link #fulfillRandomWords} (called by the gateway at some later time):
 * <ol>
 *   <li>Lock the raffle; reject unless a draw is pending under this request id.</li>
 *   <li>Select the winner from the first word, record it and reset the round (bookkeeping first).</li>
 *   <li>Transfer the whole pool to the winner as the last step.
 *       If the transfer fails the in-memory round is restored and the transaction rolls back, so the raffle
 *       stays CALCULATING with its participants and pool intact.</li>
 *   <li>Publish {@code WINNER_PICKED}.</li>
 * </ol>
 * There is no timeout: a request that is never fulfilled leaves the raffle CALCULATING.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DrawCoordinator implements RandomnessConsumer, AutomationCompatible {

    private static final byte[] NO_PERFORM_DATA = new byte[0];

    private final RaffleRepository raffleRepository;
    private final UpkeepEvaluator upkeepEvaluator;
    private final RandomnessGateway randomnessGateway;
    private final PayoutTransfer payoutTransfer;
    private final RaffleProperties properties;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    @Override
    @Transactional(readOnly = true)
    public UpkeepResult checkUpkeep(byte[] checkData) {
        final Raffle raffle = loadRaffle();
        final UpkeepCheck check = upkeepEvaluator.evaluate(raffle, clock.instant());
        log.debug("[UPKEEP] check: needed={}, {}", check.upkeepNeeded(), check);
        return new UpkeepResult(check.upkeepNeeded(), NO_PERFORM_DATA);
    }

    @Override
    @Transactional
    public void performUpkeep(byte[] performData) {
        requestDraw();
    }

    /**
     * @return id of the issued randomness request
     * @throws UpkeepNotNeededException if the predicate does not hold at this moment
     */
    @Transactional
    public long requestDraw() {
        final Raffle raffle = lockRaffle();
        final Instant now = clock.instant();

        final UpkeepCheck check = upkeepEvaluator.evaluate(raffle, now);
        if (!check.upkeepNeeded()) {
            log.info("[DRAW] Rejected: upkeep not needed ({})", check);
            throw new UpkeepNotNeededException(check.balance(), check.numPlayers(), check.state());
        }

        final long requestId = randomnessGateway.requestRandomWords(buildRequest());
        raffle.startDraw(requestId);
        raffleRepository.save(raffle);

        log.info("[DRAW] Requested: requestId={}, players={}, pool={}, round={}",
                requestId, raffle.getNumberOfPlayers(), raffle.getPoolBalance(), raffle.getRoundNumber());
        eventPublisher.publishEvent(RaffleEvent.randomnessRequested(raffle.getRaffleId(), raffle.getRoundNumber(), requestId, now));
        return requestId;
    }

    /**
     * Only {@code randomWords.get(0)} is used; any further words are ignored.
     */
    @Override
    @Transactional
    public void fulfillRandomWords(long requestId, List<BigInteger> randomWords) {
        if (randomWords == null || randomWords.isEmpty()) {
            throw new IllegalArgumentException("randomWords must not be empty");
        }
        final Raffle raffle = lockRaffle();
        try {
            raffle.requirePending(requestId);
        } catch (RaffleException e) {
            log.info("[DRAW] Fulfillment rejected: requestId={}, state={}, pendingRequestId={}, reason={}",
                    requestId, raffle.getState(), raffle.getPendingRequestId(), e.getErrorCode());
            throw e;
        }

        final Instant now = clock.instant();
        final Raffle.RoundCheckpoint checkpoint = raffle.checkpoint();
        final Raffle.DrawOutcome outcome = raffle.completeDraw(requestId, randomWords.get(0), now);
        raffleRepository.save(raffle);

        try {
            payoutTransfer.transfer(outcome.winner(), outcome.payout());
        } catch (PayoutFailedException e) {
            raffle.restore(checkpoint);
            log.warn("[DRAW] Payout failed, round restored to CALCULATING: requestId={}, winner={}, amount={}, reason={}",
                    requestId, outcome.winner(), outcome.payout(), e.getMessage());
            throw e;
        }

        log.info("[DRAW] Winner picked: requestId={}, index={}, winner={}, payout={}, round {} -> {}",
                requestId, outcome.winnerIndex(), outcome.winner(), outcome.payout(),
                outcome.roundNumber(), raffle.getRoundNumber());
        eventPublisher.publishEvent(RaffleEvent.winnerPicked(raffle.getRaffleId(), outcome.roundNumber(), requestId,
                outcome.winner(), outcome.payout(), now));
    }

    private RandomnessRequest buildRequest() {
        final RaffleProperties.Vrf vrf = properties.getVrf();
        return new RandomnessRequest(vrf.getGasLane(), vrf.getSubscriptionId(), vrf.getRequestConfirmations(),
                vrf.getCallbackGasLimit(), vrf.getNumWords());
    }

    private Raffle lockRaffle() {
        return raffleRepository.findByIdForUpdate(Raffle.SINGLETON_ID)
                .orElseThrow(() -> new IllegalStateException("Raffle not initialised: id=" + Raffle.SINGLETON_ID));
    }

    private Raffle loadRaffle() {
        return raffleRepository.findById(Raffle.SINGLETON_ID)
                .orElseThrow(() -> new IllegalStateException("Raffle not initialised: id=" + Raffle.SINGLETON_ID));
    }
}
