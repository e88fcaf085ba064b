package com.marginledger.relay;

import com.marginledger.auth.RoleRegistry;
import com.marginledger.core.LedgerSequencer;
import com.marginledger.domain.enums.LedgerRole;
import com.marginledger.domain.model.Trade;
import com.marginledger.engine.OpenLimitCommand;
import com.marginledger.engine.OpenMarketCommand;
import com.marginledger.engine.PositionEngine;
import com.marginledger.entity.RelayKeyEntity;
import com.marginledger.exception.BusinessException;
import com.marginledger.exception.ErrorCode;
import com.marginledger.exception.ResourceNotFoundException;
import com.marginledger.exception.UnauthorizedException;
import com.marginledger.oracle.ProofEncoding;
import com.marginledger.repository.jpa.RelayKeyJpaRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Entry point for calls a trader signs and a RELAYER submits.
 *
 * <p>Dispatch happens in two steps inside one sequenced operation. First the call is
 * authenticated: not expired ({@code CALL_EXPIRED}), nonce strictly above the trader's last
 * one ({@code BAD_NONCE}), signature valid for the trader's registered key
 * ({@code BAD_SIGNATURE}), parameter names limited to the action's set ({@code BAD_REQUEST});
 * the nonce is consumed at this point. Then the authenticated call
 * is routed to the position engine as the trader. If the engine call fails, the nonce
 * consumption is rolled back with it.
 */
@Service
public class DelegatedCallService {

    private static final Logger log = LoggerFactory.getLogger(DelegatedCallService.class);

    private final RelayKeyJpaRepository relayKeyJpaRepository;
    private final CallSignatureVerifier callSignatureVerifier;
    private final PositionEngine positionEngine;
    private final RoleRegistry roleRegistry;
    private final LedgerSequencer ledgerSequencer;
    private final Clock clock;

    public DelegatedCallService(
            RelayKeyJpaRepository relayKeyJpaRepository,
            CallSignatureVerifier callSignatureVerifier,
            PositionEngine positionEngine,
            RoleRegistry roleRegistry,
            LedgerSequencer ledgerSequencer,
            Clock clock) {
        this.relayKeyJpaRepository = relayKeyJpaRepository;
        this.callSignatureVerifier = callSignatureVerifier;
        this.positionEngine = positionEngine;
        this.roleRegistry = roleRegistry;
        this.ledgerSequencer = ledgerSequencer;
        this.clock = clock;
    }

    /** Registers or rotates the caller's relay key. The last consumed nonce survives rotation. */
    public void registerRelayKey(String caller, String traderId, String signingKey) {
        ledgerSequencer.run(() -> {
            if (caller == null || !caller.equals(traderId)) {
                throw new UnauthorizedException(String.format("Caller %s cannot register a key for %s", caller, traderId));
            }
            if (!StringUtils.hasText(signingKey)) {
                throw new BusinessException(ErrorCode.BAD_REQUEST, "Relay key must not be blank");
            }
            RelayKeyEntity key = relayKeyJpaRepository
                    .findById(traderId)
                    .orElseGet(() -> RelayKeyEntity.builder().traderId(traderId).build());
            key.setSigningKey(signingKey);
            key.setRegisteredAt(Instant.now(clock));
            relayKeyJpaRepository.save(key);
            log.info("Relay key registered for {}", traderId);
        });
    }

    /**
     * Authenticates {@code call} and runs it as its trader.
     *
     * @return the affected trade after the call
     */
    public Trade dispatch(String caller, DelegatedCall call) {
        return ledgerSequencer.execute(() -> {
            roleRegistry.require(caller, LedgerRole.RELAYER);
            AuthenticatedCall authenticated = authenticate(call);
            log.info("Relaying {} for {} (nonce {}) via {}",
                    call.getAction(), authenticated.getTrader(), call.getNonce(), caller);
            return route(authenticated);
        });
    }

    AuthenticatedCall authenticate(DelegatedCall call) {
        if (call.getAction() == null || !StringUtils.hasText(call.getTrader())) {
            throw new BusinessException(ErrorCode.BAD_REQUEST, "Delegated call needs a trader and an action");
        }
        long now = clock.instant().getEpochSecond();
        if (now > call.getExpiresAt()) {
            throw new BusinessException(
                    ErrorCode.CALL_EXPIRED, String.format("Call expired at %d, now %d", call.getExpiresAt(), now));
        }
        RelayKeyEntity key = relayKeyJpaRepository
                .findById(call.getTrader())
                .orElseThrow(() -> new ResourceNotFoundException("Relay key", call.getTrader()));
        if (call.getNonce() <= key.getLastNonce()) {
            throw new UnauthorizedException(
                    ErrorCode.BAD_NONCE,
                    String.format("Nonce %d not above last nonce %d", call.getNonce(), key.getLastNonce()));
        }
        if (!callSignatureVerifier.verify(call, key.getSigningKey())) {
            throw new UnauthorizedException(ErrorCode.BAD_SIGNATURE, "Signature does not match " + call.getTrader());
        }
        if (call.getParameters() != null) {
            for (String name : call.getParameters().keySet()) {
                if (!call.getAction().accepts(name)) {
                    throw new BusinessException(
                            ErrorCode.BAD_REQUEST,
                            String.format("Parameter %s is not accepted by %s", name, call.getAction()));
                }
            }
        }
        key.setLastNonce(call.getNonce());
        relayKeyJpaRepository.save(key);
        return new AuthenticatedCall(call.getTrader(), call);
    }

    private Trade route(AuthenticatedCall authenticated) {
        String trader = authenticated.getTrader();
        Map<String, String> p = authenticated.getCall().getParameters() != null
                ? authenticated.getCall().getParameters()
                : Map.of();

        return switch (authenticated.getCall().getAction()) {
            case OPEN_LIMIT -> positionEngine.trade(positionEngine.openLimit(trader, OpenLimitCommand.builder()
                    .assetId(intParam(p, "assetId"))
                    .longSide(Boolean.parseBoolean(required(p, "long")))
                    .leverage(intParam(p, "leverage"))
                    .lots(longParam(p, "lots"))
                    .targetPrice(longParam(p, "targetPrice"))
                    .stopLoss(optionalLong(p, "stopLoss"))
                    .takeProfit(optionalLong(p, "takeProfit"))
                    .build()));
            case OPEN_MARKET -> positionEngine.trade(positionEngine.openMarket(trader, OpenMarketCommand.builder()
                    .assetId(intParam(p, "assetId"))
                    .longSide(Boolean.parseBoolean(required(p, "long")))
                    .leverage(intParam(p, "leverage"))
                    .lots(longParam(p, "lots"))
                    .stopLoss(optionalLong(p, "stopLoss"))
                    .takeProfit(optionalLong(p, "takeProfit"))
                    .proof(proofParam(p))
                    .build()));
            case CANCEL -> positionEngine.cancel(trader, longParam(p, "tradeId"));
            case CLOSE_MARKET -> positionEngine.closeMarket(trader, longParam(p, "tradeId"), proofParam(p));
            case UPDATE_STOPS -> positionEngine.updateStops(
                    trader, longParam(p, "tradeId"), optionalLong(p, "stopLoss"), optionalLong(p, "takeProfit"));
        };
    }

    private static String required(Map<String, String> params, String name) {
        String value = params.get(name);
        if (!StringUtils.hasText(value)) {
            throw new BusinessException(ErrorCode.BAD_REQUEST, "Missing call parameter " + name);
        }
        return value;
    }

    private static long longParam(Map<String, String> params, String name) {
        try {
            return Long.parseLong(required(params, name));
        } catch (NumberFormatException e) {
            throw new BusinessException(ErrorCode.BAD_REQUEST, "Call parameter " + name + " is not an integer");
        }
    }

    private static int intParam(Map<String, String> params, String name) {
        long value = longParam(params, name);
        if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
            throw new BusinessException(ErrorCode.BAD_REQUEST, "Call parameter " + name + " is out of range");
        }
        return (int) value;
    }

    private static long optionalLong(Map<String, String> params, String name) {
        return StringUtils.hasText(params.get(name)) ? longParam(params, name) : 0L;
    }

    private static byte[] proofParam(Map<String, String> params) {
        return ProofEncoding.decode(required(params, "proof"));
    }
}
