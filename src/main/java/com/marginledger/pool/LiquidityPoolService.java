package com.marginledger.pool;

import com.marginledger.auth.RoleRegistry;
import com.marginledger.core.FixedPoint;
import com.marginledger.core.LedgerSequencer;
import com.marginledger.custody.CustodyLedger;
import com.marginledger.domain.enums.LedgerRole;
import com.marginledger.domain.model.PoolState;
import com.marginledger.entity.CounterpartyPoolEntity;
import com.marginledger.entity.LpShareEntity;
import com.marginledger.event.EventPublisherHelper;
import com.marginledger.event.LedgerEventType;
import com.marginledger.exception.BusinessException;
import com.marginledger.exception.ErrorCode;
import com.marginledger.exception.InsufficientFundsException;
import com.marginledger.exception.UnauthorizedException;
import com.marginledger.repository.jpa.CounterpartyPoolJpaRepository;
import com.marginledger.repository.jpa.LpShareJpaRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Share accounting on top of the counterparty pool.
 *
 * <p>Liquidity providers move custody balance into the pool and receive shares priced at
 * {@code nav / totalShares}. Minting and burning round down, in the pool's favour, so they
 * never move the share price up for the provider; only trade settlement changes NAV.
 */
@Service
public class LiquidityPoolService {

    private static final Logger log = LoggerFactory.getLogger(LiquidityPoolService.class);

    private final CounterpartyPoolJpaRepository counterpartyPoolJpaRepository;
    private final LpShareJpaRepository lpShareJpaRepository;
    private final CustodyLedger custodyLedger;
    private final RoleRegistry roleRegistry;
    private final LedgerSequencer ledgerSequencer;
    private final EventPublisherHelper eventPublisherHelper;

    public LiquidityPoolService(
            CounterpartyPoolJpaRepository counterpartyPoolJpaRepository,
            LpShareJpaRepository lpShareJpaRepository,
            CustodyLedger custodyLedger,
            RoleRegistry roleRegistry,
            LedgerSequencer ledgerSequencer,
            EventPublisherHelper eventPublisherHelper) {
        this.counterpartyPoolJpaRepository = counterpartyPoolJpaRepository;
        this.lpShareJpaRepository = lpShareJpaRepository;
        this.custodyLedger = custodyLedger;
        this.roleRegistry = roleRegistry;
        this.ledgerSequencer = ledgerSequencer;
        this.eventPublisherHelper = eventPublisherHelper;
    }

    /**
     * Moves {@code amount} of the investor's available balance into the pool.
     *
     * @return shares minted
     */
    public long provide(String caller, String investorId, long amount) {
        return ledgerSequencer.execute(() -> {
            requireSelf(caller, investorId);
            if (amount <= 0) {
                throw new BusinessException(ErrorCode.INVALID_AMOUNT, "Amount must be positive: " + amount);
            }

            CounterpartyPoolEntity pool = counterpartyPoolJpaRepository.loadMain();
            if (pool.getTotalShares() > 0 && pool.getNav() == 0) {
                throw new BusinessException(ErrorCode.POOL_INSOLVENT, "Pool has outstanding shares but no NAV");
            }
            long shares = pool.getTotalShares() == 0
                    ? amount
                    : FixedPoint.mulDiv(amount, pool.getTotalShares(), pool.getNav());
            if (shares == 0) {
                throw new BusinessException(ErrorCode.SHARES_ZERO, "Amount " + amount + " mints no shares");
            }

            custodyLedger.debitToPool(investorId, amount);
            pool.setNav(FixedPoint.addExact(pool.getNav(), amount, "pool nav"));
            pool.setTotalShares(FixedPoint.addExact(pool.getTotalShares(), shares, "total shares"));
            counterpartyPoolJpaRepository.save(pool);

            LpShareEntity holding = loadHolding(investorId);
            holding.setShares(holding.getShares() + shares);
            lpShareJpaRepository.save(holding);

            log.info("{} provided {} to pool for {} shares, nav={}", investorId, amount, shares, pool.getNav());
            eventPublisherHelper.publishLedgerEvent(this, investorId, LedgerEventType.POOL_PROVIDED, amount);
            return shares;
        });
    }

    /**
     * Burns {@code shares} and credits their NAV value to the investor's balance.
     *
     * @return amount paid out
     */
    public long redeem(String caller, String investorId, long shares) {
        return ledgerSequencer.execute(() -> {
            requireSelf(caller, investorId);
            if (shares <= 0) {
                throw new BusinessException(ErrorCode.INVALID_AMOUNT, "Shares must be positive: " + shares);
            }

            LpShareEntity holding = loadHolding(investorId);
            if (holding.getShares() < shares) {
                throw new InsufficientFundsException(
                        ErrorCode.INSUFFICIENT_SHARES, investorId, shares, holding.getShares());
            }

            CounterpartyPoolEntity pool = counterpartyPoolJpaRepository.loadMain();
            long payout = FixedPoint.mulDiv(shares, pool.getNav(), pool.getTotalShares());

            pool.setNav(pool.getNav() - payout);
            pool.setTotalShares(pool.getTotalShares() - shares);
            counterpartyPoolJpaRepository.save(pool);

            holding.setShares(holding.getShares() - shares);
            lpShareJpaRepository.save(holding);
            custodyLedger.creditFromPool(investorId, payout);

            log.info("{} redeemed {} shares for {}, nav={}", investorId, shares, payout, pool.getNav());
            eventPublisherHelper.publishLedgerEvent(this, investorId, LedgerEventType.POOL_REDEEMED, payout);
            return payout;
        });
    }

    /** Pays all accrued owner fees to the caller's custody balance. OWNER only. */
    public long withdrawOwnerFees(String caller) {
        return ledgerSequencer.execute(() -> {
            roleRegistry.require(caller, LedgerRole.OWNER);

            CounterpartyPoolEntity pool = counterpartyPoolJpaRepository.loadMain();
            long fees = pool.getOwnerFees();
            if (fees == 0) {
                return 0L;
            }
            pool.setOwnerFees(0);
            counterpartyPoolJpaRepository.save(pool);
            custodyLedger.creditFromPool(caller, fees);

            log.info("Owner {} withdrew {} in fees", caller, fees);
            eventPublisherHelper.publishLedgerEvent(this, caller, LedgerEventType.OWNER_FEES_WITHDRAWN, fees);
            return fees;
        });
    }

    // ---- Reads ----

    /** Six-decimal NAV per share; 1_000000 while no shares exist. */
    public long sharePrice() {
        return poolState().getSharePrice();
    }

    public PoolState poolState() {
        return ledgerSequencer.execute(() -> {
            CounterpartyPoolEntity pool = counterpartyPoolJpaRepository.loadMain();
            long price = pool.getTotalShares() == 0
                    ? FixedPoint.SCALE
                    : FixedPoint.mulDiv(pool.getNav(), FixedPoint.SCALE, pool.getTotalShares());
            return PoolState.builder()
                    .nav(pool.getNav())
                    .totalShares(pool.getTotalShares())
                    .ownerFees(pool.getOwnerFees())
                    .sharePrice(price)
                    .build();
        });
    }

    /** Committed NAV without taking the ledger lock or creating the pool row; 0 before first use. */
    public long currentNav() {
        return counterpartyPoolJpaRepository
                .findById(CounterpartyPoolEntity.MAIN_POOL_ID)
                .map(CounterpartyPoolEntity::getNav)
                .orElse(0L);
    }

    public long sharesOf(String investorId) {
        return ledgerSequencer.execute(() -> lpShareJpaRepository
                .findById(investorId)
                .map(LpShareEntity::getShares)
                .orElse(0L));
    }

    private LpShareEntity loadHolding(String investorId) {
        return lpShareJpaRepository
                .findById(investorId)
                .orElseGet(() -> LpShareEntity.builder().investorId(investorId).build());
    }

    private void requireSelf(String caller, String investorId) {
        if (caller == null || !caller.equals(investorId)) {
            throw new UnauthorizedException(String.format("Caller %s cannot act for investor %s", caller, investorId));
        }
    }
}
