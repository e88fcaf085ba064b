package com.marginledger.custody;

import com.marginledger.auth.RoleRegistry;
import com.marginledger.config.EngineProperties;
import com.marginledger.core.FixedPoint;
import com.marginledger.core.LedgerSequencer;
import com.marginledger.domain.enums.LedgerRole;
import com.marginledger.domain.model.AccountBalance;
import com.marginledger.entity.CounterpartyPoolEntity;
import com.marginledger.entity.LedgerAccountEntity;
import com.marginledger.event.EventPublisherHelper;
import com.marginledger.event.LedgerEventType;
import com.marginledger.exception.ArithmeticRangeException;
import com.marginledger.exception.BusinessException;
import com.marginledger.exception.ErrorCode;
import com.marginledger.exception.InsufficientFundsException;
import com.marginledger.exception.UnauthorizedException;
import com.marginledger.repository.jpa.CounterpartyPoolJpaRepository;
import com.marginledger.repository.jpa.LedgerAccountJpaRepository;
import java.time.Clock;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Custody bookkeeping: per-account {@code balance} and {@code locked} amounts and the
 * movement of realized P&L between accounts and the counterparty pool.
 *
 * <p>Every operation runs through the {@link LedgerSequencer}, so it is atomic and never
 * interleaves with another one. {@code locked <= balance} holds for every account after
 * every operation.
 *
 * <p>Access rules:
 * <ul>
 *   <li>{@link #deposit} and {@link #withdraw} may only be called by the account itself.</li>
 *   <li>{@link #lock}, {@link #unlock} and {@link #settle} require
 *       {@link LedgerRole#LEDGER_CONTROLLER}, which the position engine holds.</li>
 * </ul>
 *
 * <p>Settled losses are split: {@code ownerFeePercent} of the loss accrues to the pool's
 * owner fees, the remainder increases pool NAV. Profits are paid out of NAV only.
 */
@Service
public class CustodyLedger {

    private static final Logger log = LoggerFactory.getLogger(CustodyLedger.class);

    private final LedgerAccountJpaRepository ledgerAccountJpaRepository;
    private final CounterpartyPoolJpaRepository counterpartyPoolJpaRepository;
    private final RoleRegistry roleRegistry;
    private final LedgerSequencer ledgerSequencer;
    private final EventPublisherHelper eventPublisherHelper;
    private final EngineProperties engineProperties;
    private final Clock clock;

    public CustodyLedger(
            LedgerAccountJpaRepository ledgerAccountJpaRepository,
            CounterpartyPoolJpaRepository counterpartyPoolJpaRepository,
            RoleRegistry roleRegistry,
            LedgerSequencer ledgerSequencer,
            EventPublisherHelper eventPublisherHelper,
            EngineProperties engineProperties,
            Clock clock) {
        this.ledgerAccountJpaRepository = ledgerAccountJpaRepository;
        this.counterpartyPoolJpaRepository = counterpartyPoolJpaRepository;
        this.roleRegistry = roleRegistry;
        this.ledgerSequencer = ledgerSequencer;
        this.eventPublisherHelper = eventPublisherHelper;
        this.engineProperties = engineProperties;
        this.clock = clock;
    }

    // ---- Account holder operations ----

    public AccountBalance deposit(String caller, String accountId, long amount) {
        return ledgerSequencer.execute(() -> {
            requireSelf(caller, accountId);
            requirePositive(amount);

            LedgerAccountEntity account = loadOrCreate(accountId);
            account.setBalance(FixedPoint.addExact(account.getBalance(), amount, "balance"));
            save(account);

            log.info("Deposited {} to {}, balance={}", amount, accountId, account.getBalance());
            eventPublisherHelper.publishLedgerEvent(this, accountId, LedgerEventType.DEPOSITED, amount);
            return toBalance(account);
        });
    }

    public AccountBalance withdraw(String caller, String accountId, long amount) {
        return ledgerSequencer.execute(() -> {
            requireSelf(caller, accountId);
            requirePositive(amount);

            LedgerAccountEntity account = loadOrCreate(accountId);
            if (amount > account.available()) {
                throw new InsufficientFundsException(
                        ErrorCode.INSUFFICIENT_AVAILABLE, accountId, amount, account.available());
            }
            account.setBalance(account.getBalance() - amount);
            save(account);

            log.info("Withdrew {} from {}, balance={}", amount, accountId, account.getBalance());
            eventPublisherHelper.publishLedgerEvent(this, accountId, LedgerEventType.WITHDRAWN, amount);
            return toBalance(account);
        });
    }

    // ---- Privileged operations ----

    /**
     * Reserves {@code amount} of the account's available collateral.
     *
     * @throws InsufficientFundsException INSUFFICIENT_AVAILABLE if {@code amount > balance - locked}
     */
    public void lock(String caller, String accountId, long amount) {
        ledgerSequencer.run(() -> {
            roleRegistry.require(caller, LedgerRole.LEDGER_CONTROLLER);
            requireNonNegative(amount);

            LedgerAccountEntity account = loadOrCreate(accountId);
            if (amount > account.available()) {
                throw new InsufficientFundsException(
                        ErrorCode.INSUFFICIENT_AVAILABLE, accountId, amount, account.available());
            }
            account.setLocked(account.getLocked() + amount);
            save(account);
            log.debug("Locked {} for {}, locked={}", amount, accountId, account.getLocked());
        });
    }

    /**
     * Releases a previous reservation.
     *
     * @throws InsufficientFundsException OVER_UNLOCK if {@code amount > locked}
     */
    public void unlock(String caller, String accountId, long amount) {
        ledgerSequencer.run(() -> {
            roleRegistry.require(caller, LedgerRole.LEDGER_CONTROLLER);
            requireNonNegative(amount);

            LedgerAccountEntity account = loadOrCreate(accountId);
            if (amount > account.getLocked()) {
                throw new InsufficientFundsException(ErrorCode.OVER_UNLOCK, accountId, amount, account.getLocked());
            }
            account.setLocked(account.getLocked() - amount);
            save(account);
            log.debug("Unlocked {} for {}, locked={}", amount, accountId, account.getLocked());
        });
    }

    /**
     * Moves realized P&L between the account and the counterparty pool.
     *
     * <p>A profit is paid from pool NAV (LIQUIDITY_LOW if NAV is short). A loss is debited
     * from the account's total balance, locked funds included (FUNDS_LOW if the balance is
     * short, or if the debit would leave less than what other reservations still hold).
     * Zero is a no-op.
     */
    public void settle(String caller, String accountId, long pnl) {
        ledgerSequencer.run(() -> {
            roleRegistry.require(caller, LedgerRole.LEDGER_CONTROLLER);
            if (pnl == 0) {
                return;
            }

            CounterpartyPoolEntity pool = counterpartyPoolJpaRepository.loadMain();
            LedgerAccountEntity account = loadOrCreate(accountId);

            if (pnl > 0) {
                if (pool.getNav() < pnl) {
                    throw new InsufficientFundsException(ErrorCode.LIQUIDITY_LOW, "pool", pnl, pool.getNav());
                }
                pool.setNav(pool.getNav() - pnl);
                account.setBalance(FixedPoint.addExact(account.getBalance(), pnl, "balance"));
            } else {
                long loss = negate(pnl);
                if (loss > account.getBalance() || account.getBalance() - loss < account.getLocked()) {
                    throw new InsufficientFundsException(ErrorCode.FUNDS_LOW, accountId, loss, account.getBalance());
                }
                long fee = ownerFeeOf(loss);
                account.setBalance(account.getBalance() - loss);
                pool.setOwnerFees(FixedPoint.addExact(pool.getOwnerFees(), fee, "owner fees"));
                pool.setNav(FixedPoint.addExact(pool.getNav(), loss - fee, "pool nav"));
            }

            save(account);
            counterpartyPoolJpaRepository.save(pool);
            log.info("Settled {} for {}, balance={}, poolNav={}", pnl, accountId, account.getBalance(), pool.getNav());
            eventPublisherHelper.publishLedgerEvent(this, accountId, LedgerEventType.SETTLED, pnl);
        });
    }

    // ---- Pool transfers ----

    /**
     * Debits available collateral that leaves custody for the pool. Only callable from
     * inside a sequenced operation; the caller has already been authorized.
     */
    public void debitToPool(String accountId, long amount) {
        requireInOperation();
        LedgerAccountEntity account = loadOrCreate(accountId);
        if (amount > account.available()) {
            throw new InsufficientFundsException(ErrorCode.INSUFFICIENT_AVAILABLE, accountId, amount, account.available());
        }
        account.setBalance(account.getBalance() - amount);
        save(account);
    }

    /** Credits funds paid out of the pool. Only callable from inside a sequenced operation. */
    public void creditFromPool(String accountId, long amount) {
        requireInOperation();
        LedgerAccountEntity account = loadOrCreate(accountId);
        account.setBalance(FixedPoint.addExact(account.getBalance(), amount, "balance"));
        save(account);
    }

    // ---- Reads ----

    public long available(String accountId) {
        return balanceOf(accountId).getAvailable();
    }

    public AccountBalance balanceOf(String accountId) {
        return ledgerSequencer.execute(() -> ledgerAccountJpaRepository
                .findById(accountId)
                .map(this::toBalance)
                .orElseGet(() -> AccountBalance.builder().accountId(accountId).build()));
    }

    // ---- Helpers ----

    private LedgerAccountEntity loadOrCreate(String accountId) {
        return ledgerAccountJpaRepository
                .findById(accountId)
                .orElseGet(() -> LedgerAccountEntity.builder().accountId(accountId).build());
    }

    private void save(LedgerAccountEntity account) {
        account.setUpdatedAt(Instant.now(clock));
        ledgerAccountJpaRepository.save(account);
    }

    private void requireSelf(String caller, String accountId) {
        if (caller == null || !caller.equals(accountId)) {
            throw new UnauthorizedException(String.format("Caller %s cannot move funds of %s", caller, accountId));
        }
    }

    private void requireInOperation() {
        if (!ledgerSequencer.inOperation()) {
            throw new IllegalStateException("Pool transfers must run inside a sequenced operation");
        }
    }

    private static void requirePositive(long amount) {
        if (amount <= 0) {
            throw new BusinessException(ErrorCode.INVALID_AMOUNT, "Amount must be positive: " + amount);
        }
    }

    private static void requireNonNegative(long amount) {
        if (amount < 0) {
            throw new BusinessException(ErrorCode.INVALID_AMOUNT, "Amount must not be negative: " + amount);
        }
    }

    /** {@code floor(loss * ownerFeePercent / 100)} without overflowing for large losses. */
    private long ownerFeeOf(long loss) {
        int percent = engineProperties.getOwnerFeePercent();
        return loss / 100 * percent + loss % 100 * percent / 100;
    }

    private static long negate(long value) {
        try {
            return Math.negateExact(value);
        } catch (ArithmeticException e) {
            throw new ArithmeticRangeException("Cannot negate " + value, e);
        }
    }

    private AccountBalance toBalance(LedgerAccountEntity account) {
        return AccountBalance.builder()
                .accountId(account.getAccountId())
                .balance(account.getBalance())
                .locked(account.getLocked())
                .build();
    }
}
