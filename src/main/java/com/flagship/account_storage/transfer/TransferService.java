package com.flagship.account_storage.transfer;

import com.flagship.account_storage.account.Account;
import com.flagship.account_storage.account.AccountRegistry;
import com.flagship.account_storage.exception.CurrencyMismatchException;
import com.flagship.account_storage.exception.SelfTransferException;
import com.flagship.account_storage.ledger.LedgerStub;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Objects;

/**
 * Moves balance between two accounts of the same currency.
 *
 * The sender and the recipient are written back with two independent writes in the caller's
 * ledger transaction; the host commits both or neither. Neither the amount nor the resulting
 * sender balance is required to be non-negative. Transfers are not idempotent: replaying one
 * applies the delta again.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TransferService {

    private final AccountRegistry accountRegistry;

    /**
     * Makes a payment of {@code amount} units from {@code senderId} to {@code recipientId}.
     *
     * @throws SelfTransferException if sender and recipient are the same account
     * @throws CurrencyMismatchException if the accounts hold different currencies
     * @throws IllegalArgumentException if a resulting balance would overflow
     */
    public TransferResult transfer(LedgerStub stub, String senderId, String recipientId, long amount) {
        if (senderId != null && senderId.equals(recipientId)) {
            throw new SelfTransferException(senderId);
        }

        Account sender = accountRegistry.read(stub, senderId);
        Account recipient = accountRegistry.read(stub, recipientId);

        if (!Objects.equals(sender.getCurrency(), recipient.getCurrency())) {
            throw new CurrencyMismatchException(sender.getCurrency(), recipient.getCurrency());
        }

        Account debited;
        Account credited;
        try {
            debited = sender.withBalance(Math.subtractExact(sender.getBalance(), amount));
            credited = recipient.withBalance(Math.addExact(recipient.getBalance(), amount));
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException(String.format(
                    "Transfer of %d from %s to %s overflows an account balance", amount, senderId, recipientId), e);
        }

        log.info("Transfer applied: sender={}, recipient={}, amount={}, senderBalance={}, recipientBalance={}",
                senderId, recipientId, amount, debited.getBalance(), credited.getBalance());

        accountRegistry.update(stub, debited);
        accountRegistry.update(stub, credited);
        return new TransferResult(debited, credited, amount);
    }
}
