package com.flagship.account_storage.contract;

import com.flagship.account_storage.exception.AccountStorageException;
import com.flagship.account_storage.ledger.memory.InMemoryLedger;
import com.flagship.account_storage.ledger.memory.InMemoryTransaction;
import com.flagship.account_storage.observability.AccountStorageMetrics;
import com.flagship.account_storage.observability.CorrelationContext;
import com.flagship.account_storage.transfer.TransferResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;

/**
 * Runs contract functions the way the host platform does: one fresh ledger transaction
 * per invocation.
 *
 * - submit: commits the transaction when the function succeeds
 * - evaluate: always rolls the transaction back, for queries
 *
 * A failing function leaves nothing behind: its buffered writes are discarded.
 * Transfers are counted only once their transaction has committed.
 * Nothing here retries; a {@link com.flagship.account_storage.exception.TransactionConflictException}
 * is handed to the caller, who may resubmit.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ContractInvoker {

    private static final String SUBMIT = "submit";
    private static final String EVALUATE = "evaluate";

    private final InMemoryLedger ledger;
    private final AccountStorageContract contract;
    private final AccountStorageMetrics metrics;

    public InvocationResult submit(String function, List<String> args) {
        return invoke(function, args, true);
    }

    public InvocationResult evaluate(String function, List<String> args) {
        return invoke(function, args, false);
    }

    private InvocationResult invoke(String function, List<String> args, boolean commit) {
        long startTime = System.currentTimeMillis();
        String mode = commit ? SUBMIT : EVALUATE;

        try (InMemoryTransaction transaction = ledger.begin()) {
            MDC.put(CorrelationContext.TX_ID_MDC_KEY, transaction.getTxId());
            MDC.put(CorrelationContext.FUNCTION_MDC_KEY, function);
            log.debug("Invoking contract function: mode={}, args={}", mode, args == null ? 0 : args.size());

            Object payload = contract.invoke(transaction, function, args);
            if (commit) {
                transaction.commit();
                if (payload instanceof TransferResult) {
                    recordTransfer((TransferResult) payload);
                }
            }

            long duration = System.currentTimeMillis() - startTime;
            metrics.recordInvocation(function, mode, "success", Duration.ofMillis(duration));
            log.info("Contract function completed: mode={}, committed={}, duration={}ms", mode, commit, duration);
            return new InvocationResult(transaction.getTxId(), function, commit, payload);

        } catch (AccountStorageException e) {
            long duration = System.currentTimeMillis() - startTime;
            metrics.recordInvocation(function, mode, e.getKind().name(), Duration.ofMillis(duration));
            log.warn("Contract function rejected: mode={}, kind={}, error={}, duration={}ms",
                    mode, e.getKind(), e.getMessage(), duration);
            throw e;
        } catch (RuntimeException e) {
            long duration = System.currentTimeMillis() - startTime;
            String outcome = e instanceof IllegalArgumentException ? "invalid_argument" : "error";
            metrics.recordInvocation(function, mode, outcome, Duration.ofMillis(duration));
            log.warn("Contract function failed: mode={}, error={}, duration={}ms", mode, e.getMessage(), duration);
            throw e;
        } finally {
            MDC.remove(CorrelationContext.TX_ID_MDC_KEY);
            MDC.remove(CorrelationContext.FUNCTION_MDC_KEY);
        }
    }

    private void recordTransfer(TransferResult transfer) {
        metrics.recordTransfer(transfer.getSender().getCurrency(), transfer.getAmount());
    }
}
