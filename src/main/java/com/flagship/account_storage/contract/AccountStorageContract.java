package com.flagship.account_storage.contract;

import com.flagship.account_storage.account.AccountRegistry;
import com.flagship.account_storage.contract.dto.HistoryQueryResult;
import com.flagship.account_storage.history.AccountHistoryService;
import com.flagship.account_storage.ledger.LedgerStub;
import com.flagship.account_storage.participant.ParticipantRegistry;
import com.flagship.account_storage.transfer.TransferService;
import lombok.Value;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The remotely invocable surface of account storage: every operation under its
 * function name, taking positional string arguments.
 *
 * The contract runs against whatever transaction context it is handed and never
 * commits on its own.
 */
@Component
public class AccountStorageContract {

    private final Map<String, Registration> functions = new LinkedHashMap<>();

    public AccountStorageContract(ParticipantRegistry participants,
                                  AccountRegistry accounts,
                                  TransferService transfers,
                                  AccountHistoryService history) {
        register("CreateParticipant", List.of("email", "name", "surname", "phone", "passwd"), (stub, a) -> {
            participants.create(stub, a.text("email"), a.text("name"), a.text("surname"),
                    a.text("phone"), a.text("passwd"));
            return null;
        });
        register("ParticipantExists", List.of("email"),
                (stub, a) -> participants.exists(stub, a.text("email")));
        register("ReadParticipant", List.of("email"),
                (stub, a) -> participants.read(stub, a.text("email")));
        register("GetAllParticipants", List.of(),
                (stub, a) -> participants.listAll(stub));

        register("CreateAccount", List.of("id", "currency", "balance", "email"), (stub, a) -> {
            accounts.create(stub, a.text("id"), a.text("currency"), a.integer("balance"), a.text("email"));
            return null;
        });
        register("AccountExists", List.of("id"),
                (stub, a) -> accounts.exists(stub, a.text("id")));
        register("ReadAccount", List.of("id"),
                (stub, a) -> accounts.read(stub, a.text("id")));
        register("GetParticipantAccounts", List.of("email"),
                (stub, a) -> accounts.listForParticipant(stub, a.text("email")));

        register("Transaction", List.of("a", "b", "x"),
                (stub, a) -> transfers.transfer(stub, a.text("a"), a.text("b"), a.integer("x")));
        register("GetAccountHistory", List.of("id"),
                (stub, a) -> history.history(stub, a.text("id")).stream()
                        .map(HistoryQueryResult::from)
                        .toList());
    }

    /**
     * Runs {@code function} against {@code stub}.
     *
     * @throws IllegalArgumentException for an unknown function or malformed arguments
     */
    public Object invoke(LedgerStub stub, String function, List<String> args) {
        Registration registration = functions.get(function);
        if (registration == null) {
            throw new IllegalArgumentException("Unknown function: " + function);
        }
        ContractArguments arguments = new ContractArguments(function, registration.getParameters(),
                args == null ? List.of() : args);
        return registration.getBody().apply(stub, arguments);
    }

    public Set<String> functionNames() {
        return Collections.unmodifiableSet(functions.keySet());
    }

    public List<String> parametersOf(String function) {
        Registration registration = functions.get(function);
        if (registration == null) {
            throw new IllegalArgumentException("Unknown function: " + function);
        }
        return registration.getParameters();
    }

    private void register(String name, List<String> parameters, ContractFunction body) {
        functions.put(name, new Registration(parameters, body));
    }

    @Value
    private static class Registration {
        List<String> parameters;
        ContractFunction body;
    }
}
