package com.flagship.account_storage.contract;

import com.flagship.account_storage.AccountStorageFixture;
import com.flagship.account_storage.account.Account;
import com.flagship.account_storage.contract.dto.HistoryQueryResult;
import com.flagship.account_storage.ledger.memory.InMemoryLedger;
import com.flagship.account_storage.participant.Participant;
import com.flagship.account_storage.transfer.TransferResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for dispatching contract functions by name with positional arguments.
 */
class AccountStorageContractTest {

    private InMemoryLedger ledger;
    private AccountStorageContract contract;

    @BeforeEach
    void setUp() {
        AccountStorageFixture fixture = new AccountStorageFixture();
        ledger = fixture.ledger;
        contract = fixture.contract;
    }

    @Test
    @DisplayName("Every operation is exposed under its function name")
    void testFunctionNames() {
        assertEquals(List.of("CreateParticipant", "ParticipantExists", "ReadParticipant", "GetAllParticipants",
                        "CreateAccount", "AccountExists", "ReadAccount", "GetParticipantAccounts",
                        "Transaction", "GetAccountHistory"),
                List.copyOf(contract.functionNames()));
        assertEquals(List.of("id", "currency", "balance", "email"), contract.parametersOf("CreateAccount"));
    }

    @Test
    @DisplayName("Functions run the registries, transfer engine and history against the given stub")
    void testDispatch() {
        invoke("CreateParticipant", "e@x.com", "Eve", "Smith", "+100", "secret");
        invoke("CreateAccount", "A1", "USD", "100", "e@x.com");
        invoke("CreateAccount", "A2", "USD", "50", "e@x.com");
        TransferResult transfer = (TransferResult) invoke("Transaction", "A1", "A2", "30");
        assertEquals(70L, transfer.getSender().getBalance());
        assertEquals(80L, transfer.getRecipient().getBalance());

        assertEquals(Boolean.TRUE, invoke("ParticipantExists", "e@x.com"));
        assertEquals(Boolean.FALSE, invoke("AccountExists", "A3"));
        assertEquals("Eve", ((Participant) invoke("ReadParticipant", "e@x.com")).getName());
        assertEquals(70L, ((Account) invoke("ReadAccount", "A1")).getBalance());
        assertEquals(1, ((List<?>) invoke("GetAllParticipants")).size());
        assertEquals(2, ((List<?>) invoke("GetParticipantAccounts", "e@x.com")).size());

        List<?> history = (List<?>) invoke("GetAccountHistory", "A2");
        assertEquals(2, history.size());
        HistoryQueryResult latest = (HistoryQueryResult) history.get(1);
        assertEquals(80L, latest.getRecord().getBalance());
        assertFalse(latest.isDelete());
    }

    @Test
    @DisplayName("Unknown function is an invalid argument")
    void testUnknownFunction() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> invoke("DeleteAccount", "A1"));
        assertTrue(e.getMessage().contains("DeleteAccount"));
    }

    @Test
    @DisplayName("Wrong number of arguments is an invalid argument")
    void testWrongArity() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> invoke("CreateAccount", "A1", "USD"));
        assertTrue(e.getMessage().contains("expects 4"));
    }

    @Test
    @DisplayName("Non-integer balance and amount are invalid arguments")
    void testNonIntegerArguments() {
        assertThrows(IllegalArgumentException.class, () -> invoke("CreateAccount", "A1", "USD", "ten", "e@x.com"));
        assertThrows(IllegalArgumentException.class, () -> invoke("Transaction", "A1", "A2", "1.5"));
        assertEquals(Boolean.FALSE, invoke("AccountExists", "A1"));
    }

    private Object invoke(String function, String... args) {
        return ledger.execute(stub -> contract.invoke(stub, function, List.of(args)));
    }
}
