package com.flagship.account_storage.participant;

import com.flagship.account_storage.codec.LedgerRecordCodec;
import com.flagship.account_storage.exception.RecordAlreadyExistsException;
import com.flagship.account_storage.exception.RecordNotFoundException;
import com.flagship.account_storage.index.CompositeKeyIndex;
import com.flagship.account_storage.ledger.LedgerStub;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Creates and reads participants.
 *
 * Each participant lives at key {@code email}. A {@code doc~type} index entry
 * {@code (participant, email)} is written with it so that all participants can be listed.
 * Records are create-once: there is no update or delete.
 */
@Service
@Slf4j
public class ParticipantRegistry {

    public static final String DOC_TYPE_INDEX = "doc~type";

    private static final String RECORD_TYPE = "participant";

    private final LedgerRecordCodec codec;
    private final PasswordDigester passwordDigester;
    private final CompositeKeyIndex docTypeIndex = new CompositeKeyIndex(DOC_TYPE_INDEX, 1);

    public ParticipantRegistry(LedgerRecordCodec codec, PasswordDigester passwordDigester) {
        this.codec = codec;
        this.passwordDigester = passwordDigester;
    }

    public boolean exists(LedgerStub stub, String email) {
        requireEmail(email);
        return stub.getState(email) != null;
    }

    /**
     * Registers a new participant.
     *
     * @throws RecordAlreadyExistsException if a participant with this email exists
     */
    public Participant create(LedgerStub stub, String email, String name, String surname,
                              String phone, String secret) {
        if (exists(stub, email)) {
            throw new RecordAlreadyExistsException(RECORD_TYPE, email);
        }

        Participant participant = Participant.builder()
                .docType(Participant.DOC_TYPE)
                .email(email)
                .name(name)
                .surname(surname)
                .phone(phone)
                .passwordDigest(passwordDigester.digest(secret))
                .build();

        stub.putState(email, codec.encode(participant));
        docTypeIndex.insert(stub, participant.getDocType(), participant.getEmail());

        log.info("Created participant: email={}", email);
        return participant;
    }

    /**
     * @throws RecordNotFoundException if no participant is stored at {@code email}
     */
    public Participant read(LedgerStub stub, String email) {
        requireEmail(email);
        byte[] bytes = stub.getState(email);
        if (bytes == null) {
            throw new RecordNotFoundException(RECORD_TYPE, email);
        }
        return codec.decode(bytes, Participant.class, email);
    }

    /**
     * Lists every participant, ordered by email.
     */
    public List<Participant> listAll(LedgerStub stub) {
        List<Participant> participants = docTypeIndex.scan(stub, email -> read(stub, email), Participant.DOC_TYPE);
        log.debug("Listed participants: count={}", participants.size());
        return participants;
    }

    private static void requireEmail(String email) {
        if (email == null || email.isBlank()) {
            throw new IllegalArgumentException("Participant email is required");
        }
    }
}
