package com.hooky.infrastructure.id;

import com.fasterxml.uuid.Generators;
import com.fasterxml.uuid.impl.TimeBasedEpochGenerator;
import com.hooky.application.port.out.IdGenerator;
import com.hooky.domain.model.ReceiverId;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.util.UUID;

@Component
public class TokenIdGenerator implements IdGenerator {

    public static final int RECEIVER_ID_LENGTH = 10;

    private static final char[] ALPHABET = "abcdefghijklmnopqrstuvwxyz0123456789".toCharArray();

    private final TimeBasedEpochGenerator eventIdGenerator;
    private final SecureRandom random;

    public TokenIdGenerator() {
        this.eventIdGenerator = Generators.timeBasedEpochGenerator();
        this.random = new SecureRandom();
    }

    @Override
    public ReceiverId newReceiverId() {
        char[] token = new char[RECEIVER_ID_LENGTH];
        for (int i = 0; i < token.length; i++) {
            token[i] = ALPHABET[random.nextInt(ALPHABET.length)];
        }
        return ReceiverId.fromTrusted(new String(token));
    }

    @Override
    public UUID newEventId() {
        return eventIdGenerator.generate();
    }
}
