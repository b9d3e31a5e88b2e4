package com.ai.screening.service;

import org.springframework.stereotype.Component;

import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Fixed pool of striped locks keyed by canonical phone. The same phone always maps to the same lock.
 */
@Component
public class ContactLocks {

    private static final int STRIPES = 64;

    private final Lock[] locks = new Lock[STRIPES];

    public ContactLocks() {
        for (int i = 0; i < STRIPES; i++) {
            locks[i] = new ReentrantLock();
        }
    }

    public Lock forContact(String phone) {
        return locks[Math.floorMod(phone.hashCode(), STRIPES)];
    }
}
