package com.bastion.security.token;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Immutable, newest-first list of signing keys.
 * <p>
 * The first key signs. Older keys are kept only for verification and at most
 * {@code retainedKeys} keys survive a rotation, so with a bound of 1 a rotation
 * invalidates every token signed before it.
 */
final class SigningKeyRing {

    private final List<SigningKey> keys;

    private SigningKeyRing(List<SigningKey> keys) {
        this.keys = List.copyOf(keys);
    }

    static SigningKeyRing of(SigningKey initial) {
        return new SigningKeyRing(List.of(initial));
    }

    SigningKey active() {
        return keys.get(0);
    }

    /** Finds a retained key by ID, the active key included. */
    Optional<SigningKey> find(String keyId) {
        if (keyId == null) {
            return Optional.empty();
        }
        return keys.stream().filter(key -> key.keyId().equals(keyId)).findFirst();
    }

    /**
     * Returns a new ring with {@code newest} in front, dropping any older key with the
     * same ID, trimmed to {@code retainedKeys} entries.
     */
    SigningKeyRing rotate(SigningKey newest, int retainedKeys) {
        if (retainedKeys < 1) {
            throw new IllegalArgumentException("retainedKeys must be at least 1");
        }
        List<SigningKey> next = new ArrayList<>(keys.size() + 1);
        next.add(newest);
        for (SigningKey key : keys) {
            if (next.size() == retainedKeys) {
                break;
            }
            if (!key.keyId().equals(newest.keyId())) {
                next.add(key);
            }
        }
        return new SigningKeyRing(next);
    }

    List<String> keyIds() {
        return keys.stream().map(SigningKey::keyId).toList();
    }

    int size() {
        return keys.size();
    }
}
