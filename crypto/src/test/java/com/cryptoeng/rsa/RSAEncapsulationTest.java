/*
 * Copyright (c) 2026 textbook-rsa contributors, All Rights Reserved
 *
 */

package com.cryptoeng.rsa;

import com.cryptoeng.rsa.random.SecureRandomSource;
import com.cryptoeng.rsa.test.FixedRandomSource;
import com.cryptoeng.rsa.test.RecordingRandomSource;
import com.cryptoeng.rsa.test.TestKeys;
import com.cryptoeng.utils.Bytes;
import org.junit.Test;

import java.math.BigInteger;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.lessThan;
import static org.junit.Assert.*;

public class RSAEncapsulationTest {

    private static RSAPrivateKey toyKey() throws Exception {
        return RSAPrivateKey.fromPrimes(BigInteger.valueOf(83), BigInteger.valueOf(89));
    }

    @Test
    public void referenceKeyRoundTrip() throws Exception {
        RSAPrivateKey key = TestKeys.privateKey();
        RecordingRandomSource random = new RecordingRandomSource(new SecureRandomSource());
        RSAEncapsulation encapsulation = new RSAEncapsulation(random);
        int roundTrips = 0;
        for (int i = 0; i < 20; i++) {
            EncapsulatedKey ek = encapsulation.encryptSymmetricKey(key.getPublicKey(PublicExponent.ENCRYPTION));
            assertEquals(32, ek.getKey().length);
            assertThat(ek.getCiphertext(), is(lessThan(key.getModulus())));
            byte[] decrypted = encapsulation.decryptSymmetricKey(key.getDecryptionKey(), ek.getCiphertext());
            // r is drawn below 2^bitLength(n), which may exceed n
            if (random.getLast().compareTo(key.getModulus()) < 0) {
                assertArrayEquals(ek.getKey(), decrypted);
                roundTrips++;
            } else
                assertFalse(new Bytes(ek.getKey()).equals(new Bytes(decrypted)));
        }
        assertThat(roundTrips, is(greaterThan(0)));
    }

    @Test
    public void toyKeyVector() throws Exception {
        RSAPrivateKey key = toyKey();
        FixedRandomSource random = FixedRandomSource.of(1234);
        EncapsulatedKey ek = new RSAEncapsulation(random)
                .encryptSymmetricKey(key.getPublicKey(PublicExponent.ENCRYPTION));
        // r is drawn from [0, 2^13 - 1] for the 13-bit modulus 7387
        assertEquals(BigInteger.ZERO, random.getLastLow());
        assertEquals(BigInteger.valueOf(8191), random.getLastHigh());

        assertEquals(BigInteger.valueOf(5530), ek.getCiphertext());
        assertEquals("4324ed3488d6e708d3631da067227633cf10dbc2f2df0c1a67553282670642bb",
                     new Bytes(ek.getKey()).toHex(false).toLowerCase());
        assertArrayEquals(ek.getKey(),
                          new RSAEncapsulation(random).decryptSymmetricKey(key.getDecryptionKey(), ek.getCiphertext()));
    }

    @Test
    public void sampleAboveModulusDoesNotRoundTrip() throws Exception {
        RSAPrivateKey key = toyKey();
        RSAEncapsulation encapsulation = new RSAEncapsulation(FixedRandomSource.of(8000));
        EncapsulatedKey ek = encapsulation.encryptSymmetricKey(key.getPublicKey(PublicExponent.ENCRYPTION));
        assertEquals(BigInteger.valueOf(4753), ek.getCiphertext());
        assertEquals("befce9dfa709699a5f20d1b01095f6460dd1ac61b7a56b6fda475794d1b801a2",
                     new Bytes(ek.getKey()).toHex(false).toLowerCase());

        // the receiver recovers 8000 mod 7387 = 613
        byte[] decrypted = encapsulation.decryptSymmetricKey(key.getDecryptionKey(), ek.getCiphertext());
        assertEquals("69443a4af49b21bb608dc26305f804b82c54a56f89b914926fed497e5fcadb96",
                     new Bytes(decrypted).toHex(false).toLowerCase());
    }

    @Test
    public void zeroSample() throws Exception {
        RSAPrivateKey key = toyKey();
        RSAEncapsulation encapsulation = new RSAEncapsulation(FixedRandomSource.of(0));
        EncapsulatedKey ek = encapsulation.encryptSymmetricKey(key.getPublicKey(PublicExponent.ENCRYPTION));
        assertEquals(BigInteger.ZERO, ek.getCiphertext());
        assertEquals("6e340b9cffb37a989ca544e6bb780a2c78901d3fb33738768511a30617afa01d",
                     new Bytes(ek.getKey()).toHex(false).toLowerCase());
        assertArrayEquals(ek.getKey(), encapsulation.decryptSymmetricKey(key.getDecryptionKey(), BigInteger.ZERO));
    }

    @Test
    public void ciphertextOutOfRange() throws Exception {
        RSAPrivateKey key = TestKeys.privateKey();
        RSAEncapsulation encapsulation = new RSAEncapsulation(new SecureRandomSource());
        BigInteger n = key.getModulus();
        for (BigInteger c : new BigInteger[]{BigInteger.ONE.negate(), n, n.add(BigInteger.ONE), n.shiftLeft(1)}) {
            try {
                encapsulation.decryptSymmetricKey(key.getDecryptionKey(), c);
                fail("accepted ciphertext " + c);
            } catch (CiphertextOutOfRangeException e) {
                assertEquals("ciphertext is not in [0, n)", e.getMessage());
            }
        }
        assertEquals(32, encapsulation.decryptSymmetricKey(key.getDecryptionKey(), n.subtract(BigInteger.ONE)).length);
    }

    @Test(expected = IllegalArgumentException.class)
    public void requiresEncryptionExponent() throws Exception {
        new RSAEncapsulation(new SecureRandomSource())
                .encryptSymmetricKey(TestKeys.privateKey().getPublicKey(PublicExponent.VERIFICATION));
    }

    @Test
    public void encapsulatedKeyIsImmutable() throws Exception {
        byte[] k = new byte[32];
        EncapsulatedKey ek = new EncapsulatedKey(k, BigInteger.TEN);
        k[0] = 1;
        ek.getKey()[1] = 1;
        assertArrayEquals(new byte[32], ek.getKey());
        assertEquals(new EncapsulatedKey(new byte[32], BigInteger.TEN), ek);
    }
}
