package com.continuum.relayer.oms;

import com.continuum.relayer.ledger.Base58;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.PublicKey;
import java.security.Signature;
import java.security.spec.EdECPoint;
import java.security.spec.EdECPublicKeySpec;
import java.security.spec.NamedParameterSpec;
import java.util.Base64;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Checks that a cancellation request was signed by the order's owner.
 *
 * <p>The client signs the UTF-8 message {@code "Cancel order <orderId>"} with the wallet key
 * and sends the 64-byte ed25519 signature base64-encoded. The public key is the order's
 * base58 user address.
 */
@Component
public class CancellationVerifier {

    private static final Logger log = LoggerFactory.getLogger(CancellationVerifier.class);

    private static final int PUBLIC_KEY_LENGTH = 32;
    private static final int SIGNATURE_LENGTH = 64;

    public static String messageFor(String orderId) {
        return "Cancel order " + orderId;
    }

    public boolean verify(String orderId, String userAddress, String base64Signature) {
        byte[] signature;
        byte[] publicKey;
        try {
            signature = Base64.getDecoder().decode(base64Signature.trim());
            publicKey = Base58.decode(userAddress);
        } catch (IllegalArgumentException e) {
            log.debug("Malformed cancellation proof: orderId={}, error={}", orderId, e.getMessage());
            return false;
        }
        if (signature.length != SIGNATURE_LENGTH || publicKey.length != PUBLIC_KEY_LENGTH) {
            return false;
        }

        try {
            Signature verifier = Signature.getInstance("Ed25519");
            verifier.initVerify(toPublicKey(publicKey));
            verifier.update(messageFor(orderId).getBytes(StandardCharsets.UTF_8));
            return verifier.verify(signature);
        } catch (GeneralSecurityException e) {
            log.debug("Cancellation proof rejected: orderId={}, error={}", orderId, e.getMessage());
            return false;
        }
    }

    /** Raw ed25519 key: little-endian y with the parity of x in the top bit of the last byte. */
    static PublicKey toPublicKey(byte[] raw) throws GeneralSecurityException {
        byte[] bigEndian = new byte[PUBLIC_KEY_LENGTH];
        for (int i = 0; i < PUBLIC_KEY_LENGTH; i++) {
            bigEndian[i] = raw[PUBLIC_KEY_LENGTH - 1 - i];
        }
        boolean xOdd = (bigEndian[0] & 0x80) != 0;
        bigEndian[0] &= 0x7f;
        EdECPoint point = new EdECPoint(xOdd, new BigInteger(1, bigEndian));
        return KeyFactory.getInstance("Ed25519").generatePublic(new EdECPublicKeySpec(NamedParameterSpec.ED25519, point));
    }
}
