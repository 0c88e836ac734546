package app.mstudio.render.vault;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Base64;

@Service
public class LocalSecretVault implements SecretVault {

    private static final Logger log = LoggerFactory.getLogger(LocalSecretVault.class);
    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final int NONCE_LENGTH = 12;
    private static final int TAG_LENGTH_BITS = 128;
    private static final int DATA_KEY_LENGTH = 32;

    private final SecretKey masterKey;
    private final String keyId;
    private final SecureRandom random = new SecureRandom();

    public LocalSecretVault(VaultProps props) {
        String configured = props == null ? null : props.masterKey();
        String configuredKeyId = props == null ? null : props.keyId();
        if (configured == null || configured.isBlank()) {
            if (props != null && props.requireMasterKey()) {
                throw new IllegalStateException("app.render.vault.master-key is required");
            }
            byte[] generated = new byte[DATA_KEY_LENGTH];
            random.nextBytes(generated);
            this.masterKey = new SecretKeySpec(generated, "AES");
            this.keyId = "local-ephemeral";
            log.warn("Render vault master key is not configured; stored provider keys will not survive a restart");
            return;
        }
        byte[] decoded = Base64.getDecoder().decode(configured.trim());
        if (decoded.length != 16 && decoded.length != 24 && decoded.length != 32) {
            throw new IllegalStateException("Invalid vault master key length: " + decoded.length);
        }
        this.masterKey = new SecretKeySpec(decoded, "AES");
        this.keyId = configuredKeyId == null || configuredKeyId.isBlank() ? "local-master" : configuredKeyId;
    }

    @Override
    public EncryptedSecret encrypt(byte[] plaintext, byte[] aad) {
        if (plaintext == null || plaintext.length == 0) {
            throw new IllegalArgumentException("plaintext is required");
        }
        byte[] boundAad = aad == null ? new byte[0] : aad.clone();
        byte[] dataKey = new byte[DATA_KEY_LENGTH];
        random.nextBytes(dataKey);
        try {
            byte[] nonce = randomNonce();
            byte[] ciphertext = seal(dataKey, nonce, boundAad, plaintext);

            // data key is wrapped as nonce || ciphertext under the master key
            byte[] wrapNonce = randomNonce();
            byte[] wrapped = seal(masterKey.getEncoded(), wrapNonce, boundAad, dataKey);
            byte[] packed = new byte[NONCE_LENGTH + wrapped.length];
            System.arraycopy(wrapNonce, 0, packed, 0, NONCE_LENGTH);
            System.arraycopy(wrapped, 0, packed, NONCE_LENGTH, wrapped.length);
            return new EncryptedSecret(ciphertext, packed, keyId, nonce, boundAad);
        } finally {
            Arrays.fill(dataKey, (byte) 0);
        }
    }

    @Override
    public byte[] decrypt(EncryptedSecret secret) {
        if (secret == null || !secret.isComplete()) {
            throw new IllegalArgumentException("secret is incomplete");
        }
        byte[] aad = secret.aad() == null ? new byte[0] : secret.aad();
        byte[] packed = secret.wrappedDataKey();
        if (packed == null || packed.length <= NONCE_LENGTH) {
            throw new IllegalArgumentException("Invalid encrypted data key format");
        }
        byte[] wrapNonce = Arrays.copyOfRange(packed, 0, NONCE_LENGTH);
        byte[] wrapped = Arrays.copyOfRange(packed, NONCE_LENGTH, packed.length);
        byte[] dataKey = open(masterKey.getEncoded(), wrapNonce, aad, wrapped);
        try {
            return open(dataKey, secret.nonce(), aad, secret.ciphertext());
        } finally {
            Arrays.fill(dataKey, (byte) 0);
        }
    }

    public String keyId() {
        return keyId;
    }

    private byte[] randomNonce() {
        byte[] nonce = new byte[NONCE_LENGTH];
        random.nextBytes(nonce);
        return nonce;
    }

    private byte[] seal(byte[] key, byte[] nonce, byte[] aad, byte[] plaintext) {
        try {
            return cipher(Cipher.ENCRYPT_MODE, key, nonce, aad).doFinal(plaintext);
        } catch (GeneralSecurityException ex) {
            throw new IllegalStateException("Failed to encrypt secret", ex);
        }
    }

    private byte[] open(byte[] key, byte[] nonce, byte[] aad, byte[] ciphertext) {
        try {
            return cipher(Cipher.DECRYPT_MODE, key, nonce, aad).doFinal(ciphertext);
        } catch (GeneralSecurityException ex) {
            throw new IllegalStateException("Failed to decrypt secret", ex);
        }
    }

    private Cipher cipher(int mode, byte[] key, byte[] nonce, byte[] aad) throws GeneralSecurityException {
        Cipher cipher = Cipher.getInstance(TRANSFORMATION);
        cipher.init(mode, new SecretKeySpec(key, "AES"), new GCMParameterSpec(TAG_LENGTH_BITS, nonce));
        if (aad.length > 0) {
            cipher.updateAAD(aad);
        }
        return cipher;
    }
}
