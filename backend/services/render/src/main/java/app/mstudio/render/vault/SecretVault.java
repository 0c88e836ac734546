package app.mstudio.render.vault;

/**
 * Envelope encryption for provider API keys. The associated data binds a secret to its owner so a ciphertext
 * copied to another workspace row fails authentication.
 */
public interface SecretVault {
    EncryptedSecret encrypt(byte[] plaintext, byte[] aad);

    byte[] decrypt(EncryptedSecret secret);
}
