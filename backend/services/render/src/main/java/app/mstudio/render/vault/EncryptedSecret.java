package app.mstudio.render.vault;

/**
 * A provider key sealed under a per-secret data key. {@code wrappedDataKey} is the data key sealed under the
 * vault master key identified by {@code keyId}, prefixed with its own nonce.
 */
public record EncryptedSecret(
        byte[] ciphertext,
        byte[] wrappedDataKey,
        String keyId,
        byte[] nonce,
        byte[] aad
) {

    public boolean isComplete() {
        return ciphertext != null && ciphertext.length > 0
                && wrappedDataKey != null
                && nonce != null;
    }

    /**
     * Same sealed material presented with different associated data.
     */
    public EncryptedSecret boundTo(byte[] otherAad) {
        return new EncryptedSecret(ciphertext, wrappedDataKey, keyId, nonce, otherAad);
    }
}
