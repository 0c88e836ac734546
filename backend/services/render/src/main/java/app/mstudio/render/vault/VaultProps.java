package app.mstudio.render.vault;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * @param masterKey        base64 AES key (16, 24 or 32 bytes)
 * @param requireMasterKey refuse to start with an ephemeral key
 */
@ConfigurationProperties(prefix = "app.render.vault")
public record VaultProps(
        String masterKey,
        String keyId,
        boolean requireMasterKey
) {
}
