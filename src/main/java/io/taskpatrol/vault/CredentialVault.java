package io.taskpatrol.vault;

import io.taskpatrol.security.SecretMaterial;

/**
 * Source of decrypted tenant credentials. Implementations never cache the material they return; the
 * caller closes it as soon as the remote call is over.
 */
public interface CredentialVault {
    SecretMaterial resolve(String credentialId) throws VaultException;
}
