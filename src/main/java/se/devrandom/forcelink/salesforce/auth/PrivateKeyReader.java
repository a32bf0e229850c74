/*
 * Forcelink - Salesforce API Integration Runtime
 * Copyright (C) 2025 Johan Karlsteen
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package se.devrandom.forcelink.salesforce.auth;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.devrandom.forcelink.exception.AuthException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.security.KeyFactory;
import java.security.PrivateKey;
import java.security.spec.PKCS8EncodedKeySpec;
import java.util.Base64;

/**
 * Reads RSA private keys in PKCS#8 PEM format.
 */
public final class PrivateKeyReader {
    private static final Logger log = LoggerFactory.getLogger(PrivateKeyReader.class);

    private PrivateKeyReader() {
    }

    public static String readPem(String keyFilePath) {
        if (keyFilePath == null || keyFilePath.isEmpty()) {
            throw new IllegalArgumentException("JWT key file path is not configured");
        }
        Path keyPath = Paths.get(keyFilePath);
        if (!Files.exists(keyPath)) {
            throw new AuthException(AuthException.Reason.MALFORMED_CREDENTIALS, Credentials.AUTH_JWT_BEARER,
                    "JWT key file not found: " + keyFilePath);
        }
        log.debug("Reading private key from: {}", keyFilePath);
        try {
            return Files.readString(keyPath, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new AuthException(AuthException.Reason.MALFORMED_CREDENTIALS, Credentials.AUTH_JWT_BEARER,
                    "JWT key file unreadable: " + keyFilePath, null, e);
        }
    }

    public static PrivateKey parse(String pem) {
        // Strip PEM armour and whitespace
        String keyContent = pem
                .replaceAll("-----BEGIN.*-----", "")
                .replaceAll("-----END.*-----", "")
                .replaceAll("\\s+", "");
        try {
            byte[] keyBytes = Base64.getDecoder().decode(keyContent);
            PKCS8EncodedKeySpec keySpec = new PKCS8EncodedKeySpec(keyBytes);
            KeyFactory keyFactory = KeyFactory.getInstance("RSA");
            return keyFactory.generatePrivate(keySpec);
        } catch (Exception e) {
            throw new AuthException(AuthException.Reason.SIGNATURE_FAILURE, Credentials.AUTH_JWT_BEARER,
                    "Invalid private key format. Ensure the key is in PKCS#8 PEM format.", null, e);
        }
    }
}
