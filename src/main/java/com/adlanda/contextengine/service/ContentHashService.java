package com.adlanda.contextengine.service;

import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Computes content hashes.
 *
 * Used as the embedding cache key: identical text always maps to the same key.
 */
@Service
public class ContentHashService {

    /**
     * Computes the SHA-256 hash of a string's UTF-8 bytes.
     *
     * @param content The string content to hash
     * @return Hexadecimal string representation of the hash (64 characters)
     */
    public String computeHash(String content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hashBytes = digest.digest(content.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hashBytes);
        } catch (NoSuchAlgorithmException e) {
            // SHA-256 is always available in standard JVMs
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }
}
