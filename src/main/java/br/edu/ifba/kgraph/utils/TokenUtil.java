package br.edu.ifba.kgraph.utils;

import com.knuddels.jtokkit.Encodings;
import com.knuddels.jtokkit.api.Encoding;
import com.knuddels.jtokkit.api.EncodingType;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Token count hint recorded on each document.
 *
 * <p>Counts against cl100k_base, the encoding downstream embedding and generation
 * models budget against. When jtokkit cannot load its vocabulary the hint degrades
 * to one token per four characters.</p>
 */
public final class TokenUtil {

    private static final Logger logger = LoggerFactory.getLogger(TokenUtil.class);

    private static final int CHARS_PER_TOKEN = 4;

    private TokenUtil() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Loaded on first use by the class loader, once per JVM.
     */
    private static final class Cl100k {

        private static final Optional<Encoding> ENCODING = load();

        private static Optional<Encoding> load() {
            try {
                Encoding encoding = Encodings.newLazyEncodingRegistry().getEncoding(EncodingType.CL100K_BASE);
                logger.info("Token count hints use jtokkit cl100k_base");
                return Optional.of(encoding);
            } catch (RuntimeException e) {
                logger.warn("jtokkit unavailable, token count hints are approximate: {}", e.getMessage());
                return Optional.empty();
            }
        }
    }

    /**
     * Counts the cl100k tokens of a document text.
     *
     * @param text document text
     * @return exact count, or {@link #estimateTokensApproximate(String)} without jtokkit
     */
    public static int estimateTokens(@NotNull String text) {
        if (text.isEmpty()) {
            return 0;
        }
        return Cl100k.ENCODING
            .map(encoding -> encoding.countTokens(text))
            .orElseGet(() -> estimateTokensApproximate(text));
    }

    /**
     * Character-based fallback, rounded up.
     */
    public static int estimateTokensApproximate(@NotNull String text) {
        return (text.length() + CHARS_PER_TOKEN - 1) / CHARS_PER_TOKEN;
    }
}
