package com.helmet.corpus.util;

import com.helmet.corpus.model.Stage;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Collection;
import java.util.HexFormat;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Deterministic identifiers for papers, artifacts and synthesis batches.
 * <p>
 * Every id is a name-based UUID over a composite key, so the same logical input always maps
 * to the same id across runs. This is what makes the stores idempotent:
 * <ul>
 *   <li>re-fetching a paper never creates a second record</li>
 *   <li>regenerating a stage for a paper rewrites the same artifact ids</li>
 * </ul>
 */
public final class StableIds {

    /** Separator used in composite keys to prevent collisions. */
    private static final String SEPARATOR = "|";

    private StableIds() {
    }

    /**
     * @param externalSourceId the source system key (e.g. a PMC id); surrounding whitespace is ignored
     */
    public static UUID paperId(String externalSourceId) {
        if (externalSourceId == null || externalSourceId.isBlank()) {
            throw new IllegalArgumentException("externalSourceId cannot be null or blank");
        }
        return nameBased("paper" + SEPARATOR + externalSourceId.trim());
    }

    public static UUID artifactId(UUID ownerId, Stage stage, int sequenceIndex) {
        if (ownerId == null) {
            throw new IllegalArgumentException("ownerId cannot be null");
        }
        if (sequenceIndex < 0) {
            throw new IllegalArgumentException("sequenceIndex cannot be negative");
        }
        return nameBased("artifact" + SEPARATOR + ownerId + SEPARATOR + stage.stageName() + SEPARATOR + sequenceIndex);
    }

    /**
     * Id of a synthesis batch; independent of the order members are listed in.
     */
    public static UUID batchId(Collection<UUID> memberIds) {
        if (memberIds == null || memberIds.isEmpty()) {
            throw new IllegalArgumentException("memberIds cannot be null or empty");
        }
        String members = memberIds.stream()
            .map(UUID::toString)
            .sorted()
            .collect(Collectors.joining(","));
        return nameBased("batch" + SEPARATOR + members);
    }

    public static String contentHash(String content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(content.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

    private static UUID nameBased(String composite) {
        return UUID.nameUUIDFromBytes(composite.getBytes(StandardCharsets.UTF_8));
    }
}
