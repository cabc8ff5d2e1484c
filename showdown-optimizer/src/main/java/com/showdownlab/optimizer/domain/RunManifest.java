package com.showdownlab.optimizer.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Reproducibility record of an optimization run.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RunManifest {

    private String runId;
    private LocalDateTime createdAt;
    private ScoringMode scoringMode;
    private int requestedLineups;
    private int salaryCap;
    private int rosterSize;
    private String modelId;
    private String playerDataChecksum;

    public static RunManifest describe(List<Player> pool, RosterConstraintSet constraints, ScoringMode mode,
            int requestedLineups, String modelId, LocalDateTime createdAt) {
        return RunManifest.builder()
                .runId(UUID.randomUUID().toString())
                .createdAt(createdAt)
                .scoringMode(mode)
                .requestedLineups(requestedLineups)
                .salaryCap(constraints.getSalaryCap())
                .rosterSize(constraints.getRosterSize())
                .modelId(modelId)
                .playerDataChecksum(checksum(pool))
                .build();
    }

    /**
     * SHA-256 over the id-sorted (id, mean, ceiling, salary) tuples of the pool.
     */
    public static String checksum(List<Player> pool) {
        StringBuilder canonical = new StringBuilder();
        pool.stream()
                .sorted(Comparator.comparing(Player::getId))
                .forEach(p -> canonical.append(p.getId()).append(':')
                        .append(String.format(Locale.ROOT, "%.4f", p.getMeanScore())).append(':')
                        .append(String.format(Locale.ROOT, "%.4f", p.getCeilingScore())).append(':')
                        .append(p.getSalary()).append(';'));

        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(canonical.toString().getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }
}
