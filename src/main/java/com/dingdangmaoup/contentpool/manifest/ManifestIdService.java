package com.dingdangmaoup.contentpool.manifest;

import com.dingdangmaoup.contentpool.model.ContentType;
import com.dingdangmaoup.contentpool.model.GameType;
import com.dingdangmaoup.contentpool.model.ManifestId;
import com.dingdangmaoup.contentpool.model.OperationResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Locale;

/**
 * Generates deterministic manifest ids.
 * Every generated id has exactly five segments:
 * {@code schemaVersion.userVersion.publisher.contentType.contentName},
 * e.g. {@code 1.108.steam.gameinstallation.zerohour}.
 */
@Slf4j
@Service
public class ManifestIdService {

    public static final int SCHEMA_VERSION = 1;

    private static final String GAME_INSTALLATION_TOKEN = "gameinstallation";

    /**
     * Id for publisher-provided content
     *
     * @param publisherId publisher identifier, e.g. "cnclabs"
     * @param contentType the kind of content
     * @param contentName human readable content name
     * @param userVersion content version counter, zero for the first version
     */
    public OperationResult<ManifestId> generatePublisherContentId(String publisherId, ContentType contentType,
                                                                  String contentName, int userVersion) {
        if (userVersion < 0) {
            return OperationResult.failure("User version cannot be negative: " + userVersion);
        }
        if (contentType == null) {
            return OperationResult.failure("Content type is required");
        }
        String publisher = normalize(publisherId);
        String name = normalize(contentName);
        if (publisher.isEmpty()) {
            return OperationResult.failure("Publisher id must contain at least one letter or digit");
        }
        if (name.isEmpty()) {
            return OperationResult.failure("Content name must contain at least one letter or digit");
        }

        return create(SCHEMA_VERSION + "." + userVersion + "." + publisher + "." + contentType.idToken() + "." + name);
    }

    /**
     * Id for a detected game installation
     *
     * @param installationType installation source, e.g. "steam" or "cdiso"
     * @param gameType         the game the installation provides
     * @param userVersion      installed version such as "1.08", or null for 0
     */
    public OperationResult<ManifestId> generateGameInstallationId(String installationType, GameType gameType,
                                                                  String userVersion) {
        String installation = normalize(installationType);
        if (installation.isEmpty()) {
            return OperationResult.failure("Installation type must contain at least one letter or digit");
        }
        String version;
        try {
            version = normalizeVersion(userVersion);
        } catch (IllegalArgumentException e) {
            return OperationResult.failure(e.getMessage());
        }
        String game = gameType == GameType.ZERO_HOUR ? "zerohour" : "generals";

        return create(SCHEMA_VERSION + "." + version + "." + installation + "." + GAME_INSTALLATION_TOKEN + "." + game);
    }

    public OperationResult<ManifestId> validateAndCreateManifestId(String value) {
        return create(value);
    }

    private OperationResult<ManifestId> create(String value) {
        String problem = ManifestId.findProblem(value);
        if (problem != null) {
            log.debug("Rejected manifest id {}: {}", value, problem);
            return OperationResult.failure(problem);
        }
        return OperationResult.success(ManifestId.of(value));
    }

    /**
     * "1.08" -> "108", "1.8" -> "108", "2.0" -> "200", "5" -> "5", "007" -> "007", blank -> "0"
     */
    static String normalizeVersion(String version) {
        if (version == null || version.isBlank()) {
            return "0";
        }
        String trimmed = version.trim();
        if (trimmed.contains(".")) {
            String[] parts = trimmed.split("\\.", -1);
            if (parts.length != 2) {
                throw new IllegalArgumentException("Version must be 'major.minor' or a single number: " + version);
            }
            int major = parseNonNegative(parts[0], version);
            int minor = parseNonNegative(parts[1], version);
            return major + String.format("%02d", minor);
        }
        parseNonNegative(trimmed, version);
        return trimmed;
    }

    private static int parseNonNegative(String part, String version) {
        try {
            int value = Integer.parseInt(part);
            if (value < 0) {
                throw new IllegalArgumentException("Version must be non-negative: " + version);
            }
            return value;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Version must be numeric: " + version, e);
        }
    }

    private static String normalize(String input) {
        if (input == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        for (char c : input.trim().toLowerCase(Locale.ROOT).toCharArray()) {
            if ((c >= 'a' && c <= 'z') || (c >= '0' && c <= '9')) {
                sb.append(c);
            }
        }
        return sb.toString();
    }
}
