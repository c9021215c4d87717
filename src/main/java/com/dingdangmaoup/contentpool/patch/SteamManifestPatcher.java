package com.dingdangmaoup.contentpool.patch;

import com.dingdangmaoup.contentpool.model.ContentManifest;
import com.dingdangmaoup.contentpool.model.ManifestFile;
import com.dingdangmaoup.contentpool.model.ManifestId;
import com.dingdangmaoup.contentpool.model.OperationResult;
import com.dingdangmaoup.contentpool.pool.ContentManifestPool;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Selects the launch executable of a stored game client manifest.
 * Steam launches go through generals.exe; standalone launches run game.dat directly.
 * Only the executable flags change; content is untouched.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SteamManifestPatcher {

    public static final String GENERALS_EXECUTABLE = "generals.exe";
    public static final String GAME_DAT_EXECUTABLE = "game.dat";

    private final ContentManifestPool pool;

    /**
     * @param id             the stored manifest to patch
     * @param useSteamLaunch true to launch through generals.exe, false for game.dat
     * @return Mono emitting true if the record was rewritten, false if it already matched
     */
    public Mono<OperationResult<Boolean>> patchLaunchMode(ManifestId id, boolean useSteamLaunch) {
        log.info("Patching manifest {} for Steam launch: {}", id, useSteamLaunch);

        return pool.getManifest(id)
                .flatMap(found -> {
                    if (found.isFailure()) {
                        return Mono.just(OperationResult.<Boolean>failure(found.allErrors()));
                    }
                    ContentManifest manifest = found.getData();
                    if (manifest == null) {
                        return Mono.just(OperationResult.<Boolean>failure("Manifest " + id + " is not stored"));
                    }

                    Optional<ManifestFile> generalsExe = findFile(manifest, GENERALS_EXECUTABLE);
                    Optional<ManifestFile> gameDat = findFile(manifest, GAME_DAT_EXECUTABLE);
                    if (generalsExe.isEmpty() || gameDat.isEmpty()) {
                        return Mono.just(OperationResult.<Boolean>failure("Manifest " + id
                                + " does not contain required files (" + GENERALS_EXECUTABLE
                                + " and " + GAME_DAT_EXECUTABLE + ")"));
                    }

                    if (generalsExe.get().isExecutable() == useSteamLaunch
                            && gameDat.get().isExecutable() != useSteamLaunch) {
                        log.debug("No changes needed for manifest {}", id);
                        return Mono.just(OperationResult.<Boolean>success(false));
                    }

                    ContentManifest patched = manifest.toBuilder()
                            .files(withLaunchMode(manifest.getFiles(), useSteamLaunch))
                            .build();
                    return pool.addManifest(patched)
                            .doOnNext(result -> {
                                if (result.isSuccess()) {
                                    log.info("Patched manifest {} launch mode", id);
                                }
                            });
                });
    }

    private static List<ManifestFile> withLaunchMode(List<ManifestFile> files, boolean useSteamLaunch) {
        List<ManifestFile> patched = new ArrayList<>(files.size());
        for (ManifestFile file : files) {
            if (GENERALS_EXECUTABLE.equalsIgnoreCase(file.getRelativePath())) {
                patched.add(file.toBuilder().executable(useSteamLaunch).build());
            } else if (GAME_DAT_EXECUTABLE.equalsIgnoreCase(file.getRelativePath())) {
                patched.add(file.toBuilder().executable(!useSteamLaunch).build());
            } else {
                patched.add(file);
            }
        }
        return patched;
    }

    private static Optional<ManifestFile> findFile(ContentManifest manifest, String relativePath) {
        return manifest.getFiles().stream()
                .filter(file -> relativePath.equalsIgnoreCase(file.getRelativePath()))
                .findFirst();
    }
}
