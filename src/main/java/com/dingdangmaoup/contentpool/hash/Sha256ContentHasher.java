package com.dingdangmaoup.contentpool.hash;

import com.dingdangmaoup.contentpool.config.properties.StorageProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

@Slf4j
@Component
public class Sha256ContentHasher implements ContentHasher {

    private static final String ALGORITHM = "SHA-256";

    private final int bufferSize;

    public Sha256ContentHasher(StorageProperties storageProperties) {
        this.bufferSize = Math.max(4096, storageProperties.getHashBufferSize());
    }

    @Override
    public String hash(InputStream input) throws IOException {
        MessageDigest digest = newDigest();
        byte[] buffer = new byte[bufferSize];
        int read;
        while ((read = input.read(buffer)) != -1) {
            digest.update(buffer, 0, read);
        }
        return HexFormat.of().formatHex(digest.digest());
    }

    @Override
    public Mono<String> computeFileHash(Path file) {
        return Mono.fromCallable(() -> hashFile(file))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public String hashFile(Path file) throws IOException {
        try (InputStream input = Files.newInputStream(file)) {
            String hash = hash(input);
            log.debug("Hashed {} -> {}", file, hash);
            return hash;
        }
    }

    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance(ALGORITHM);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("JVM does not provide " + ALGORITHM, e);
        }
    }
}
