package com.dingdangmaoup.contentpool.hash;

import reactor.core.publisher.Mono;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;

/**
 * Computes the content hash that names objects in the content-addressable store.
 * Identical bytes always produce the identical hash, whatever their origin.
 */
public interface ContentHasher {

    /**
     * Hash a stream, reading it to the end
     *
     * @param input the byte stream; not closed by this method
     * @return lowercase hex digest
     */
    String hash(InputStream input) throws IOException;

    /**
     * Hash a file on disk, blocking the calling thread
     */
    String hashFile(Path file) throws IOException;

    /**
     * Hash a file on disk
     *
     * @param file the file to hash
     * @return Mono emitting the lowercase hex digest
     */
    Mono<String> computeFileHash(Path file);
}
