package net.proxymachine.support.io;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.UUID;

/**
 * Streams content into a hidden temporary sibling and renames it over the destination
 * only once the stream completed. A failed, cancelled or interrupted write never leaves a
 * file at the destination path, and the temporary file is removed.
 */
public final class AtomicFileWriter {

    private static final Logger log = LoggerFactory.getLogger(AtomicFileWriter.class);

    static final String TEMP_SUFFIX = ".part";

    private AtomicFileWriter() {
    }

    /**
     * Writes the body to {@code destination}. The parent directory must exist.
     *
     * @return number of bytes committed
     */
    public static Mono<Long> write(Flux<DataBuffer> body, Path destination) {
        return Mono.defer(() -> {
            Path temp = tempSibling(destination);
            return DataBufferUtils.write(body, temp, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE)
                .then(Mono.fromCallable(() -> commit(temp, destination)).subscribeOn(Schedulers.boundedElastic()))
                .doOnError(error -> deleteQuietly(temp))
                .doOnCancel(() -> deleteQuietly(temp));
        });
    }

    static Path tempSibling(Path destination) {
        return destination.resolveSibling("." + destination.getFileName() + "." + UUID.randomUUID() + TEMP_SUFFIX);
    }

    private static long commit(Path temp, Path destination) throws IOException {
        long size = Files.size(temp);
        try {
            Files.move(temp, destination, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException ex) {
            log.debug("Atomic move unsupported for {}, falling back to replace", destination);
            Files.move(temp, destination, StandardCopyOption.REPLACE_EXISTING);
        }
        return size;
    }

    private static void deleteQuietly(Path temp) {
        try {
            Files.deleteIfExists(temp);
        } catch (IOException ex) {
            log.warn("Failed to remove temporary file {}: {}", temp, ex.getMessage());
        }
    }
}
