package net.proxymachine.support.io;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DefaultDataBufferFactory;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

class AtomicFileWriterTest {

    @TempDir
    Path dir;

    @Test
    void write_commitsCompleteBody() throws IOException {
        Path destination = dir.resolve("card.png");

        StepVerifier.create(AtomicFileWriter.write(Flux.just(buffer("hello "), buffer("world")), destination))
            .expectNext(11L)
            .verifyComplete();

        assertThat(Files.readString(destination)).isEqualTo("hello world");
        assertThat(listDir()).containsExactly("card.png");
    }

    @Test
    void write_leavesNothingBehindWhenStreamFailsMidway() throws IOException {
        Path destination = dir.resolve("card.png");
        Flux<DataBuffer> body = Flux.concat(Flux.just(buffer("partial")), Flux.error(new IOException("connection reset")));

        StepVerifier.create(AtomicFileWriter.write(body, destination))
            .expectErrorMessage("connection reset")
            .verify();

        assertThat(destination).doesNotExist();
        assertThat(listDir()).isEmpty();
    }

    @Test
    void write_keepsPreviousFileWhenReplacementFails() throws IOException {
        Path destination = dir.resolve("card.png");
        Files.writeString(destination, "previous");

        StepVerifier.create(AtomicFileWriter.write(Flux.error(new IOException("boom")), destination))
            .expectError(IOException.class)
            .verify();

        assertThat(Files.readString(destination)).isEqualTo("previous");
        assertThat(listDir()).containsExactly("card.png");
    }

    @Test
    void tempSibling_isHiddenNextToDestination() {
        Path destination = dir.resolve("card.png");

        Path temp = AtomicFileWriter.tempSibling(destination);

        assertThat(temp.getParent()).isEqualTo(dir);
        assertThat(temp.getFileName().toString()).startsWith(".card.png.").endsWith(AtomicFileWriter.TEMP_SUFFIX);
        assertThat(AtomicFileWriter.tempSibling(destination)).isNotEqualTo(temp);
    }

    private static DataBuffer buffer(String value) {
        return DefaultDataBufferFactory.sharedInstance.wrap(value.getBytes(StandardCharsets.UTF_8));
    }

    private List<String> listDir() throws IOException {
        try (Stream<Path> files = Files.list(dir)) {
            return files.map(path -> path.getFileName().toString()).sorted().toList();
        }
    }
}
