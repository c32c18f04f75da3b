package com.libragraph.vpk.core.archive;

import com.libragraph.vpk.util.DirectoryLister;
import com.libragraph.vpk.util.DirectoryReadException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class DirectoryReaderTest {

    @TempDir
    Path root;

    private List<Path> populate(int count) throws IOException {
        Files.createDirectories(root.resolve("sub"));
        for (int i = 0; i < count; i++) {
            Path dir = i % 2 == 0 ? root : root.resolve("sub");
            Files.writeString(dir.resolve("file-" + i + ".txt"), "content " + i);
        }
        return DirectoryLister.listFiles(root);
    }

    @Test
    void parallelReadShouldMatchSequentialRead() throws IOException {
        List<Path> files = populate(32);

        BlobSet sequential = new DirectoryReader(1).read(root, files);
        BlobSet parallel = new DirectoryReader(6).read(root, files);

        assertThat(parallel).isEqualTo(sequential);
        assertThat(new ArrayList<>(parallel.paths())).isEqualTo(new ArrayList<>(sequential.paths()));
        assertThat(parallel.get("sub/file-1.txt"))
                .hasValueSatisfying(b -> assertThat(new String(b)).isEqualTo("content 1"));
    }

    @Test
    void missingFileShouldFailWithItsPath() throws IOException {
        List<Path> files = new ArrayList<>(populate(4));
        Path gone = root.resolve("gone.txt");
        files.add(gone);

        assertThatThrownBy(() -> new DirectoryReader(3).read(root, files))
                .isInstanceOfSatisfying(DirectoryReadException.class,
                        e -> assertThat(e.path()).isEqualTo(gone));
    }

    @Test
    void shouldRejectZeroThreads() {
        assertThatIllegalArgumentException().isThrownBy(() -> new DirectoryReader(0));
    }
}
