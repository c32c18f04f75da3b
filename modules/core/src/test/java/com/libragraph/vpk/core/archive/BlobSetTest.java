package com.libragraph.vpk.core.archive;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class BlobSetTest {

    private static byte[] utf8(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void shouldKeepInsertionOrder() {
        BlobSet blobs = new BlobSet()
                .put("z.txt", utf8("z"))
                .put("a.txt", utf8("a"))
                .put("m/n.txt", utf8("n"));

        assertThat(blobs.paths()).containsExactly("z.txt", "a.txt", "m/n.txt");
        assertThat(blobs.size()).isEqualTo(3);
        assertThat(blobs.totalBytes()).isEqualTo(3);
    }

    @Test
    void shouldCopyContentInAndOut() {
        byte[] content = {1, 2, 3};
        BlobSet blobs = new BlobSet().put("f", content);

        content[0] = 9;
        assertThat(blobs.get("f")).hasValueSatisfying(b -> assertThat(b).containsExactly(1, 2, 3));

        blobs.get("f").orElseThrow()[1] = 9;
        assertThat(blobs.get("f")).hasValueSatisfying(b -> assertThat(b).containsExactly(1, 2, 3));
    }

    @Test
    void equalityShouldCompareBytes() {
        BlobSet a = new BlobSet().put("x", new byte[]{1, 2});
        BlobSet b = new BlobSet().put("x", new byte[]{1, 2});
        BlobSet c = new BlobSet().put("x", new byte[]{1, 3});

        assertThat(a).isEqualTo(b).hasSameHashCodeAs(b);
        assertThat(a).isNotEqualTo(c);
        assertThat(a).isNotEqualTo(new BlobSet());
    }

    @Test
    void mergeShouldOverwriteAndAddButNeverRemove() {
        BlobSet base = new BlobSet()
                .put("keep.txt", utf8("kept"))
                .put("change.txt", utf8("old"));
        BlobSet patch = new BlobSet()
                .put("change.txt", utf8("new"))
                .put("added.txt", utf8("added"));

        base.merge(patch);

        assertThat(base.paths()).containsExactly("keep.txt", "change.txt", "added.txt");
        assertThat(base.get("keep.txt")).hasValueSatisfying(b -> assertThat(b).isEqualTo(utf8("kept")));
        assertThat(new String(base.get("change.txt").orElseThrow(), StandardCharsets.UTF_8)).isEqualTo("new");
        assertThat(base.contains("added.txt")).isTrue();
    }

    @Test
    void shouldBuildFromMap() {
        Map<String, byte[]> content = new LinkedHashMap<>();
        content.put("b", new byte[]{2});
        content.put("a", new byte[]{1});

        assertThat(BlobSet.of(content).paths()).containsExactly("b", "a");
    }

    @Test
    void shouldRejectEmptyPathOrNullContent() {
        BlobSet blobs = new BlobSet();

        assertThatIllegalArgumentException().isThrownBy(() -> blobs.put("", new byte[0]));
        assertThatNullPointerException().isThrownBy(() -> blobs.put("x", null));
        assertThat(blobs.isEmpty()).isTrue();
    }

    @Test
    void toStringShouldNotDumpContent() {
        BlobSet blobs = new BlobSet().put("secret.txt", utf8("hunter2"));

        assertThat(blobs.toString()).isEqualTo("BlobSet[1 entries, 7 bytes]");
    }
}
