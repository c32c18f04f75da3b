package com.libragraph.vpk.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class KeyMaterialTest {

    @Test
    void shouldConstructFromBytes() {
        byte[] bytes = new byte[32];
        bytes[0] = (byte) 0xAB;
        bytes[31] = (byte) 0xCD;

        KeyMaterial key = new KeyMaterial(bytes);
        assertThat(key.length()).isEqualTo(32);
        assertThat(key.bytes()[0]).isEqualTo((byte) 0xAB);
    }

    @Test
    void shouldCopyOnConstruction() {
        byte[] bytes = new byte[16];
        bytes[0] = (byte) 0x01;
        KeyMaterial key = new KeyMaterial(bytes);

        bytes[0] = (byte) 0xFF;
        assertThat(key.bytes()[0]).isEqualTo((byte) 0x01);
    }

    @Test
    void shouldCopyOnAccess() {
        KeyMaterial key = new KeyMaterial(new byte[16]);

        key.bytes()[0] = (byte) 0xFF;
        assertThat(key.bytes()[0]).isEqualTo((byte) 0x00);
    }

    @Test
    void shouldRejectNullAndEmpty() {
        assertThatNullPointerException().isThrownBy(() -> new KeyMaterial(null));
        assertThatIllegalArgumentException().isThrownBy(() -> new KeyMaterial(new byte[0]));
    }

    @Test
    void shouldRoundTripHex() {
        String hex = "000102030405060708090a0b0c0d0e0f";
        assertThat(KeyMaterial.fromHex(hex).toHex()).isEqualTo(hex);
    }

    @Test
    void shouldRejectInvalidHex() {
        assertThatIllegalArgumentException().isThrownBy(() -> KeyMaterial.fromHex("zz"));
    }

    @Test
    void shouldCompareByContent() {
        KeyMaterial a = KeyMaterial.fromHex("00112233445566778899aabbccddeeff");
        KeyMaterial b = KeyMaterial.fromHex("00112233445566778899aabbccddeeff");
        KeyMaterial c = KeyMaterial.fromHex("ffeeddccbbaa99887766554433221100");

        assertThat(a).isEqualTo(b);
        assertThat(a.hashCode()).isEqualTo(b.hashCode());
        assertThat(a).isNotEqualTo(c);
    }

    @Test
    void toStringShouldNotLeakKeyBytes() {
        KeyMaterial key = KeyMaterial.fromHex("00112233445566778899aabbccddeeff");

        assertThat(key.toString())
                .doesNotContain("00112233")
                .contains("16 bytes");
    }
}
