package com.phillippitts.sttguard.service.integrity;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Random;

import static com.phillippitts.sttguard.testutil.PcmFixtures.pcm;
import static com.phillippitts.sttguard.testutil.PcmFixtures.tone;
import static org.assertj.core.api.Assertions.assertThat;

class PcmChecksumTest {

    @Test
    void sumsSamples() {
        assertThat(PcmChecksum.compute(pcm(1, 2, 3, 4))).isEqualTo(10L);
    }

    @Test
    void silenceHasZeroChecksum() {
        assertThat(PcmChecksum.compute(new byte[16_000])).isZero();
        assertThat(PcmChecksum.compute(new byte[0])).isZero();
    }

    @Test
    void negativeSamplesContributeSignedValues() {
        assertThat(PcmChecksum.compute(pcm(-5, 3))).isEqualTo(0xFFFF_FFFEL);
        assertThat(PcmChecksum.compute(pcm(-5, 5))).isZero();
    }

    @Test
    void extremeSamplesAreReadSigned() {
        assertThat(PcmChecksum.compute(pcm(-32768))).isEqualTo(0x1_0000_0000L - 32768);
        assertThat(PcmChecksum.compute(pcm(32767))).isEqualTo(32767L);
    }

    @Test
    void reducesModulo2To32OnlyAtTheEnd() {
        // 140000 * 32767 exceeds 2^32 once
        int[] samples = new int[140_000];
        Arrays.fill(samples, 32767);

        assertThat(PcmChecksum.compute(pcm(samples))).isEqualTo((140_000L * 32767L) & 0xFFFF_FFFFL);
    }

    @Test
    void matchesReferenceLongAccumulation() {
        Random random = new Random(7);
        int[] samples = new int[4096];
        long expected = 0;
        for (int i = 0; i < samples.length; i++) {
            samples[i] = random.nextInt(65536) - 32768;
            expected += samples[i];
        }

        assertThat(PcmChecksum.compute(pcm(samples))).isEqualTo(expected & 0xFFFF_FFFFL);
    }

    @Test
    void toneChecksumIsStable() {
        byte[] a = tone(200);
        byte[] b = tone(200);

        assertThat(PcmChecksum.compute(a)).isEqualTo(PcmChecksum.compute(b));
        assertThat(PcmChecksum.sampleCount(a)).isEqualTo(3200);
    }

    @Test
    void sampleCountIgnoresTrailingOddByte() {
        byte[] odd = {1, 0, 2, 0, 3};

        assertThat(PcmChecksum.sampleCount(odd)).isEqualTo(2);
        assertThat(PcmChecksum.compute(odd)).isEqualTo(3);
    }
}
