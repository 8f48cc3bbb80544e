package com.treasurylens.ruleset;

import com.treasurylens.common.MetadataDecodeException;
import com.treasurylens.domain.RulesetMetadata;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RulesetMetadataCodecTest {

    private static final String HOOK = "0x00000000000000000000000000000000000000aa";

    @Test
    void decode_readsEachFieldFromItsBits() {
        BigInteger word = BigInteger.valueOf(1000)
                .or(BigInteger.valueOf(6000).shiftLeft(16))
                .or(BigInteger.valueOf(2).shiftLeft(32))
                .setBit(64)
                .setBit(64 + 14)
                .or(BigInteger.valueOf(0xaa).shiftLeft(80))
                .or(BigInteger.valueOf(7).shiftLeft(240));

        RulesetMetadata m = RulesetMetadataCodec.decode(word);

        assertThat(m.reservedPercent()).isEqualTo(1000);
        assertThat(m.cashOutTaxRate()).isEqualTo(6000);
        assertThat(m.baseCurrency()).isEqualTo(2L);
        assertThat(m.pausePay()).isTrue();
        assertThat(m.pauseCashOut()).isFalse();
        assertThat(m.useDataHookForCashOut()).isTrue();
        assertThat(m.dataHook()).isEqualTo(HOOK);
        assertThat(m.metadata()).isEqualTo(7);
        assertThat(m.reservedFraction()).isEqualByComparingTo("0.1");
    }

    @Test
    void decode_zeroWordHasZeroHookAndNoFlags() {
        RulesetMetadata m = RulesetMetadataCodec.decode(BigInteger.ZERO);
        assertThat(m.dataHook()).isEqualTo("0x0000000000000000000000000000000000000000");
        assertThat(m.allowOwnerMinting()).isFalse();
        assertThat(m.cashOutTaxRate()).isZero();
    }

    @Test
    void encode_isInverseOfDecode() {
        RulesetMetadata m = new RulesetMetadata(5000, 10_000, 1L,
                false, true, false, true, false, true, false, true, false, true, false, true, false, true, false,
                HOOK, 65535);
        assertThat(RulesetMetadataCodec.decode(RulesetMetadataCodec.encode(m))).isEqualTo(m);
    }

    @Test
    void decode_isInverseOfEncodeForAValidWord() {
        BigInteger word = BigInteger.valueOf(2500)
                .or(BigInteger.valueOf(3000).shiftLeft(16))
                .setBit(66)
                .setBit(71);
        assertThat(RulesetMetadataCodec.encode(RulesetMetadataCodec.decode(word))).isEqualTo(word);
    }

    @Test
    void decodeThenEncode_restoresRandomValidWords() {
        Random random = new Random(20_240_501L);
        BigInteger taxMask = BigInteger.valueOf(0xFFFF).shiftLeft(16);
        for (int i = 0; i < 500; i++) {
            BigInteger word = new BigInteger(256, random)
                    .clearBit(79)
                    .andNot(taxMask)
                    .or(BigInteger.valueOf(random.nextInt(10_001)).shiftLeft(16));

            assertThat(RulesetMetadataCodec.encode(RulesetMetadataCodec.decode(word)))
                    .as("word %s", word.toString(16))
                    .isEqualTo(word);
        }
    }

    @Test
    void encodeThenDecode_restoresRandomMetadata() {
        Random random = new Random(7L);
        for (int i = 0; i < 200; i++) {
            boolean[] f = new boolean[RulesetMetadataCodec.FLAG_COUNT];
            for (int j = 0; j < f.length; j++) {
                f[j] = random.nextBoolean();
            }
            String hook = String.format("0x%040x", new BigInteger(160, random));
            RulesetMetadata m = new RulesetMetadata(random.nextInt(0x10000), random.nextInt(10_001),
                    random.nextInt() & 0xFFFF_FFFFL,
                    f[0], f[1], f[2], f[3], f[4], f[5], f[6], f[7], f[8], f[9], f[10], f[11], f[12], f[13], f[14],
                    hook, random.nextInt(0x10000));

            assertThat(RulesetMetadataCodec.decode(RulesetMetadataCodec.encode(m))).isEqualTo(m);
        }
    }

    @Test
    void decode_rejectsTaxRateAboveTenThousand() {
        BigInteger word = BigInteger.valueOf(10_001).shiftLeft(16);
        assertThatThrownBy(() -> RulesetMetadataCodec.decode(word))
                .isInstanceOf(MetadataDecodeException.class)
                .hasMessageContaining("10001");
    }

    @Test
    void decode_rejectsWordsOutsideUint256() {
        assertThatThrownBy(() -> RulesetMetadataCodec.decode(BigInteger.ONE.negate()))
                .isInstanceOf(MetadataDecodeException.class);
        assertThatThrownBy(() -> RulesetMetadataCodec.decode(BigInteger.ONE.shiftLeft(256)))
                .isInstanceOf(MetadataDecodeException.class);
    }

    @Test
    void encode_rejectsOutOfRangeFields() {
        RulesetMetadata tooMuchTax = new RulesetMetadata(0, 10_001, 1L,
                false, false, false, false, false, false, false, false, false, false, false, false, false, false, false,
                null, 0);
        assertThatThrownBy(() -> RulesetMetadataCodec.encode(tooMuchTax)).isInstanceOf(IllegalArgumentException.class);

        RulesetMetadata badHook = new RulesetMetadata(0, 0, 1L,
                false, false, false, false, false, false, false, false, false, false, false, false, false, false, false,
                "0x1234", 0);
        assertThatThrownBy(() -> RulesetMetadataCodec.encode(badHook)).isInstanceOf(IllegalArgumentException.class);
    }
}
