package com.hcltech.composable.common.codec;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

class JacksonTypedJsonCodecTest {

    public record Balance(String holder, BigInteger amount) {
    }

    private final Codec<Balance, String> codec = Codec.clazzCodec(Balance.class);

    @Test
    void encodesRecordsAsJsonObjects() {
        String json = codec.encode(new Balance("0xabc", new BigInteger("100000000000000000000"))).valueOrThrow();
        assertTrue(json.contains("\"holder\":\"0xabc\""), json);
        assertTrue(json.contains("\"amount\":100000000000000000000"), json);
    }

    @Test
    void decodesBackToRecord() {
        Balance b = codec.decode("{\"holder\":\"0xabc\",\"amount\":5}").valueOrThrow();
        assertEquals(new Balance("0xabc", BigInteger.valueOf(5)), b);
    }

    @Test
    void malformedJsonIsAnErrorNotAnException() {
        var result = codec.decode("{not json");
        assertTrue(result.isError());
        assertTrue(result.getErrors().get(0).startsWith("Failed to decode Balance"));
    }
}
