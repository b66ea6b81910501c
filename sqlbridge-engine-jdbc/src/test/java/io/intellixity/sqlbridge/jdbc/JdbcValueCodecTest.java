package io.intellixity.sqlbridge.jdbc;

import io.intellixity.sqlbridge.error.CodecException;
import io.intellixity.sqlbridge.value.ColumnType;
import io.intellixity.sqlbridge.value.Value;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.sql.Timestamp;
import java.time.LocalDate;
import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.*;

final class JdbcValueCodecTest {
  private final JdbcValueCodec codec = new JdbcValueCodec();

  @Test
  void narrowIntegersWiden() {
    assertEquals(Value.of(7L), codec.decode((byte) 7, 0));
    assertEquals(Value.of(-300L), codec.decode((short) -300, 0));
    assertEquals(Value.of(70_000L), codec.decode(70_000, 0));
    assertEquals(Value.of(Long.MIN_VALUE), codec.decode(Long.MIN_VALUE, 0));
  }

  @Test
  void unsignedBeyondSigned64Fails() {
    BigInteger max = BigInteger.valueOf(Long.MAX_VALUE);
    assertEquals(Value.of(Long.MAX_VALUE), codec.decode(max, 0));

    CodecException e = assertThrows(CodecException.class, () -> codec.decode(max.add(BigInteger.ONE), 3));
    assertEquals(3, e.columnIndex());
  }

  @Test
  void floatWidensToReal() {
    Value v = codec.decode(1.5f, 0);
    assertEquals(Value.of(1.5d), v);
  }

  @Test
  void decimals_integralFitsElsePlainText() {
    assertEquals(Value.of(42L), codec.decode(new BigDecimal("42"), 0));
    assertEquals(Value.of("3.10"), codec.decode(new BigDecimal("3.10"), 0));
    assertEquals(Value.of("123456789012345678901234567890"),
        codec.decode(new BigDecimal("123456789012345678901234567890"), 0));
  }

  @Test
  void booleansAndTemporalValues() {
    assertEquals(Value.of(1L), codec.decode(Boolean.TRUE, 0));
    assertEquals(Value.of("2024-02-29"), codec.decode(LocalDate.of(2024, 2, 29), 0));
    assertEquals(Value.of("2024-02-29T10:15:30"),
        codec.decode(Timestamp.valueOf(LocalDateTime.of(2024, 2, 29, 10, 15, 30)), 0));
  }

  @Test
  void bytesInTextColumnMustBeUtf8() {
    byte[] ok = "héllo".getBytes(StandardCharsets.UTF_8);
    assertEquals(Value.of("héllo"), codec.decode(ok, ColumnType.TEXT, 0));
    assertEquals(Value.of(ok), codec.decode(ok, ColumnType.BLOB, 0));

    byte[] bad = {(byte) 0xC3, (byte) 0x28};
    CodecException e = assertThrows(CodecException.class, () -> codec.decode(bad, ColumnType.TEXT, 2));
    assertEquals(2, e.columnIndex());
    assertEquals(Value.of(bad), codec.decode(bad, ColumnType.UNKNOWN, 2));
  }

  @Test
  void unsupportedCellClassFails() {
    CodecException e = assertThrows(CodecException.class, () -> codec.decode(new Object(), 5));
    assertEquals(5, e.columnIndex());
  }

  @Test
  void encodeUsesPlainJavaObjects() {
    assertNull(codec.encode(Value.NULL));
    assertEquals(9L, codec.encode(Value.of(9)));
    assertEquals(2.5d, codec.encode(Value.of(2.5)));
    assertEquals("x", codec.encode(Value.of("x")));
    assertArrayEquals(new byte[] {1, 2}, (byte[]) codec.encode(Value.of(new byte[] {1, 2})));
  }
}
