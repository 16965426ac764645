//  Copyright (c) Meta Platforms, Inc. and affiliates.
//  This source code is licensed under both the GPLv2 (found in the
//  COPYING file in the root directory) and Apache 2.0 License
//  (found in the LICENSE.Apache file in the root directory).

package org.chunkio;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.Test;

public class CompressionTypeTest {
  /**
   * These values are written into files. If this test fails, the file format
   * has been broken: restore the constant instead of updating the test.
   */
  @Test
  public void frozenValues() {
    assertThat(CompressionType.NONE.getValue()).isEqualTo((byte) 0);
    assertThat(CompressionType.BROTLI.getValue()).isEqualTo((byte) 0x62);
    assertThat(CompressionType.ZSTD.getValue()).isEqualTo((byte) 0x7a);
    assertThat(CompressionType.SNAPPY.getValue()).isEqualTo((byte) 0x73);
    assertThat(CompressionType.values()).hasSize(4);
  }

  @Test
  public void getCompressionType() {
    for (final CompressionType compressionType : CompressionType.values()) {
      assertThat(CompressionType.getCompressionType(compressionType.getValue()))
          .isSameAs(compressionType);
    }
  }

  @Test
  public void getCompressionType_unknownValue() {
    assertThatThrownBy(() -> CompressionType.getCompressionType((byte) 'x'))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  public void optionNames() {
    assertThat(CompressionType.NONE.getOptionName()).isEqualTo("uncompressed");
    assertThat(CompressionType.BROTLI.getOptionName()).isEqualTo("brotli");
    assertThat(CompressionType.ZSTD.getOptionName()).isEqualTo("zstd");
    assertThat(CompressionType.SNAPPY.getOptionName()).isEqualTo("snappy");
    for (final CompressionType compressionType : CompressionType.values()) {
      assertThat(CompressionType.getFromOptionName(compressionType.getOptionName()))
          .isSameAs(compressionType);
    }
    assertThat(CompressionType.getFromOptionName("Brotli")).isNull();
    assertThat(CompressionType.getFromOptionName("none")).isNull();
  }
}
