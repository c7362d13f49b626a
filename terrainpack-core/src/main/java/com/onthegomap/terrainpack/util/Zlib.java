package com.onthegomap.terrainpack.util;

import java.io.ByteArrayOutputStream;
import java.util.zip.DataFormatException;
import java.util.zip.Deflater;
import java.util.zip.Inflater;

/** Compresses and decompresses byte arrays in the zlib format. */
public final class Zlib {

  private Zlib() {}

  /** Returns {@code in} compressed at the highest compression level. */
  public static byte[] deflate(byte[] in) {
    Deflater deflater = new Deflater(Deflater.BEST_COMPRESSION);
    try {
      deflater.setInput(in);
      deflater.finish();
      var bos = new ByteArrayOutputStream(Math.max(64, in.length / 2));
      byte[] buffer = new byte[8192];
      while (!deflater.finished()) {
        int n = deflater.deflate(buffer);
        bos.write(buffer, 0, n);
      }
      return bos.toByteArray();
    } finally {
      deflater.end();
    }
  }

  /**
   * Returns {@code zipped} decompressed, which must inflate to exactly {@code expectedLength} bytes.
   *
   * @throws DataFormatException if the data is not valid zlib or has a different length
   */
  public static byte[] inflate(byte[] zipped, int expectedLength) throws DataFormatException {
    Inflater inflater = new Inflater();
    try {
      inflater.setInput(zipped);
      byte[] result = new byte[expectedLength];
      int total = 0;
      while (total < expectedLength && !inflater.finished()) {
        int n = inflater.inflate(result, total, expectedLength - total);
        if (n == 0 && (inflater.needsInput() || inflater.needsDictionary())) {
          break;
        }
        total += n;
      }
      if (total == expectedLength && !inflater.finished()) {
        // reach the end of stream marker, which must not produce more output
        total += inflater.inflate(new byte[1]);
      }
      if (total != expectedLength || !inflater.finished()) {
        throw new DataFormatException("expected " + expectedLength + " bytes after inflating, got " +
          (total > expectedLength ? "more" : total));
      }
      return result;
    } finally {
      inflater.end();
    }
  }
}
