package ca.gc.cra.prism.infrastructure.detect;

import ca.gc.cra.prism.domain.analysis.FileKind;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Leading-byte signatures of the media containers PRISM recognizes.
 */
enum ContainerSignature {
  JPEG(FileKind.IMAGE, false, 0, bytes(0xFF, 0xD8, 0xFF)),
  PNG(FileKind.IMAGE, false, 0, bytes(0x89, 0x50, 0x4E, 0x47, 0x0D, 0x0A, 0x1A, 0x0A)),
  GIF(FileKind.IMAGE, false, 0, ascii("GIF8")),
  WEBP(FileKind.IMAGE, true, 8, ascii("WEBP")),
  BMP(FileKind.IMAGE, false, 0, ascii("BM")),
  ISO_MEDIA(FileKind.VIDEO, false, 4, ascii("ftyp")),
  MATROSKA(FileKind.VIDEO, false, 0, bytes(0x1A, 0x45, 0xDF, 0xA3)),
  AVI(FileKind.VIDEO, true, 8, ascii("AVI ")),
  WAV(FileKind.AUDIO, true, 8, ascii("WAVE")),
  MP3(FileKind.AUDIO, false, 0, ascii("ID3")),
  FLAC(FileKind.AUDIO, false, 0, ascii("fLaC")),
  OGG(FileKind.AUDIO, false, 0, ascii("OggS"));

  /** Bytes needed to test every signature. */
  static final int HEADER_BYTES = 16;

  private static final byte[] RIFF = ascii("RIFF");

  private final FileKind kind;
  private final boolean riff;
  private final int offset;
  private final byte[] magic;

  ContainerSignature(FileKind kind, boolean riff, int offset, byte[] magic) {
    this.kind = kind;
    this.riff = riff;
    this.offset = offset;
    this.magic = magic;
  }

  FileKind kind() {
    return kind;
  }

  /**
   * Identifies the container from a file header.
   *
   * @param header leading bytes of the file
   * @param length number of valid bytes in {@code header}
   * @return matching container, or empty when unrecognized
   */
  static Optional<ContainerSignature> identify(byte[] header, int length) {
    for (ContainerSignature signature : values()) {
      if (signature.matches(header, length)) {
        return Optional.of(signature);
      }
    }
    if (length >= 2 && (header[0] & 0xFF) == 0xFF && (header[1] & 0xE0) == 0xE0) {
      // MPEG audio frame sync without an ID3 tag.
      return Optional.of(MP3);
    }
    return Optional.empty();
  }

  private boolean matches(byte[] header, int length) {
    if (riff && !startsWith(header, length, RIFF, 0)) {
      return false;
    }
    return startsWith(header, length, magic, offset);
  }

  private static boolean startsWith(byte[] header, int length, byte[] expected, int at) {
    if (length < at + expected.length) {
      return false;
    }
    for (int i = 0; i < expected.length; i++) {
      if (header[at + i] != expected[i]) {
        return false;
      }
    }
    return true;
  }

  private static byte[] bytes(int... values) {
    byte[] out = new byte[values.length];
    for (int i = 0; i < values.length; i++) {
      out[i] = (byte) values[i];
    }
    return out;
  }

  private static byte[] ascii(String value) {
    return value.getBytes(StandardCharsets.US_ASCII);
  }
}
