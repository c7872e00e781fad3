package io.intellixity.entigen.codegen.internal;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

public final class OutputFiles {
  private OutputFiles() {}

  public static Path write(Path outDir, String relativePath, String content) throws IOException {
    Path file = outDir.resolve(relativePath);
    Files.createDirectories(file.getParent());
    Files.writeString(file, content, StandardCharsets.UTF_8);
    return file;
  }

  public static LineWriter open(Path outDir, String relativePath) throws IOException {
    Path file = outDir.resolve(relativePath);
    Files.createDirectories(file.getParent());
    return new LineWriter(Files.newBufferedWriter(file, StandardCharsets.UTF_8));
  }

  public static String sha256(Path file) throws IOException {
    try {
      MessageDigest md = MessageDigest.getInstance("SHA-256");
      return HexFormat.of().formatHex(md.digest(Files.readAllBytes(file)));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }

  /** Line-oriented writer, always {@code \n} line endings. */
  public static final class LineWriter implements Closeable {
    private final Writer w;

    public LineWriter(Writer w) { this.w = w; }

    public void println(String s) throws IOException {
      w.write(s);
      w.write("\n");
    }

    public void blank() throws IOException { w.write("\n"); }

    @Override public void close() throws IOException { w.close(); }
  }
}
