package org.proxyrotor;

import static java.util.Objects.requireNonNull;

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import org.apache.commons.lang3.RandomStringUtils;
import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;

/**
 * A {@code multipart/form-data} body (RFC 7578). Build one with {@link #builder()}; a form that
 * ends up without any file is sent url-encoded instead, which is what most servers expect from a
 * plain form.
 */
@NullMarked
public final class MultipartBody extends RequestBody {

  private static final byte[] CRLF = {'\r', '\n'};
  private static final byte[] DASHDASH = {'-', '-'};

  /** One field or file of the form. */
  public static final class Part {
    private final String name;
    @Nullable private final String filename;
    @Nullable private final String contentType;
    private final byte[] content;

    Part(String name, @Nullable String filename, @Nullable String contentType, byte[] content) {
      this.name = name;
      this.filename = filename;
      this.contentType = contentType;
      this.content = content;
    }

    public String getName() {
      return name;
    }

    @Nullable
    public String getFilename() {
      return filename;
    }

    @Nullable
    public String getContentType() {
      return contentType;
    }

    public boolean isFile() {
      return filename != null;
    }
  }

  private final String boundary;
  private final List<Part> parts;
  private final byte[] encoded;

  private MultipartBody(String boundary, List<Part> parts) {
    this.boundary = boundary;
    this.parts = Collections.unmodifiableList(new ArrayList<>(parts));
    this.encoded = encode(boundary, this.parts);
  }

  public static Builder builder() {
    return new Builder();
  }

  public String getBoundary() {
    return boundary;
  }

  public List<Part> getParts() {
    return parts;
  }

  @Override
  public String contentType() {
    return "multipart/form-data; boundary=" + boundary;
  }

  @Override
  public byte[] bytes() {
    return encoded;
  }

  private static byte[] encode(String boundary, List<Part> parts) {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    byte[] boundaryBytes = boundary.getBytes(StandardCharsets.US_ASCII);
    for (Part part : parts) {
      out.writeBytes(DASHDASH);
      out.writeBytes(boundaryBytes);
      out.writeBytes(CRLF);
      StringBuilder disposition =
          new StringBuilder("Content-Disposition: form-data; name=\"")
              .append(escape(part.name))
              .append('"');
      if (part.filename != null) {
        disposition.append("; filename=\"").append(escape(part.filename)).append('"');
      }
      out.writeBytes(disposition.toString().getBytes(StandardCharsets.UTF_8));
      out.writeBytes(CRLF);
      if (part.contentType != null) {
        out.writeBytes(("Content-Type: " + part.contentType).getBytes(StandardCharsets.UTF_8));
        out.writeBytes(CRLF);
      }
      out.writeBytes(CRLF);
      out.writeBytes(part.content);
      out.writeBytes(CRLF);
    }
    out.writeBytes(DASHDASH);
    out.writeBytes(boundaryBytes);
    out.writeBytes(DASHDASH);
    out.writeBytes(CRLF);
    return out.toByteArray();
  }

  // RFC 7578 section 2: quotes and line breaks in names are percent-encoded
  private static String escape(String value) {
    return value.replace("\"", "%22").replace("\r", "%0D").replace("\n", "%0A");
  }

  /** Collects fields and files in the order they are added. */
  public static final class Builder {
    private final List<Part> parts = new ArrayList<>();
    @Nullable private String boundary;

    private Builder() {}

    @CanIgnoreReturnValue
    public Builder addField(String name, String value) {
      parts.add(
          new Part(
              requireNonNull(name, "name cannot be null"),
              null,
              null,
              value.getBytes(StandardCharsets.UTF_8)));
      return this;
    }

    @CanIgnoreReturnValue
    public Builder addFile(
        String name, String filename, @Nullable String contentType, byte[] content) {
      parts.add(
          new Part(
              requireNonNull(name, "name cannot be null"),
              requireNonNull(filename, "filename cannot be null"),
              contentType != null ? contentType : OCTET_STREAM,
              content.clone()));
      return this;
    }

    /** Adds a file read from disk; the content type is guessed from the file name. */
    @CanIgnoreReturnValue
    public Builder addFile(String name, Path file) {
      try {
        return addFile(
            name,
            String.valueOf(file.getFileName()),
            Files.probeContentType(file),
            Files.readAllBytes(file));
      } catch (IOException e) {
        throw new UncheckedIOException("Could not read form file " + file, e);
      }
    }

    /** Fixes the boundary instead of generating a random one. */
    @CanIgnoreReturnValue
    public Builder withBoundary(String boundary) {
      if (boundary.isEmpty() || boundary.length() > 70) {
        throw new IllegalArgumentException("Multipart boundary must be 1 to 70 characters");
      }
      this.boundary = boundary;
      return this;
    }

    /**
     * Builds the body: a {@link MultipartBody} when at least one file was added, otherwise a
     * url-encoded form carrying the fields.
     */
    public RequestBody build() {
      boolean hasFiles = false;
      for (Part part : parts) {
        hasFiles |= part.isFile();
      }
      if (!hasFiles) {
        List<Map.Entry<String, String>> fields = new ArrayList<>();
        for (Part part : parts) {
          fields.add(Map.entry(part.name, new String(part.content, StandardCharsets.UTF_8)));
        }
        return RequestBody.form(fields);
      }
      String chosen =
          boundary != null
              ? boundary
              : "----ProxyRotorBoundary" + RandomStringUtils.secure().nextAlphanumeric(24);
      return new MultipartBody(chosen, parts);
    }
  }
}
